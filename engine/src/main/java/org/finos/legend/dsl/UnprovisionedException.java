package org.finos.legend.dsl;

/**
 * No backend symbol is available for a source or feature.
 */
public class UnprovisionedException extends RuntimeException {

    public UnprovisionedException(String message) {
        super(message);
    }

    public UnprovisionedException(String message, Throwable cause) {
        super(message, cause);
    }
}
