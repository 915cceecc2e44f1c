package org.finos.legend.dsl;

/**
 * A native value cannot be converted into the requested kind.
 */
public class CastException extends RuntimeException {

    public CastException(String message) {
        super(message);
    }

    public CastException(String message, Throwable cause) {
        super(message, cause);
    }
}
