package org.finos.legend.dsl;

/**
 * A backend recognizes a node shape but cannot encode it.
 */
public class UnsupportedException extends RuntimeException {

    public UnsupportedException(String message) {
        super(message);
    }

    public UnsupportedException(String message, Throwable cause) {
        super(message, cause);
    }
}
