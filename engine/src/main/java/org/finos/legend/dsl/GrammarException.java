package org.finos.legend.dsl;

/**
 * The DSL is being used in a structurally invalid way.
 * Raised at construction time, before any parsing happens.
 */
public class GrammarException extends RuntimeException {

    public GrammarException(String message) {
        super(message);
    }

    public GrammarException(String message, Throwable cause) {
        super(message, cause);
    }
}
