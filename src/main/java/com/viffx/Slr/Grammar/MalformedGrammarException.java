package com.viffx.Slr.Grammar;

/**
 * Thrown when a grammar definition cannot be turned into a {@link Grammar}: a non-terminal is used
 * but never defined, no start symbol is set, or the grammar text itself is invalid.
 */
public class MalformedGrammarException extends IllegalArgumentException {
    public MalformedGrammarException(String message) {
        super(message);
    }

    public MalformedGrammarException(String message, Throwable cause) {
        super(message, cause);
    }
}
