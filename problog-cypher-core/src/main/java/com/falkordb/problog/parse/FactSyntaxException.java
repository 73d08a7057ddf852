package com.falkordb.problog.parse;

/**
 * Base class for input errors found while parsing facts.
 *
 * <p>The only subclasses are {@link FactFormatException} and
 * {@link FactArityException}. Both are deterministic: the same input always
 * fails the same way, so callers should report rather than retry.</p>
 */
public abstract class FactSyntaxException extends Exception {

    private static final long serialVersionUID = 1L;

    /**
     * Constructs a new FactSyntaxException.
     *
     * @param message the detail message
     */
    FactSyntaxException(final String message) {
        super(message);
    }
}
