package com.falkordb.problog.parse;

/**
 * Thrown when a fact has neither one nor two arguments.
 */
public final class FactArityException extends FactSyntaxException {

    private static final long serialVersionUID = 1L;

    /** Predicate of the rejected fact. */
    private final String predicate;

    /** Number of arguments found. */
    private final int argumentCount;

    /**
     * Constructs a new FactArityException.
     *
     * @param predicate the predicate name
     * @param argumentCount the number of arguments found
     * @param fragment the fact text, for the message
     */
    public FactArityException(final String predicate,
            final int argumentCount, final String fragment) {
        super("Only unary or binary predicates supported, '" + predicate
            + "' has " + argumentCount + " argument(s) -> " + fragment);
        this.predicate = predicate;
        this.argumentCount = argumentCount;
    }

    /**
     * Predicate of the rejected fact.
     *
     * @return the predicate name
     */
    public String getPredicate() {
        return predicate;
    }

    /**
     * Number of arguments the fact had.
     *
     * @return the argument count
     */
    public int getArgumentCount() {
        return argumentCount;
    }
}
