package com.falkordb.problog.parse;

import java.util.List;

/**
 * One ground fact: {@code predicate(arg)} or {@code predicate(arg1, arg2)}.
 *
 * <p>Arguments are kept exactly as written in the source, quotes included;
 * quoting is resolved when the fact is emitted.</p>
 *
 * @param predicate the predicate name, never blank
 * @param args the arguments, one or two
 */
public record Fact(String predicate, List<String> args) {

    /** Smallest supported arity. */
    public static final int MIN_ARITY = 1;

    /** Largest supported arity. */
    public static final int MAX_ARITY = 2;

    /**
     * Validates and copies the components.
     *
     * @param predicate the predicate name
     * @param args the arguments
     */
    public Fact {
        if (predicate == null || predicate.isBlank()) {
            throw new IllegalArgumentException("Predicate must not be blank");
        }
        if (args == null || !isSupportedArity(args.size())) {
            throw new IllegalArgumentException(
                "Facts take one or two arguments, got "
                    + (args == null ? "none" : args.size()));
        }
        args = List.copyOf(args);
    }

    /**
     * Create a unary fact.
     *
     * @param predicate the predicate name
     * @param instance the single argument
     * @return the fact
     */
    public static Fact unary(final String predicate, final String instance) {
        return new Fact(predicate, List.of(instance));
    }

    /**
     * Create a binary fact.
     *
     * @param predicate the predicate name
     * @param subject the first argument
     * @param object the second argument
     * @return the fact
     */
    public static Fact binary(final String predicate, final String subject,
            final String object) {
        return new Fact(predicate, List.of(subject, object));
    }

    /**
     * Whether an argument count is accepted.
     *
     * @param count the argument count
     * @return true for one or two
     */
    public static boolean isSupportedArity(final int count) {
        return count >= MIN_ARITY && count <= MAX_ARITY;
    }

    /**
     * Number of arguments.
     *
     * @return 1 or 2
     */
    public int arity() {
        return args.size();
    }

    /**
     * Whether this fact labels a single instance.
     *
     * @return true for one argument
     */
    public boolean isUnary() {
        return args.size() == 1;
    }

    /**
     * Whether this fact relates two instances.
     *
     * @return true for two arguments
     */
    public boolean isBinary() {
        return args.size() == 2;
    }

    @Override
    public String toString() {
        return predicate + "(" + String.join(", ", args) + ").";
    }
}
