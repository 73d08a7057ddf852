package com.falkordb.problog.parse;

import java.util.List;
import java.util.Optional;

/**
 * Validates one raw fact fragment and turns it into a {@link Fact}.
 */
public final class FactParser {

    private FactParser() {
        throw new AssertionError("No instances");
    }

    /**
     * Parse a fragment produced by {@link FactSplitter}.
     *
     * @param raw the raw fragment
     * @return the fact, or empty when the fragment holds nothing but a
     *     terminator or whitespace
     * @throws FactFormatException if the fragment has no terminating
     *     {@code .}, no {@code (}, does not end with {@code )}, or has a
     *     blank predicate name
     * @throws FactArityException if the fact has neither one nor two
     *     arguments
     */
    public static Optional<Fact> parse(final String raw)
            throws FactSyntaxException {
        String text = raw == null ? "" : raw.strip();
        if (text.isEmpty()) {
            return Optional.empty();
        }
        if (text.charAt(text.length() - 1) != FactSplitter.TERMINATOR) {
            throw new FactFormatException(
                "Fact missing terminating '.'", text);
        }

        String body = text.substring(0, text.length() - 1).strip();
        if (body.isEmpty()) {
            return Optional.empty();
        }
        int open = body.indexOf('(');
        if (open < 0 || !body.endsWith(")")) {
            throw new FactFormatException("Invalid fact format", body);
        }

        String predicate = body.substring(0, open).strip();
        if (predicate.isEmpty()) {
            throw new FactFormatException("Fact has no predicate name", body);
        }
        String interior = body.substring(open + 1, body.length() - 1);
        List<String> args = ArgumentSplitter.split(interior);
        if (!Fact.isSupportedArity(args.size())) {
            throw new FactArityException(predicate, args.size(), body);
        }
        return Optional.of(new Fact(predicate, args));
    }
}
