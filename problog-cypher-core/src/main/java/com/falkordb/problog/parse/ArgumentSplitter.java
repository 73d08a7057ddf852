package com.falkordb.problog.parse;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits the text between a fact's outer parentheses into arguments.
 *
 * <p>Commas inside quoted literals or after a backslash do not split.
 * Arguments are trimmed and empty ones are dropped, so {@code a,,b} gives
 * two arguments.</p>
 */
public final class ArgumentSplitter {

    /** Argument separator. */
    public static final char SEPARATOR = ',';

    private ArgumentSplitter() {
        throw new AssertionError("No instances");
    }

    /**
     * Split an argument list.
     *
     * @param interior text between the outer parentheses
     * @return the non-empty, trimmed arguments in order
     */
    public static List<String> split(final String interior) {
        List<String> args = new ArrayList<>();
        if (interior == null || interior.isEmpty()) {
            return args;
        }

        QuoteScanner scanner = new QuoteScanner();
        StringBuilder current = new StringBuilder();

        for (int i = 0; i < interior.length(); i++) {
            char ch = interior.charAt(i);
            if (scanner.accept(ch) && ch == SEPARATOR) {
                addIfPresent(args, current);
                current.setLength(0);
            } else {
                current.append(ch);
            }
        }
        addIfPresent(args, current);
        return args;
    }

    private static void addIfPresent(final List<String> args,
            final CharSequence segment) {
        String arg = segment.toString().strip();
        if (!arg.isEmpty()) {
            args.add(arg);
        }
    }
}
