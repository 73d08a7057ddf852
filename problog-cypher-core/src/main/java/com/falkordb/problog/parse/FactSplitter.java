package com.falkordb.problog.parse;

import java.util.ArrayList;
import java.util.List;

/**
 * Partitions comment-free source text into raw fact fragments.
 *
 * <p>A {@code .} ends a fact only when it is outside quotes and outside
 * parentheses, so {@code p('a.b').} and {@code p(f(1.5)).} each yield a
 * single fragment. Emitted fragments are trimmed and carry exactly one
 * trailing {@code .}. Text left after the last terminator is emitted as is,
 * without a terminator, for {@link FactParser} to reject.</p>
 */
public final class FactSplitter {

    /** Fact terminator. */
    public static final char TERMINATOR = '.';

    private FactSplitter() {
        throw new AssertionError("No instances");
    }

    /**
     * Split text into raw fact fragments in source order.
     *
     * @param text comment-free source text
     * @return the raw fragments, never null
     */
    public static List<String> split(final String text) {
        List<String> fragments = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return fragments;
        }

        QuoteScanner scanner = new QuoteScanner();
        StringBuilder current = new StringBuilder();
        int depth = 0;

        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (scanner.accept(ch)) {
                if (ch == '(') {
                    depth++;
                } else if (ch == ')') {
                    depth = Math.max(depth - 1, 0);
                } else if (ch == TERMINATOR && depth == 0) {
                    String fact = current.toString().strip();
                    if (!fact.isEmpty()) {
                        fragments.add(fact + TERMINATOR);
                    }
                    current.setLength(0);
                    continue;
                }
            }
            current.append(ch);
        }

        String trailing = current.toString().strip();
        if (!trailing.isEmpty()) {
            fragments.add(trailing);
        }
        return fragments;
    }
}
