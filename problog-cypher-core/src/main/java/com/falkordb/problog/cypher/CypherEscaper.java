package com.falkordb.problog.cypher;

/**
 * Quoting helpers for values placed into generated Cypher.
 */
public final class CypherEscaper {

    private CypherEscaper() {
        throw new AssertionError("No instances");
    }

    /**
     * Render a fact argument as a single-quoted Cypher string literal.
     *
     * <p>The value is trimmed and one layer of matching outer quotes
     * ({@code '...'} or {@code "..."}) is removed. Backslashes and single
     * quotes are then backslash-escaped.</p>
     *
     * @param value the raw argument text
     * @return the literal, including its surrounding single quotes
     */
    public static String escapeLiteral(final String value) {
        String v = value == null ? "" : value.strip();
        if (!v.isEmpty() && isQuote(v.charAt(0))
                && v.charAt(v.length() - 1) == v.charAt(0)) {
            v = v.length() > 1 ? v.substring(1, v.length() - 1) : "";
        }
        String escaped = v.replace("\\", "\\\\").replace("'", "\\'");
        return "'" + escaped + "'";
    }

    /**
     * Render a predicate name as a backtick-quoted Cypher identifier.
     *
     * @param value the raw name
     * @return the identifier with backticks doubled and wrapped in backticks
     */
    public static String escapeIdentifier(final String value) {
        String v = value == null ? "" : value.strip();
        return "`" + v.replace("`", "``") + "`";
    }

    private static boolean isQuote(final char ch) {
        return ch == '\'' || ch == '"';
    }
}
