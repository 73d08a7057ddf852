package com.falkordb.problog.parse;

/**
 * Removes {@code %} comments from fact source text.
 *
 * <p>Each line is cut at the first {@code %}. The cut is not quote-aware:
 * a {@code %} inside a quoted literal also ends the line.</p>
 */
public final class CommentStripper {

    /** Comment marker. */
    public static final char COMMENT_MARKER = '%';

    private CommentStripper() {
        throw new AssertionError("No instances");
    }

    /**
     * Strip trailing comments from every line.
     *
     * @param text source text
     * @return the text with comments removed, lines joined by {@code \n}
     */
    public static String strip(final String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder(text.length());
        boolean first = true;
        for (String line : text.lines().toList()) {
            if (!first) {
                sb.append('\n');
            }
            first = false;
            int marker = line.indexOf(COMMENT_MARKER);
            sb.append(marker >= 0 ? line.substring(0, marker) : line);
        }
        return sb.toString();
    }
}
