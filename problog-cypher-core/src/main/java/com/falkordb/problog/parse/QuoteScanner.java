package com.falkordb.problog.parse;

/**
 * Character-at-a-time scanner that tracks quoting and backslash escapes.
 *
 * <p>Used by {@link FactSplitter} and {@link ArgumentSplitter} to decide
 * which characters are structural (delimiters, parentheses) and which are
 * plain content. A scanner instance holds the state of one scan and must
 * not be shared between scans.</p>
 *
 * <p>Transitions:</p>
 * <ul>
 *   <li>{@code NORMAL} + {@code '} or {@code "} moves to {@code IN_QUOTE}
 *       with that character as the active quote</li>
 *   <li>{@code IN_QUOTE} + the active quote returns to {@code NORMAL};
 *       the other quote character is plain content</li>
 *   <li>{@code NORMAL} or {@code IN_QUOTE} + {@code \} moves to
 *       {@code ESCAPED}, remembering the state to resume</li>
 *   <li>{@code ESCAPED} + any character resumes the remembered state</li>
 * </ul>
 */
final class QuoteScanner {

    /** Scanner states. */
    enum State {
        /** Outside any quoted literal. */
        NORMAL,
        /** Inside a literal opened by the active quote character. */
        IN_QUOTE,
        /** The previous character was a backslash. */
        ESCAPED
    }

    /** Escape character. */
    static final char BACKSLASH = '\\';

    /** Current state. */
    private State state = State.NORMAL;

    /** State to return to once an escaped character is consumed. */
    private State resumeState = State.NORMAL;

    /** Quote character that opened the current literal, or 0. */
    private char activeQuote;

    /**
     * Consume one character.
     *
     * @param ch the next character of the input
     * @return true if the character is structural: outside any quote, not
     *     escaped, and neither a quote nor a backslash itself
     */
    boolean accept(final char ch) {
        switch (state) {
            case ESCAPED:
                state = resumeState;
                return false;
            case IN_QUOTE:
                if (ch == BACKSLASH) {
                    escape();
                } else if (ch == activeQuote) {
                    state = State.NORMAL;
                    activeQuote = 0;
                }
                return false;
            case NORMAL:
            default:
                if (ch == BACKSLASH) {
                    escape();
                    return false;
                }
                if (isQuote(ch)) {
                    state = State.IN_QUOTE;
                    activeQuote = ch;
                    return false;
                }
                return true;
        }
    }

    /**
     * Current state, for tests and diagnostics.
     *
     * @return the scanner state
     */
    State state() {
        return state;
    }

    /**
     * Quote character of the literal being scanned.
     *
     * @return the active quote, or 0 outside a literal
     */
    char activeQuote() {
        return activeQuote;
    }

    private void escape() {
        resumeState = state;
        state = State.ESCAPED;
    }

    /**
     * Whether a character opens or closes a quoted literal.
     *
     * @param ch the character
     * @return true for a straight single or double quote
     */
    static boolean isQuote(final char ch) {
        return ch == '\'' || ch == '"';
    }
}
