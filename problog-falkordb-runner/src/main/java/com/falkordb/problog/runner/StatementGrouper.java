package com.falkordb.problog.runner;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Groups converter output lines into executable Cypher statements.
 *
 * <p>Each output line is one clause. A {@code SET n:...} line only makes
 * sense after the {@code MERGE (n:...)} that binds {@code n}, and a
 * relationship {@code MERGE (s)-[...]->(o)} after the two node merges.
 * A line that declares a node variable ({@code MERGE (v:...)}) starts a new
 * statement when the current statement already binds {@code v} or already
 * holds a clause that uses its variables. With converter output this yields
 * one statement per label block and one per relationship triple.</p>
 *
 * <p>A quoted literal or backtick identifier may span several lines. Such
 * continuation lines are kept verbatim and attached to the clause that
 * opened the literal.</p>
 */
public final class StatementGrouper {

    /** Prefix of a clause that may declare a node variable. */
    private static final String MERGE_NODE = "MERGE (";

    private StatementGrouper() {
        throw new AssertionError("No instances");
    }

    /**
     * Group a script into statements.
     *
     * @param script converter output, one clause per line
     * @return statements in script order, clauses joined by newlines
     */
    public static List<String> group(final String script) {
        List<String> statements = new ArrayList<>();
        if (script == null || script.isBlank()) {
            return statements;
        }

        List<String> current = new ArrayList<>();
        Set<String> bound = new HashSet<>();
        boolean used = false;
        LiteralTracker literal = new LiteralTracker();

        for (String raw : script.split("\n", -1)) {
            if (literal.isOpen()) {
                int last = current.size() - 1;
                literal.scan(raw);
                String tail = literal.isOpen() ? raw : raw.stripTrailing();
                current.set(last, current.get(last) + "\n" + tail);
                continue;
            }
            String line = raw.stripLeading();
            literal.scan(line);
            if (!literal.isOpen()) {
                line = line.stripTrailing();
            }
            if (line.isEmpty()) {
                continue;
            }
            String declared = declaredVariable(line);
            if (declared != null) {
                if (!current.isEmpty() && (used || bound.contains(declared))) {
                    statements.add(String.join("\n", current));
                    current.clear();
                    bound.clear();
                    used = false;
                }
                bound.add(declared);
            } else {
                used = true;
            }
            current.add(line);
        }
        if (!current.isEmpty()) {
            statements.add(String.join("\n", current));
        }
        return statements;
    }

    /**
     * Variable declared by a {@code MERGE (v:Label ...)} clause.
     *
     * @param line one clause
     * @return the variable name, or null if the clause declares none
     */
    static String declaredVariable(final String line) {
        if (!line.startsWith(MERGE_NODE)) {
            return null;
        }
        int start = MERGE_NODE.length();
        int end = start;
        while (end < line.length()
                && Character.isJavaIdentifierPart(line.charAt(end))) {
            end++;
        }
        if (end == start || end >= line.length() || line.charAt(end) != ':') {
            return null;
        }
        return line.substring(start, end);
    }

    /**
     * Tracks whether a {@code '...'} literal or {@code `...`} identifier is
     * still open at the end of a line. Inside a literal a backslash escapes
     * the next character; inside an identifier a doubled backtick closes and
     * reopens it, which leaves the state unchanged.
     */
    static final class LiteralTracker {

        /** Open delimiter, or 0 outside any literal. */
        private char open;

        /** Whether the previous character was an unconsumed backslash. */
        private boolean escaped;

        boolean isOpen() {
            return open != 0;
        }

        void scan(final String line) {
            for (int i = 0; i < line.length(); i++) {
                char c = line.charAt(i);
                if (escaped) {
                    escaped = false;
                } else if (open == '\'' && c == '\\') {
                    escaped = true;
                } else if (open == 0 && (c == '\'' || c == '`')) {
                    open = c;
                } else if (c == open) {
                    open = 0;
                }
            }
            // a pending escape applies to the line break itself
            escaped = false;
        }
    }
}
