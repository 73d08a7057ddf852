package com.falkordb.problog.cypher;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for CypherEscaper.
 */
public class CypherEscaperTest {

    @Test
    @DisplayName("Plain value is wrapped in single quotes")
    public void testPlainLiteral() {
        assertEquals("'alice'", CypherEscaper.escapeLiteral("alice"));
        assertEquals("'alice'", CypherEscaper.escapeLiteral("  alice "));
    }

    @Test
    @DisplayName("One layer of matching outer quotes is removed")
    public void testOuterQuotesStripped() {
        assertEquals("'a,b'", CypherEscaper.escapeLiteral("'a,b'"));
        assertEquals("'New York'", CypherEscaper.escapeLiteral("\"New York\""));
        assertEquals("'\\'x\\''", CypherEscaper.escapeLiteral("\"'x'\""));
    }

    @Test
    @DisplayName("Mismatched outer quotes are kept and escaped")
    public void testMismatchedQuotesKept() {
        assertEquals("'\\'a\"'", CypherEscaper.escapeLiteral("'a\""));
    }

    @Test
    @DisplayName("Single quotes and backslashes are backslash-escaped")
    public void testEscaping() {
        assertEquals("'O\\'Brien'", CypherEscaper.escapeLiteral("O'Brien"));
        assertEquals("'C:\\\\tmp'", CypherEscaper.escapeLiteral("C:\\tmp"));
        assertEquals("'it\\\\\\'s'", CypherEscaper.escapeLiteral("'it\\'s'"));
    }

    @Test
    @DisplayName("Lone quote character becomes an empty literal")
    public void testLoneQuote() {
        assertEquals("''", CypherEscaper.escapeLiteral("'"));
        assertEquals("''", CypherEscaper.escapeLiteral("''"));
    }

    @Test
    @DisplayName("Identifier is wrapped in backticks")
    public void testIdentifier() {
        assertEquals("`person`", CypherEscaper.escapeIdentifier(" person "));
    }

    @Test
    @DisplayName("Backticks in identifiers are doubled")
    public void testIdentifierBacktick() {
        assertEquals("`p``x`", CypherEscaper.escapeIdentifier("p`x"));
        assertEquals("``````", CypherEscaper.escapeIdentifier("``"));
    }
}
