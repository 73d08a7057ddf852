package com.falkordb.problog.parse;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for FactSplitter.
 */
public class FactSplitterTest {

    @Test
    @DisplayName("Facts on one line are split at each terminator")
    public void testSplitsAtTerminators() {
        assertEquals(List.of("p(a).", "r(a,b)."),
            FactSplitter.split("p(a). r(a,b)."));
    }

    @Test
    @DisplayName("Fragments are trimmed across lines")
    public void testTrimsFragments() {
        assertEquals(List.of("p(a).", "q(b)."),
            FactSplitter.split("  p(a)  .\n\n  q(b).\n"));
    }

    @Test
    @DisplayName("Dot inside quotes does not terminate a fact")
    public void testDotInsideQuotes() {
        assertEquals(List.of("site('example.org')."),
            FactSplitter.split("site('example.org')."));
        assertEquals(List.of("site(\"a.b\")."),
            FactSplitter.split("site(\"a.b\")."));
    }

    @Test
    @DisplayName("Dot inside parentheses does not terminate a fact")
    public void testDotInsideParentheses() {
        assertEquals(List.of("weight(x, 1.5)."),
            FactSplitter.split("weight(x, 1.5)."));
    }

    @Test
    @DisplayName("Escaped dot does not terminate a fact")
    public void testEscapedDot() {
        assertEquals(List.of("p(a\\.b)."), FactSplitter.split("p(a\\.b)."));
        assertEquals(List.of("a\\.b."), FactSplitter.split("a\\.b."));
    }

    @Test
    @DisplayName("Unbalanced closing parenthesis does not go below zero depth")
    public void testDepthFloor() {
        assertEquals(List.of("p(a)).", "q(b)."),
            FactSplitter.split("p(a)). q(b)."));
    }

    @Test
    @DisplayName("Trailing text without terminator is kept as a fragment")
    public void testTrailingFragment() {
        assertEquals(List.of("p(a).", "q(b)"),
            FactSplitter.split("p(a). q(b)"));
    }

    @Test
    @DisplayName("Stray terminators produce no empty fragments")
    public void testStrayTerminators() {
        assertEquals(List.of("p(a)."), FactSplitter.split(". p(a). ."));
    }

    @Test
    @DisplayName("Empty input gives no fragments")
    public void testEmptyInput() {
        assertTrue(FactSplitter.split("").isEmpty());
        assertTrue(FactSplitter.split("   \n ").isEmpty());
        assertTrue(FactSplitter.split(null).isEmpty());
    }
}
