package com.falkordb.problog.parse;

import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for FactParser.
 */
public class FactParserTest {

    @Test
    @DisplayName("Unary fact parses to predicate and one argument")
    public void testUnaryFact() throws Exception {
        Optional<Fact> fact = FactParser.parse("person(alice).");
        assertTrue(fact.isPresent());
        assertEquals("person", fact.get().predicate());
        assertEquals(List.of("alice"), fact.get().args());
    }

    @Test
    @DisplayName("Binary fact keeps argument order and trims names")
    public void testBinaryFact() throws Exception {
        Fact fact = FactParser.parse(" knows ( alice , bob ) . ").orElseThrow();
        assertEquals("knows", fact.predicate());
        assertEquals(List.of("alice", "bob"), fact.args());
    }

    @Test
    @DisplayName("Quoted argument keeps its quotes")
    public void testQuotedArgumentKept() throws Exception {
        Fact fact = FactParser.parse("p('a,b').").orElseThrow();
        assertEquals(List.of("'a,b'"), fact.args());
    }

    @Test
    @DisplayName("Missing terminator is a format error")
    public void testMissingTerminator() {
        FactFormatException e = assertThrows(FactFormatException.class,
            () -> FactParser.parse("p(a)"));
        assertEquals("p(a)", e.getFragment());
        assertTrue(e.getMessage().contains("terminating '.'"));
    }

    @Test
    @DisplayName("Missing parentheses is a format error")
    public void testMissingParentheses() {
        FactFormatException e = assertThrows(FactFormatException.class,
            () -> FactParser.parse("raining."));
        assertEquals("raining", e.getFragment());
    }

    @Test
    @DisplayName("Text after the closing parenthesis is a format error")
    public void testTextAfterClosingParenthesis() {
        assertThrows(FactFormatException.class,
            () -> FactParser.parse("p(a) extra."));
    }

    @Test
    @DisplayName("Blank predicate name is a format error")
    public void testBlankPredicate() {
        assertThrows(FactFormatException.class,
            () -> FactParser.parse("(a)."));
    }

    @Test
    @DisplayName("Three arguments is an arity error")
    public void testTernaryFact() {
        FactArityException e = assertThrows(FactArityException.class,
            () -> FactParser.parse("p(a,b,c)."));
        assertEquals("p", e.getPredicate());
        assertEquals(3, e.getArgumentCount());
    }

    @Test
    @DisplayName("Empty argument list is an arity error")
    public void testNoArguments() {
        FactArityException e = assertThrows(FactArityException.class,
            () -> FactParser.parse("p()."));
        assertEquals(0, e.getArgumentCount());
    }

    @Test
    @DisplayName("Adjacent commas do not count as an argument")
    public void testEmptyFieldDropped() throws Exception {
        Fact fact = FactParser.parse("r(a,,b).").orElseThrow();
        assertEquals(List.of("a", "b"), fact.args());
    }

    @Test
    @DisplayName("Bare terminator and blank fragments are skipped")
    public void testEmptyFragmentsSkipped() throws Exception {
        assertTrue(FactParser.parse(".").isEmpty());
        assertTrue(FactParser.parse("  .  ").isEmpty());
        assertTrue(FactParser.parse("").isEmpty());
        assertTrue(FactParser.parse(null).isEmpty());
    }

    @Test
    @DisplayName("Both error kinds share the FactSyntaxException base")
    public void testErrorHierarchy() {
        assertThrows(FactSyntaxException.class, () -> FactParser.parse("p(a)"));
        assertThrows(FactSyntaxException.class,
            () -> FactParser.parse("p(a,b,c)."));
    }
}
