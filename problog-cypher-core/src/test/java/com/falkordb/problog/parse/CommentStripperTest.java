package com.falkordb.problog.parse;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for CommentStripper.
 */
public class CommentStripperTest {

    @Test
    @DisplayName("Full comment line becomes empty")
    public void testFullLineComment() {
        assertEquals("\np(a).", CommentStripper.strip("% note\np(a)."));
    }

    @Test
    @DisplayName("Trailing comment is cut at the marker")
    public void testTrailingComment() {
        assertEquals("p(a). ", CommentStripper.strip("p(a). % person"));
    }

    @Test
    @DisplayName("Marker inside a quoted literal still truncates the line")
    public void testMarkerInsideQuotesTruncates() {
        assertEquals("rate(x, '50", CommentStripper.strip("rate(x, '50%')."));
    }

    @Test
    @DisplayName("Lines without comments are unchanged")
    public void testNoComments() {
        assertEquals("p(a).\nq(b).", CommentStripper.strip("p(a).\nq(b)."));
    }

    @Test
    @DisplayName("Windows line endings are normalised to newlines")
    public void testCrLf() {
        assertEquals("p(a).\nq(b).", CommentStripper.strip("p(a).\r\nq(b)."));
    }

    @Test
    @DisplayName("Null and empty input give empty text")
    public void testNullAndEmpty() {
        assertEquals("", CommentStripper.strip(null));
        assertEquals("", CommentStripper.strip(""));
    }
}
