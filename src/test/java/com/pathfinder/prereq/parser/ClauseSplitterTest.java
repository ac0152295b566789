package com.pathfinder.prereq.parser;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ClauseSplitterTest {
    @Test
    void neverSplitsInsideParentheses() {
        assertEquals(List.of("(CS 135, CS 145)", "MATH 135"),
                ClauseSplitter.splitOutsideParens("(CS 135, CS 145), MATH 135", ClauseSplitter.COMMA));
        assertEquals(List.of("(A; (B; C))", "D"),
                ClauseSplitter.splitOutsideParens("(A; (B; C)); D", ClauseSplitter.SEMICOLON));
    }

    @Test
    void wordSeparatorIsCaseInsensitive() {
        assertEquals(List.of("CS 136", "MATH 135"),
                ClauseSplitter.splitOutsideParens("CS 136 AND MATH 135", ClauseSplitter.AND_WORD));
    }

    @Test
    void unterminatedParenthesisKeepsTailTogether() {
        assertEquals(List.of("A", "(B; C; D"),
                ClauseSplitter.splitOutsideParens("A; (B; C; D", ClauseSplitter.SEMICOLON));
    }

    @Test
    void dropsEmptyPartsAndTrims() {
        List<String> parts = ClauseSplitter.splitOutsideParens(" A ;; B; ", ClauseSplitter.SEMICOLON);
        assertEquals(List.of("A", "B"), parts);
        assertEquals("A; B", String.join("; ", parts));
        assertTrue(ClauseSplitter.splitOutsideParens("", ClauseSplitter.COMMA).isEmpty());
    }

    @Test
    void findsOutermostSegments() {
        List<int[]> segments = ClauseSplitter.topLevelParenSegments("(a (b)) or (c)");
        assertEquals(2, segments.size());
        assertArrayEquals(new int[]{0, 7}, segments.get(0));
        assertArrayEquals(new int[]{11, 14}, segments.get(1));
    }
}
