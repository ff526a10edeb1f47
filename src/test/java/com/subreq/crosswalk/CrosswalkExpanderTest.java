package com.subreq.crosswalk;

import com.subreq.code.CodeSet;
import com.subreq.exception.MalformedExpressionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for CrosswalkExpander.
 */
class CrosswalkExpanderTest {

    // ===== Supported shapes =====

    @Test
    @DisplayName("OR in the first AND-group expands into one row per alternative")
    void expandsFirstGroupAlternatives() {
        CrosswalkExpander.Expansion expansion = expand("(H or S) & c & h");

        assertEquals(List.of(CodeSet.parse("Hch"), CodeSet.parse("Sch")), expansion.codeSets());
        assertEquals(0, expansion.unknownTokens());
    }

    @Test
    @DisplayName("Single code expands to a single row")
    void singleCode() {
        assertEquals(List.of(CodeSet.parse("¿")), expand("¿").codeSets());
    }

    @Test
    @DisplayName("Top-level OR between AND-groups yields one row per side")
    void topLevelOr() {
        CrosswalkExpander.Expansion expansion = expand("v&Q or c&h");

        assertEquals(List.of(CodeSet.parse("vQ"), CodeSet.parse("ch")), expansion.codeSets());
    }

    @Test
    @DisplayName("Four AND-groups are allowed")
    void fourGroups() {
        assertEquals(List.of(CodeSet.parse("Hchg")), expand("H & c & h & g").codeSets());
    }

    @Test
    @DisplayName("Adjacent symbols are separate codes")
    void adjacentSymbols() {
        assertEquals(List.of(CodeSet.parse("ch")), expand("ch").codeSets());
    }

    @Test
    @DisplayName("Empty expression yields the empty code set")
    void emptyExpression() {
        CrosswalkExpander.Expansion expansion = expand("");

        assertEquals(List.of(CodeSet.empty()), expansion.codeSets());
    }

    @Test
    @DisplayName("Duplicate alternatives collapse")
    void duplicatesCollapse() {
        assertEquals(List.of(CodeSet.parse("Hc")), expand("(H or H) & c").codeSets());
    }

    @Test
    @DisplayName("Unknown tokens are dropped and counted")
    void unknownTokens() {
        CrosswalkExpander.Expansion expansion = expand("H & 9 & XYZ");

        assertEquals(List.of(CodeSet.parse("H")), expansion.codeSets());
        assertEquals(2, expansion.unknownTokens());
    }

    // ===== Malformed shapes =====

    @ParameterizedTest
    @DisplayName("Unsupported shapes are rejected")
    @ValueSource(strings = {
            "H & c & h & g & v",
            "(H & c",
            "H & c)",
            "c & (H or S)",
            "H &",
            "& H",
            "or H",
            "H or",
            "()"
    })
    void malformed(String expression) {
        assertThrows(MalformedExpressionException.class, () -> expand(expression));
    }

    @Test
    @DisplayName("Malformed exception reports expression and position")
    void malformedDetails() {
        MalformedExpressionException e = assertThrows(MalformedExpressionException.class,
                () -> expand("H & c)"));

        assertEquals("H & c)", e.getExpression());
        assertEquals(5, e.getPosition());
    }

    private static CrosswalkExpander.Expansion expand(String text) {
        return CrosswalkExpander.expand(new NormalizedExpression(text));
    }
}
