package com.subreq.code;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the condition code alphabet.
 */
class ConditionCodeTest {

    @Test
    @DisplayName("Alphabet has 13 maroon and 9 gold codes with distinct symbols")
    void alphabetShape() {
        Set<Character> symbols = new HashSet<>();
        int maroon = 0;
        int gold = 0;
        for (ConditionCode code : ConditionCode.values()) {
            assertTrue(symbols.add(code.symbol()), "Duplicate symbol " + code.symbol());
            if (code.group() == CodeGroup.MAROON) maroon++;
            else gold++;
        }
        assertEquals(13, maroon);
        assertEquals(9, gold);
    }

    @ParameterizedTest
    @DisplayName("Single code symbols resolve")
    @ValueSource(strings = {"G", "H", "Q", "S", "c", "g", "h", "t", "v", "w", "x", "y", "z",
            "¿", "Ñ", "ß", "£", "Æ", "ÿ", "«", "ñ", "ù"})
    void resolvesSymbols(String value) {
        assertTrue(ConditionCode.fromValue(value).isPresent());
    }

    @ParameterizedTest
    @DisplayName("Non-code values do not resolve")
    @ValueSource(strings = {"", "U", "L", "3.0", "Hc", "A", "-", "HU"})
    void rejectsNonCodes(String value) {
        assertTrue(ConditionCode.fromValue(value).isEmpty());
    }

    @Test
    @DisplayName("Null value does not resolve")
    void nullValue() {
        assertTrue(ConditionCode.fromValue(null).isEmpty());
    }
}
