package com.subreq.requirement;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for RequirementTerm.
 */
class RequirementTermTest {

    @ParameterizedTest
    @DisplayName("Year and term become a term code")
    @CsvSource({
            "'2019 7', 2197",
            "'2020 1', 2201",
            "'2019  4', 2194",
            "20197, 2197"
    })
    void toTermCode(String value, String expected) {
        assertEquals(expected, RequirementTerm.toTermCode(value));
    }

    @Test
    @DisplayName("Null and blank values are passed through")
    void blank() {
        assertNull(RequirementTerm.toTermCode(null));
        assertEquals("", RequirementTerm.toTermCode(""));
    }
}
