package com.subreq.course;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for CoursePattern.
 */
class CoursePatternTest {

    @ParameterizedTest
    @DisplayName("Course pattern matching")
    @CsvSource({
            "ENG, ENG 101, true",
            "ENG, ENG 1010, false",
            "ENG, ENGL 101, false",
            "ENG 1**, ENG 101, true",
            "ENG 1**, ENG 201, false",
            "ENG 1**, ENG 10, false",
            "MAT 3**, MAT 370, true",
            "HST 101, HST 101, true",
            "HST 101, HST 102, false",
            "*** 1**, ABC 123, true"
    })
    void matches(String pattern, String course, boolean expected) {
        assertEquals(expected, CoursePattern.compile(pattern).matches(course));
    }

    @Test
    @DisplayName("Course names are trimmed before matching")
    void trimsCourse() {
        assertTrue(CoursePattern.compile("ENG 101").matches("  ENG 101 "));
    }

    @Test
    @DisplayName("Blank pattern matches no course")
    void blankPattern() {
        CoursePattern pattern = CoursePattern.compile("  ");

        assertTrue(pattern.isBlank());
        assertFalse(pattern.matches("ANY 999"));
        assertFalse(pattern.matches(""));
        assertFalse(CoursePattern.compile(null).matches("ENG 101"));
        assertFalse(CoursePattern.compile("").matches("ENG 101"));
    }

    @Test
    @DisplayName("Regex metacharacters in patterns are literal")
    void literalMetacharacters() {
        assertFalse(CoursePattern.compile("EN. 101").matches("ENG 101"));
        assertTrue(CoursePattern.compile("EN. 101").matches("EN. 101"));
    }
}
