package com.subreq.course;

import com.subreq.code.Division;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for OfferedCourse.
 */
class OfferedCourseTest {

    @Test
    @DisplayName("Subject, catalog number and division come from the full course")
    void parts() {
        OfferedCourse course = new OfferedCourse("000123", " ENG 394 ", "GE11", "3", "3");

        assertEquals("ENG 394", course.fullCourse());
        assertEquals("ENG", course.subject());
        assertEquals("394", course.catalogNumber());
        assertEquals(Optional.of(Division.UPPER), course.division());
    }

    @Test
    @DisplayName("Missing full course has no division")
    void missingFullCourse() {
        OfferedCourse course = new OfferedCourse("1", null, null, null, null);

        assertEquals("", course.fullCourse());
        assertTrue(course.division().isEmpty());
    }
}
