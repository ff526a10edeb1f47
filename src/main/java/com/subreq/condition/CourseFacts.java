package com.subreq.condition;

import com.subreq.code.CodeSet;
import com.subreq.code.Division;

/**
 * What a condition is evaluated against: one code set alternative of a course and
 * the course's division.
 *
 * @param codes    Code set from one crosswalk row of the course's designation
 * @param division Course division, null when the catalog number has no division
 */
public record CourseFacts(CodeSet codes, Division division) {

    public CourseFacts {
        codes = codes == null ? CodeSet.empty() : codes;
    }

    public static CourseFacts of(CodeSet codes) {
        return new CourseFacts(codes, null);
    }
}
