package com.subreq.course;

import java.util.regex.Pattern;

/**
 * Course pattern of a sub-requirement entry.
 * <p>
 * Two forms are used in the audit tables:
 * <ul>
 *   <li>implicit, subject only ("MAT"): any three-character catalog number of that subject;</li>
 *   <li>explicit ("MAT 3**", "ENG 101"): each {@code *} matches exactly one character.</li>
 * </ul>
 * A blank pattern matches no course. Matching is case-sensitive and runs against
 * the trimmed course name.
 */
public final class CoursePattern {

    private static final int SUBJECT_LENGTH = 3;
    private static final char WILDCARD = '*';

    private static final CoursePattern NONE = new CoursePattern("", null);

    private final String source;
    private final Pattern regex;

    private CoursePattern(String source, Pattern regex) {
        this.source = source;
        this.regex = regex;
    }

    public static CoursePattern compile(String pattern) {
        if (pattern == null || pattern.isBlank()) {
            return NONE;
        }
        String trimmed = pattern.trim();
        if (trimmed.length() == SUBJECT_LENGTH) {
            return new CoursePattern(trimmed, Pattern.compile(Pattern.quote(trimmed) + " ..."));
        }

        StringBuilder regex = new StringBuilder();
        StringBuilder literal = new StringBuilder();
        for (char c : trimmed.toCharArray()) {
            if (c == WILDCARD) {
                if (literal.length() > 0) {
                    regex.append(Pattern.quote(literal.toString()));
                    literal.setLength(0);
                }
                regex.append('.');
            } else {
                literal.append(c);
            }
        }
        if (literal.length() > 0) {
            regex.append(Pattern.quote(literal.toString()));
        }
        return new CoursePattern(trimmed, Pattern.compile(regex.toString()));
    }

    public boolean matches(String fullCourse) {
        return regex != null && fullCourse != null && regex.matcher(fullCourse.trim()).matches();
    }

    public boolean isBlank() {
        return regex == null;
    }

    @Override
    public String toString() {
        return regex == null ? "NONE" : source;
    }
}
