package com.subreq.requirement;

/**
 * Converts requirement year/term values into term ("strm") codes.
 * <p>
 * Spaces are removed, then the century digit is dropped: "2019 7" becomes "2197".
 */
public final class RequirementTerm {

    private RequirementTerm() {
    }

    /**
     * @param value Requirement year/term, may be null or blank
     * @return Term code, or the value unchanged when it is null or blank
     */
    public static String toTermCode(String value) {
        if (value == null || value.isBlank()) {
            return value;
        }
        String compact = value.replace(" ", "");
        if (compact.length() < 2) {
            return compact;
        }
        return compact.charAt(0) + compact.substring(2);
    }
}
