package com.subreq.code;

import java.util.Optional;

/**
 * Upper/lower division marker carried by sub-requirement criteria and derived
 * from a course's catalog number.
 */
public enum Division {
    UPPER('U'),
    LOWER('L');

    private final char marker;

    Division(char marker) {
        this.marker = marker;
    }

    public char marker() {
        return marker;
    }

    /**
     * Resolve the marker accumulated from several criteria fields.
     * An upper marker wins over a lower one.
     *
     * @param markers Concatenated marker characters, may be null
     * @return Division, or empty if no marker is present
     */
    public static Optional<Division> fromMarkers(String markers) {
        if (markers == null || markers.isEmpty()) {
            return Optional.empty();
        }
        if (markers.indexOf(UPPER.marker) >= 0) {
            return Optional.of(UPPER);
        }
        if (markers.indexOf(LOWER.marker) >= 0) {
            return Optional.of(LOWER);
        }
        return Optional.empty();
    }

    /**
     * Check whether a whole field value is a division marker.
     */
    public static boolean isMarker(String value) {
        return value != null && value.length() == 1
                && (value.charAt(0) == UPPER.marker || value.charAt(0) == LOWER.marker);
    }

    /**
     * Derive a course's division from its catalog number.
     * 100/200 level courses are lower division, 300 through 700 level upper division.
     *
     * @param catalogNumber Catalog number such as "101" or "494"
     * @return Division, or empty for any other level
     */
    public static Optional<Division> ofCatalogNumber(String catalogNumber) {
        if (catalogNumber == null || catalogNumber.isBlank()) {
            return Optional.empty();
        }
        char level = catalogNumber.trim().charAt(0);
        if (level == '1' || level == '2') {
            return Optional.of(LOWER);
        }
        if (level >= '3' && level <= '7') {
            return Optional.of(UPPER);
        }
        return Optional.empty();
    }
}
