package com.subreq.course;

import com.subreq.code.Division;

import java.util.Comparator;
import java.util.Optional;

/**
 * A course offering from the course catalog.
 *
 * @param crseId       Course id, the catalog key
 * @param fullCourse   Subject and catalog number, e.g. "ENG 101"
 * @param designation  Requirement designation, e.g. "GE11"; may be null
 * @param unitsMinimum Minimum credit hours
 * @param unitsMaximum Maximum credit hours
 */
public record OfferedCourse(
        String crseId,
        String fullCourse,
        String designation,
        String unitsMinimum,
        String unitsMaximum
) {

    public static final Comparator<OfferedCourse> ORDER = Comparator
            .comparing(OfferedCourse::fullCourse, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(OfferedCourse::crseId, Comparator.nullsFirst(Comparator.naturalOrder()));

    public OfferedCourse {
        fullCourse = fullCourse == null ? "" : fullCourse.trim();
    }

    public String subject() {
        int space = fullCourse.indexOf(' ');
        return space < 0 ? fullCourse : fullCourse.substring(0, space);
    }

    public String catalogNumber() {
        int space = fullCourse.lastIndexOf(' ');
        return space < 0 ? "" : fullCourse.substring(space + 1);
    }

    /**
     * Division derived from the catalog number, empty for levels outside 100-799.
     */
    public Optional<Division> division() {
        return Division.ofCatalogNumber(catalogNumber());
    }
}
