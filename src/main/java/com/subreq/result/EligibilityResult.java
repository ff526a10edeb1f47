package com.subreq.result;

import com.subreq.course.OfferedCourse;
import com.subreq.requirement.SubRequirementDetails;
import com.subreq.requirement.SubRequirementKey;

import java.util.Comparator;

/**
 * A course that satisfies a sub-requirement.
 *
 * @param details Sub-requirement columns carried through
 * @param course  The satisfying course
 */
public record EligibilityResult(SubRequirementDetails details, OfferedCourse course) {

    public static final Comparator<EligibilityResult> ORDER = Comparator
            .comparing((EligibilityResult r) -> r.details().key())
            .thenComparing(EligibilityResult::course, OfferedCourse.ORDER);

    public SubRequirementKey key() {
        return details.key();
    }

    /**
     * Identity used to collapse duplicates: one row per course and sub-requirement.
     */
    public ResultKey resultKey() {
        return new ResultKey(details.key(), course.crseId(), course.fullCourse());
    }

    public record ResultKey(SubRequirementKey subRequirement, String crseId, String fullCourse) {
    }
}
