package com.subreq.requirement;

import com.subreq.code.Division;

/**
 * Canonical matching criteria derived from one sub-requirement row.
 *
 * @param details        Descriptive columns with term codes converted
 * @param codes          Accept and reject code criteria
 * @param acceptDivision Division a course must be in, null when unrestricted
 * @param rejectDivision Division that rejects a course, null when unrestricted
 */
public record SubRequirementCriteria(
        SubRequirementDetails details,
        CriteriaCodes codes,
        Division acceptDivision,
        Division rejectDivision
) {

    public SubRequirementKey key() {
        return details.key();
    }
}
