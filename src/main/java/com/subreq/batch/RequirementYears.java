package com.subreq.batch;

import com.subreq.requirement.SubRequirementRaw;

/**
 * Batch key: the first and last active requirement year of a sub-requirement row.
 */
public record RequirementYears(String rqfyt, String lyt) {

    public static RequirementYears of(SubRequirementRaw row) {
        return new RequirementYears(row.details().rqfyt(), row.details().lyt());
    }

    @Override
    public String toString() {
        return "{rqfyt=" + rqfyt + ", lyt=" + lyt + "}";
    }
}
