package com.subreq.engine;

import com.subreq.crosswalk.CrosswalkReport;

/**
 * Counters for a whole run, logged when the run completes.
 *
 * @param crosswalk      Crosswalk build counters
 * @param batches        Number of requirement-year batches evaluated
 * @param rowsRead       Raw sub-requirement rows
 * @param criteriaRows   Criteria rows after explosion
 * @param filteredValues Sub-requirement column values dropped by the alphabet filter
 * @param courses        Offered courses
 * @param results        Distinct eligibility results
 */
public record RunReport(
        CrosswalkReport crosswalk,
        int batches,
        int rowsRead,
        int criteriaRows,
        int filteredValues,
        int courses,
        int results
) {

    @Override
    public String toString() {
        return "RunReport{crosswalkRows=" + crosswalk.rows()
                + ", malformedExpressions=" + crosswalk.malformedCount()
                + ", unknownTokens=" + crosswalk.unknownTokens()
                + ", batches=" + batches
                + ", subRequirementRows=" + rowsRead
                + ", criteriaRows=" + criteriaRows
                + ", filteredValues=" + filteredValues
                + ", courses=" + courses
                + ", results=" + results + '}';
    }
}
