package com.subreq.batch;

import com.subreq.result.EligibilityResult;

import java.util.Set;

/**
 * Merged output of all requirement-year batches.
 *
 * @param results        Distinct results across batches
 * @param batches        Batches evaluated
 * @param rowsRead       Raw sub-requirement rows
 * @param criteriaRows   Criteria rows after explosion
 * @param filteredValues Column values dropped by the alphabet filter
 */
public record BatchRun(Set<EligibilityResult> results, int batches, int rowsRead, int criteriaRows,
                       int filteredValues) {
}
