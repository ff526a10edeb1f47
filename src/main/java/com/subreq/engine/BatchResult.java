package com.subreq.engine;

import com.subreq.result.EligibilityResult;

import java.util.Set;

/**
 * Output of evaluating one batch of sub-requirement rows.
 *
 * @param results        Distinct eligibility results
 * @param rowsRead       Raw sub-requirement rows in the batch
 * @param criteriaRows   Criteria rows after explosion
 * @param filteredValues Column values dropped as neither a condition code nor a division marker
 */
public record BatchResult(Set<EligibilityResult> results, int rowsRead, int criteriaRows, int filteredValues) {
}
