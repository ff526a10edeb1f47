package com.subreq.crosswalk;

/**
 * Raw crosswalk entry as published: a designation and its legacy expression.
 *
 * @param designation Requirement designation
 * @param expression  Legacy eligibility expression, e.g. "HUAD OR (HU or SB) &amp; C &amp; H"
 */
public record CrosswalkSourceRow(String designation, String expression) {
}
