package com.subreq.crosswalk;

import com.subreq.code.CodeSet;

/**
 * One concrete AND-combination of condition codes for a designation.
 * Several rows may share a designation; each is an OR alternative.
 *
 * @param designation Requirement designation, e.g. "GE11"
 * @param codes       Codes a course with this designation carries
 */
public record CrosswalkRow(String designation, CodeSet codes) {
}
