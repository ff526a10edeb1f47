package com.subreq.crosswalk;

import java.util.List;

/**
 * Counters collected while building a crosswalk.
 *
 * @param sourceRows          Source rows read
 * @param rows                Crosswalk rows produced, including the sentinel row
 * @param unknownTokens       Tokens dropped as neither a legacy code nor a condition code
 * @param malformedExpressions Source rows dropped because their expression had an unsupported shape
 */
public record CrosswalkReport(int sourceRows, int rows, int unknownTokens, List<String> malformedExpressions) {

    public int malformedCount() {
        return malformedExpressions.size();
    }
}
