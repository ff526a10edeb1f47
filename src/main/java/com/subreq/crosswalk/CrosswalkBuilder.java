package com.subreq.crosswalk;

import com.subreq.code.CodeSet;
import com.subreq.exception.MalformedExpressionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the {@link Crosswalk} from the published designation table:
 * normalize legacy codes, split leading gold alternatives, expand AND/OR groups.
 * <p>
 * A malformed expression drops its source row and is reported; it never fails the build.
 */
public class CrosswalkBuilder {

    private static final Logger log = LoggerFactory.getLogger(CrosswalkBuilder.class);

    private final List<CrosswalkRow> rows = new ArrayList<>();
    private final List<String> malformed = new ArrayList<>();
    private int sourceRows;
    private int unknownTokens;

    /**
     * Build a crosswalk and its report in one call.
     */
    public static Result build(List<CrosswalkSourceRow> source) {
        CrosswalkBuilder builder = new CrosswalkBuilder();
        Crosswalk crosswalk = builder.addAll(source).crosswalk();
        return new Result(crosswalk, builder.report(crosswalk));
    }

    public CrosswalkBuilder addAll(List<CrosswalkSourceRow> source) {
        for (CrosswalkSourceRow row : source) {
            sourceRows++;
            rows.addAll(expandRow(row));
        }
        return this;
    }

    private List<CrosswalkRow> expandRow(CrosswalkSourceRow row) {
        String designation = row.designation() == null ? "" : row.designation().trim();
        NormalizedExpression normalized = CodeNormalizer.normalize(row.expression());

        List<CrosswalkRow> expanded = new ArrayList<>();
        int unknown = 0;
        try {
            for (NormalizedExpression part : ComboSplitter.split(normalized)) {
                CrosswalkExpander.Expansion expansion = CrosswalkExpander.expand(part);
                unknown += expansion.unknownTokens();
                for (CodeSet codes : expansion.codeSets()) {
                    expanded.add(new CrosswalkRow(designation, codes));
                }
            }
        } catch (MalformedExpressionException e) {
            log.warn("Dropping crosswalk row for designation '{}': {}", designation, e.getMessage());
            malformed.add(designation);
            return List.of();
        }

        if (unknown > 0) {
            log.debug("Designation '{}' expression '{}' had {} unknown tokens", designation, row.expression(), unknown);
        }
        unknownTokens += unknown;
        log.debug("Designation '{}' expanded to {} rows", designation, expanded.size());
        return expanded;
    }

    public Crosswalk crosswalk() {
        Crosswalk crosswalk = Crosswalk.of(rows);
        log.info("Built crosswalk from {} source rows: {} rows, {} malformed, {} unknown tokens",
                sourceRows, crosswalk.size(), malformed.size(), unknownTokens);
        return crosswalk;
    }

    public CrosswalkReport report(Crosswalk crosswalk) {
        return new CrosswalkReport(sourceRows, crosswalk.size(), unknownTokens, List.copyOf(malformed));
    }

    /**
     * Crosswalk together with its build report.
     */
    public record Result(Crosswalk crosswalk, CrosswalkReport report) {
    }
}
