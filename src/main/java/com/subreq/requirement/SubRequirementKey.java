package com.subreq.requirement;

import java.util.Comparator;

/**
 * Identity of a sub-requirement course entry, used to collapse duplicate results.
 */
public record SubRequirementKey(
        String rname,
        String subreqId,
        String rqfyt,
        String lyt,
        String rqfyt2,
        String lyt2,
        String seq1,
        String seq2,
        String seq3,
        String seq4,
        String rtitle1
) implements Comparable<SubRequirementKey> {

    private static final Comparator<String> NULLS_FIRST = Comparator.nullsFirst(Comparator.naturalOrder());

    private static final Comparator<SubRequirementKey> ORDER = Comparator
            .comparing(SubRequirementKey::rname, NULLS_FIRST)
            .thenComparing(SubRequirementKey::rqfyt, NULLS_FIRST)
            .thenComparing(SubRequirementKey::lyt, NULLS_FIRST)
            .thenComparing(SubRequirementKey::seq1, NULLS_FIRST)
            .thenComparing(SubRequirementKey::seq2, NULLS_FIRST)
            .thenComparing(SubRequirementKey::seq3, NULLS_FIRST)
            .thenComparing(SubRequirementKey::seq4, NULLS_FIRST)
            .thenComparing(SubRequirementKey::subreqId, NULLS_FIRST)
            .thenComparing(SubRequirementKey::rqfyt2, NULLS_FIRST)
            .thenComparing(SubRequirementKey::lyt2, NULLS_FIRST)
            .thenComparing(SubRequirementKey::rtitle1, NULLS_FIRST);

    @Override
    public int compareTo(SubRequirementKey other) {
        return ORDER.compare(this, other);
    }
}
