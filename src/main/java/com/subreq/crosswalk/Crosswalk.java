package com.subreq.crosswalk;

import com.subreq.code.CodeSet;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable designation to code set table.
 * <p>
 * Always contains the sentinel designation {@value #NO_DESIGNATION} mapped to the
 * empty code set, which stands for "course has no applicable designation".
 */
public final class Crosswalk {

    public static final String NO_DESIGNATION = "-";

    private final Map<String, List<CodeSet>> codeSetsByDesignation;
    private final int rowCount;

    private Crosswalk(Map<String, List<CodeSet>> codeSetsByDesignation) {
        this.codeSetsByDesignation = codeSetsByDesignation;
        this.rowCount = codeSetsByDesignation.values().stream().mapToInt(List::size).sum();
    }

    /**
     * Build a crosswalk from expanded rows. Duplicate rows collapse; the sentinel row is added.
     */
    public static Crosswalk of(List<CrosswalkRow> rows) {
        Map<String, Set<CodeSet>> grouped = new LinkedHashMap<>();
        for (CrosswalkRow row : rows) {
            grouped.computeIfAbsent(row.designation(), k -> new LinkedHashSet<>()).add(row.codes());
        }
        grouped.computeIfAbsent(NO_DESIGNATION, k -> new LinkedHashSet<>()).add(CodeSet.empty());

        Map<String, List<CodeSet>> table = new LinkedHashMap<>();
        grouped.forEach((designation, codeSets) -> table.put(designation, List.copyOf(codeSets)));
        return new Crosswalk(Collections.unmodifiableMap(table));
    }

    /**
     * Code set alternatives for a designation.
     * Blank or unknown designations fall back to the sentinel row.
     *
     * @param designation Course designation, may be null
     * @return Code sets, never empty
     */
    public List<CodeSet> codeSetsFor(String designation) {
        String key = designation == null || designation.isBlank() ? NO_DESIGNATION : designation.trim();
        List<CodeSet> codeSets = codeSetsByDesignation.get(key);
        return codeSets != null ? codeSets : codeSetsByDesignation.get(NO_DESIGNATION);
    }

    public boolean contains(String designation) {
        return designation != null && codeSetsByDesignation.containsKey(designation.trim());
    }

    /**
     * Distinct code sets across all designations.
     */
    public Set<CodeSet> distinctCodeSets() {
        Set<CodeSet> distinct = new LinkedHashSet<>();
        codeSetsByDesignation.values().forEach(distinct::addAll);
        return distinct;
    }

    public int size() {
        return rowCount;
    }

    @Override
    public String toString() {
        return "Crosswalk{designations=" + codeSetsByDesignation.size() + ", rows=" + rowCount + '}';
    }
}
