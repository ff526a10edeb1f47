package com.subreq.requirement;

import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * One sub-requirement row as read from the audit tables, before criteria derivation.
 *
 * @param details Descriptive columns, term columns not yet converted
 * @param codes   Raw values of the code-bearing columns; absent columns are null
 * @param acor    Accept OR flag; contains "-" when every ac1..ac5 code is its own alternative
 * @param rcand   Reject AND flag; "-" when rc1..rc5 reject only together
 */
public record SubRequirementRaw(
        SubRequirementDetails details,
        Map<CriteriaField, String> codes,
        String acor,
        String rcand
) {

    /**
     * Descriptive column names in output order.
     */
    public static final List<String> DETAIL_COLUMNS = List.of(
            "rname", "subreq_id", "rqfyt", "lyt", "rqfyt2", "lyt2", "rtitle1",
            "seq1", "seq2", "seq3", "seq4", "course", "tflg", "ctitle", "matchctl",
            "grp", "grpmin", "grpmax", "hcmin", "hcmax");

    public String value(CriteriaField field) {
        return codes.get(field);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for SubRequirementRaw. Columns are set by their table names.
     */
    public static final class Builder {

        private final Map<String, String> columns = new HashMap<>();
        private final Map<CriteriaField, String> codes = new EnumMap<>(CriteriaField.class);
        private String acor;
        private String rcand;

        private Builder() {
        }

        /**
         * Set any column by name: descriptive, code-bearing or flag column.
         * Unknown column names are ignored.
         */
        public Builder column(String name, String value) {
            for (CriteriaField field : CriteriaField.values()) {
                if (field.column().equals(name)) {
                    codes.put(field, value);
                    return this;
                }
            }
            if ("acor".equals(name)) {
                acor = value;
            } else if ("rcand".equals(name)) {
                rcand = value;
            } else if (DETAIL_COLUMNS.contains(name)) {
                columns.put(name, value);
            }
            return this;
        }

        public Builder code(CriteriaField field, String value) {
            codes.put(field, value);
            return this;
        }

        public Builder acor(String acor) {
            this.acor = acor;
            return this;
        }

        public Builder rcand(String rcand) {
            this.rcand = rcand;
            return this;
        }

        public Builder rname(String rname) {
            return column("rname", rname);
        }

        public Builder subreqId(String subreqId) {
            return column("subreq_id", subreqId);
        }

        public Builder terms(String rqfyt, String lyt) {
            return column("rqfyt", rqfyt).column("lyt", lyt);
        }

        public Builder course(String course) {
            return column("course", course);
        }

        public SubRequirementRaw build() {
            SubRequirementDetails details = new SubRequirementDetails(
                    columns.get("rname"), columns.get("subreq_id"),
                    columns.get("rqfyt"), columns.get("lyt"),
                    columns.get("rqfyt2"), columns.get("lyt2"),
                    columns.get("rtitle1"),
                    columns.get("seq1"), columns.get("seq2"), columns.get("seq3"), columns.get("seq4"),
                    columns.get("course"), columns.get("tflg"), columns.get("ctitle"), columns.get("matchctl"),
                    columns.get("grp"), columns.get("grpmin"), columns.get("grpmax"),
                    columns.get("hcmin"), columns.get("hcmax"));
            return new SubRequirementRaw(details, Collections.unmodifiableMap(new EnumMap<>(codes)), acor, rcand);
        }
    }
}
