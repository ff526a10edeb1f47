package com.subreq.io;

import com.subreq.course.OfferedCourse;
import com.subreq.crosswalk.CrosswalkSourceRow;
import com.subreq.requirement.CriteriaField;
import com.subreq.requirement.SubRequirementRaw;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps CSV tables onto the engine's input rows.
 */
public final class TableSources {

    public static final String DESIGNATION_COLUMN = "PS Requirement Designation";
    public static final String EXPRESSION_COLUMN = "DARS Subreq AC1-AC5";

    private static final List<String> FLAG_COLUMNS = List.of("acor", "rcand");

    private TableSources() {
    }

    /**
     * Published crosswalk: designation and legacy expression per row.
     */
    public static List<CrosswalkSourceRow> crosswalk(CsvTable table) {
        List<CrosswalkSourceRow> rows = new ArrayList<>(table.size());
        for (int i = 0; i < table.size(); i++) {
            rows.add(new CrosswalkSourceRow(
                    table.required(i, DESIGNATION_COLUMN),
                    table.required(i, EXPRESSION_COLUMN)));
        }
        return rows;
    }

    /**
     * Sub-requirement rows. Only {@code rname} is required; other columns default to empty.
     */
    public static List<SubRequirementRaw> subRequirements(CsvTable table) {
        List<String> columns = new ArrayList<>(SubRequirementRaw.DETAIL_COLUMNS);
        for (CriteriaField field : CriteriaField.values()) {
            columns.add(field.column());
        }
        columns.addAll(FLAG_COLUMNS);

        List<SubRequirementRaw> rows = new ArrayList<>(table.size());
        for (int i = 0; i < table.size(); i++) {
            table.required(i, "rname");
            SubRequirementRaw.Builder builder = SubRequirementRaw.builder();
            for (String column : columns) {
                builder.column(column, table.value(i, column));
            }
            rows.add(builder.build());
        }
        return rows;
    }

    /**
     * Offered courses with their requirement designation.
     */
    public static List<OfferedCourse> offeredCourses(CsvTable table) {
        List<OfferedCourse> courses = new ArrayList<>(table.size());
        for (int i = 0; i < table.size(); i++) {
            courses.add(new OfferedCourse(
                    table.required(i, "crse_id"),
                    table.required(i, "full_crse"),
                    table.value(i, "rqmnt_designtn"),
                    table.value(i, "units_minimum"),
                    table.value(i, "units_maximum")));
        }
        return courses;
    }
}
