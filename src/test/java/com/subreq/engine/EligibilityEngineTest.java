package com.subreq.engine;

import com.subreq.course.OfferedCourse;
import com.subreq.crosswalk.Crosswalk;
import com.subreq.crosswalk.CrosswalkBuilder;
import com.subreq.io.CsvTable;
import com.subreq.io.EligibilityResultWriter;
import com.subreq.io.TableSources;
import com.subreq.requirement.SubRequirementRaw;
import com.subreq.result.EligibilityResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringWriter;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests of the engine against the fixture tables.
 */
class EligibilityEngineTest {

    private EligibilityEngine engine;
    private Crosswalk crosswalk;
    private List<SubRequirementRaw> rows;
    private List<OfferedCourse> courses;

    @BeforeEach
    void setUp() {
        engine = new EligibilityEngine();
        crosswalk = engine.buildCrosswalk(
                TableSources.crosswalk(CsvTable.read("classpath:fixtures/crosswalk.csv"))).crosswalk();
        rows = TableSources.subRequirements(CsvTable.read("classpath:fixtures/sub-requirements.csv"));
        courses = TableSources.offeredCourses(CsvTable.read("classpath:fixtures/offered-courses.csv"));
    }

    @Test
    @DisplayName("Fixture tables produce the expected course and sub-requirement pairs")
    void expectedPairs() {
        BatchResult result = engine.evaluate(rows, courses, crosswalk);

        assertEquals(Set.of(
                "GSHU/ENG 101", "GSHU/ENG 394",
                "GSMA/MAT 117",
                "GSUP/ENG 394", "GSUP/MAT 370",
                "GSRJ/ART 100"), pairs(result.results()));
        assertEquals(4, result.rowsRead());
        assertEquals(5, result.criteriaRows());
        assertEquals(1, result.filteredValues());
    }

    @Test
    @DisplayName("Results carry term codes and descriptive columns")
    void carriesDetails() {
        EligibilityResult humanities = engine.evaluate(rows, courses, crosswalk).results().stream()
                .filter(r -> r.details().rname().equals("GSHU"))
                .findFirst().orElseThrow();

        assertEquals("2197", humanities.details().rqfyt());
        assertEquals("9999", humanities.details().lyt());
        assertEquals("Humanities, Arts and Design", humanities.details().rtitle1());
    }

    @Test
    @DisplayName("Malformed crosswalk row leaves its courses on the no-designation row")
    void malformedDesignationFallsBack() {
        CrosswalkBuilder.Result built = engine.buildCrosswalk(
                TableSources.crosswalk(CsvTable.read("classpath:fixtures/crosswalk.csv")));

        assertFalse(built.crosswalk().contains("BAD"));
        assertEquals(built.crosswalk().codeSetsFor(Crosswalk.NO_DESIGNATION), built.crosswalk().codeSetsFor("BAD"));
        assertEquals(List.of("BAD"), built.report().malformedExpressions());
    }

    @Test
    @DisplayName("Re-running on unchanged inputs gives byte-identical output")
    void idempotent() throws IOException {
        StringWriter first = new StringWriter();
        StringWriter second = new StringWriter();

        EligibilityResultWriter.write(engine.evaluate(rows, courses, crosswalk).results(), first);
        EligibilityResultWriter.write(new EligibilityEngine().evaluate(rows, courses, crosswalk).results(), second);

        assertEquals(first.toString(), second.toString());
    }

    @Test
    @DisplayName("Criteria derivation is exposed for inspection")
    void buildCriteria() {
        assertEquals(5, engine.buildCriteria(rows).size());
    }

    static Set<String> pairs(Set<EligibilityResult> results) {
        return results.stream()
                .map(r -> r.details().rname() + "/" + r.course().fullCourse())
                .collect(Collectors.toSet());
    }
}
