package com.subreq.crosswalk;

import com.subreq.code.CodeSet;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for CrosswalkBuilder and Crosswalk.
 */
class CrosswalkBuilderTest {

    @Test
    @DisplayName("GE11 expands to the gold code and both maroon combinations")
    void ge11() {
        CrosswalkBuilder.Result result = CrosswalkBuilder.build(List.of(
                new CrosswalkSourceRow("GE11", "HUAD OR (HU or SB) & C & H")));

        assertEquals(List.of(CodeSet.parse("¿"), CodeSet.parse("Hch"), CodeSet.parse("Sch")),
                result.crosswalk().codeSetsFor("GE11"));
    }

    @Test
    @DisplayName("Sentinel row is always present")
    void sentinelAlwaysPresent() {
        Crosswalk crosswalk = CrosswalkBuilder.build(List.of()).crosswalk();

        assertTrue(crosswalk.contains(Crosswalk.NO_DESIGNATION));
        assertEquals(List.of(CodeSet.empty()), crosswalk.codeSetsFor(Crosswalk.NO_DESIGNATION));
        assertEquals(1, crosswalk.size());
    }

    @Test
    @DisplayName("Unknown and blank designations fall back to the sentinel")
    void fallback() {
        Crosswalk crosswalk = CrosswalkBuilder.build(List.of(new CrosswalkSourceRow("GE5", "CS"))).crosswalk();

        assertEquals(List.of(CodeSet.parse("Q")), crosswalk.codeSetsFor("GE5"));
        assertEquals(List.of(CodeSet.empty()), crosswalk.codeSetsFor("NOPE"));
        assertEquals(List.of(CodeSet.empty()), crosswalk.codeSetsFor(""));
        assertEquals(List.of(CodeSet.empty()), crosswalk.codeSetsFor(null));
    }

    @Test
    @DisplayName("Malformed row is dropped and reported, other rows survive")
    void malformedDropped() {
        CrosswalkBuilder.Result result = CrosswalkBuilder.build(List.of(
                new CrosswalkSourceRow("BAD", "HU & C & H & SB & MA"),
                new CrosswalkSourceRow("GE3", "MA")));

        assertFalse(result.crosswalk().contains("BAD"));
        assertEquals(List.of(CodeSet.parse("v")), result.crosswalk().codeSetsFor("GE3"));
        assertEquals(List.of("BAD"), result.report().malformedExpressions());
        assertEquals(1, result.report().malformedCount());
        assertEquals(2, result.report().sourceRows());
    }

    @ParameterizedTest
    @DisplayName("Gold code followed by a dangling 'or' is dropped as malformed")
    @ValueSource(strings = {"HUAD or", "HUAD or   ", "HUAD OR "})
    void danglingOrDropped(String expression) {
        CrosswalkBuilder.Result result = CrosswalkBuilder.build(List.of(
                new CrosswalkSourceRow("GE11", expression)));

        assertFalse(result.crosswalk().contains("GE11"));
        assertEquals(List.of("GE11"), result.report().malformedExpressions());
        assertEquals(1, result.report().malformedCount());
        assertEquals(1, result.crosswalk().size());
    }

    @Test
    @DisplayName("Duplicate rows collapse and distinct code sets are tracked")
    void duplicatesCollapse() {
        CrosswalkBuilder.Result result = CrosswalkBuilder.build(List.of(
                new CrosswalkSourceRow("GE1", "L"),
                new CrosswalkSourceRow("GE1", "L"),
                new CrosswalkSourceRow("GE2", "L")));

        Crosswalk crosswalk = result.crosswalk();
        assertEquals(List.of(CodeSet.parse("t")), crosswalk.codeSetsFor("GE1"));
        assertEquals(3, crosswalk.size());
        assertEquals(Set.of(CodeSet.parse("t"), CodeSet.empty()), crosswalk.distinctCodeSets());
    }

    @Test
    @DisplayName("Unknown tokens are counted in the report")
    void unknownCounted() {
        CrosswalkBuilder.Result result = CrosswalkBuilder.build(List.of(
                new CrosswalkSourceRow("GE9", "HU & XYZ")));

        assertEquals(1, result.report().unknownTokens());
        assertEquals(List.of(CodeSet.parse("H")), result.crosswalk().codeSetsFor("GE9"));
    }

    @Test
    @DisplayName("Rows added in several calls are all kept")
    void addAllAccumulates() {
        CrosswalkBuilder builder = new CrosswalkBuilder()
                .addAll(List.of(new CrosswalkSourceRow("GE1", "L")))
                .addAll(List.of(new CrosswalkSourceRow("GE2", "MA")));

        Crosswalk crosswalk = builder.crosswalk();
        assertTrue(crosswalk.contains("GE1"));
        assertTrue(crosswalk.contains("GE2"));
        assertEquals(2, builder.report(crosswalk).sourceRows());
    }
}
