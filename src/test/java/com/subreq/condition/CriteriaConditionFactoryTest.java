package com.subreq.condition;

import com.subreq.code.CodeSet;
import com.subreq.code.Division;
import com.subreq.condition.impl.AndCondition;
import com.subreq.requirement.CriteriaCodes;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for CriteriaConditionFactory.
 */
class CriteriaConditionFactoryTest {

    @Test
    @DisplayName("No criteria gives ALWAYS_TRUE")
    void noCriteria() {
        Condition condition = CriteriaConditionFactory.create(CriteriaCodes.none(), null, null);

        assertEquals(ConditionType.ALWAYS_TRUE, condition.getType());
        assertTrue(condition.evaluate(CourseFacts.of(CodeSet.empty())));
    }

    @Test
    @DisplayName("Single criterion is not wrapped in AND")
    void singleCriterion() {
        Condition condition = CriteriaConditionFactory.create(
                new CriteriaCodes(CodeSet.parse("H"), CodeSet.empty(), CodeSet.empty()), null, null);

        assertEquals(ConditionType.ALL_CODES_PRESENT, condition.getType());
    }

    @Test
    @DisplayName("All criteria parts combine under AND in a fixed order")
    void allParts() {
        Condition condition = CriteriaConditionFactory.create(
                new CriteriaCodes(CodeSet.parse("H"), CodeSet.parse("cg"), CodeSet.parse("S")),
                Division.UPPER, Division.LOWER);

        assertEquals(ConditionType.AND, condition.getType());
        AndCondition and = (AndCondition) condition;
        assertEquals(5, and.getConditions().size());
        assertEquals("AND([ALL_OF {H}, NOT(ALL_OF {c,g}), NOT(ANY_OF {S}), DIVISION == U, NOT(DIVISION == L)])",
                condition.toString());
    }
}
