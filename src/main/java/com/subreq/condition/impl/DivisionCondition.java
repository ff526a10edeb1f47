package com.subreq.condition.impl;

import com.subreq.code.Division;
import com.subreq.condition.Condition;
import com.subreq.condition.ConditionType;
import com.subreq.condition.CourseFacts;

/**
 * Condition that checks the course is in the given division.
 * A course without a division never matches.
 */
public class DivisionCondition implements Condition {

    private final Division division;

    public DivisionCondition(Division division) {
        this.division = division;
    }

    @Override
    public boolean evaluate(CourseFacts facts) {
        return facts.division() == division;
    }

    @Override
    public ConditionType getType() {
        return ConditionType.DIVISION_EQUALS;
    }

    @Override
    public String toString() {
        return "DIVISION == " + division.marker();
    }
}
