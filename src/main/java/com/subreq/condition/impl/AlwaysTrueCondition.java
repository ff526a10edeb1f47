package com.subreq.condition.impl;

import com.subreq.condition.Condition;
import com.subreq.condition.ConditionType;
import com.subreq.condition.CourseFacts;

/**
 * Condition that always evaluates to true.
 * Stands in for criteria that place no restriction.
 */
public class AlwaysTrueCondition implements Condition {

    public static final AlwaysTrueCondition INSTANCE = new AlwaysTrueCondition();

    private AlwaysTrueCondition() {}

    @Override
    public boolean evaluate(CourseFacts facts) {
        return true;
    }

    @Override
    public ConditionType getType() {
        return ConditionType.ALWAYS_TRUE;
    }

    @Override
    public String toString() {
        return "ALWAYS_TRUE";
    }
}
