package com.subreq.condition.impl;

import com.subreq.code.CodeSet;
import com.subreq.condition.Condition;
import com.subreq.condition.ConditionType;
import com.subreq.condition.CourseFacts;

/**
 * Condition that checks the course carries every required code.
 * An empty required set is satisfied by any course.
 */
public class AllCodesPresentCondition implements Condition {

    private final CodeSet required;

    public AllCodesPresentCondition(CodeSet required) {
        this.required = required;
    }

    @Override
    public boolean evaluate(CourseFacts facts) {
        return facts.codes().containsAll(required);
    }

    @Override
    public ConditionType getType() {
        return ConditionType.ALL_CODES_PRESENT;
    }

    @Override
    public String toString() {
        return "ALL_OF " + required;
    }
}
