package com.subreq.condition.impl;

import com.subreq.code.CodeSet;
import com.subreq.condition.Condition;
import com.subreq.condition.ConditionType;
import com.subreq.condition.CourseFacts;

/**
 * Condition that checks the course carries at least one of the given codes.
 */
public class AnyCodePresentCondition implements Condition {

    private final CodeSet candidates;

    public AnyCodePresentCondition(CodeSet candidates) {
        this.candidates = candidates;
    }

    @Override
    public boolean evaluate(CourseFacts facts) {
        return facts.codes().intersects(candidates);
    }

    @Override
    public ConditionType getType() {
        return ConditionType.ANY_CODE_PRESENT;
    }

    @Override
    public String toString() {
        return "ANY_OF " + candidates;
    }
}
