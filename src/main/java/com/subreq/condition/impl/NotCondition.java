package com.subreq.condition.impl;

import com.subreq.condition.Condition;
import com.subreq.condition.ConditionType;
import com.subreq.condition.CourseFacts;

/**
 * Logical NOT condition - negates the nested condition.
 */
public class NotCondition implements Condition {

    private final Condition condition;

    public NotCondition(Condition condition) {
        this.condition = condition;
    }

    @Override
    public boolean evaluate(CourseFacts facts) {
        return !condition.evaluate(facts);
    }

    @Override
    public ConditionType getType() {
        return ConditionType.NOT;
    }

    @Override
    public String toString() {
        return "NOT(" + condition + ")";
    }
}
