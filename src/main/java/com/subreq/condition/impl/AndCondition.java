package com.subreq.condition.impl;

import com.subreq.condition.Condition;
import com.subreq.condition.ConditionType;
import com.subreq.condition.CourseFacts;

import java.util.List;

/**
 * Logical AND condition - all nested conditions must be true.
 */
public class AndCondition implements Condition {

    private final List<Condition> conditions;

    public AndCondition(List<Condition> conditions) {
        this.conditions = List.copyOf(conditions);
    }

    @Override
    public boolean evaluate(CourseFacts facts) {
        if (conditions.isEmpty()) {
            return true; // Empty AND is true
        }
        return conditions.stream().allMatch(c -> c.evaluate(facts));
    }

    public List<Condition> getConditions() {
        return conditions;
    }

    @Override
    public ConditionType getType() {
        return ConditionType.AND;
    }

    @Override
    public String toString() {
        return "AND(" + conditions + ")";
    }
}
