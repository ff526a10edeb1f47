package com.subreq.condition;

/**
 * Represents a boolean condition that can be evaluated against course facts.
 */
public interface Condition {

    /**
     * Evaluate this condition against the given facts.
     *
     * @param facts Course codes and division
     * @return true if condition matches, false otherwise
     */
    boolean evaluate(CourseFacts facts);

    /**
     * Get the condition type.
     */
    ConditionType getType();
}
