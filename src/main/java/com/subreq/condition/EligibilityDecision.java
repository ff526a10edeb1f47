package com.subreq.condition;

/**
 * Outcome of evaluating one course code set against one sub-requirement.
 *
 * @param accepted    Whether the course satisfies the criteria
 * @param explanation Human-readable reason, naming the failing condition on rejection
 */
public record EligibilityDecision(boolean accepted, String explanation) {

    public static EligibilityDecision accepted(Condition condition) {
        return new EligibilityDecision(true, "Accepted by " + condition);
    }

    public static EligibilityDecision rejected(Condition failing) {
        return new EligibilityDecision(false, "Failed " + failing);
    }
}
