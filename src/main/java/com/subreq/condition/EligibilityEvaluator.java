package com.subreq.condition;

import com.subreq.requirement.SubRequirementCriteria;

/**
 * Decides whether a course satisfies a sub-requirement's criteria.
 */
public interface EligibilityEvaluator {

    /**
     * Evaluate criteria against one code set alternative of a course.
     *
     * @param facts    Course codes and division
     * @param criteria Sub-requirement criteria
     * @return Decision with explanation
     */
    EligibilityDecision evaluate(CourseFacts facts, SubRequirementCriteria criteria);

    /**
     * Shortcut when the explanation is not needed.
     */
    default boolean accepts(CourseFacts facts, SubRequirementCriteria criteria) {
        return evaluate(facts, criteria).accepted();
    }
}
