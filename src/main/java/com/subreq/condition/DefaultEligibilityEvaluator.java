package com.subreq.condition;

import com.subreq.code.Division;
import com.subreq.condition.impl.AndCondition;
import com.subreq.requirement.CriteriaCodes;
import com.subreq.requirement.SubRequirementCriteria;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Default implementation of EligibilityEvaluator.
 * <p>
 * Condition trees are built once per distinct criteria shape and cached, since many
 * sub-requirement rows share the same codes. Safe for concurrent use.
 */
public class DefaultEligibilityEvaluator implements EligibilityEvaluator {

    private final Map<CriteriaShape, Condition> conditions = new ConcurrentHashMap<>();

    @Override
    public EligibilityDecision evaluate(CourseFacts facts, SubRequirementCriteria criteria) {
        Condition condition = conditionFor(criteria);

        if (condition instanceof AndCondition and) {
            for (Condition nested : and.getConditions()) {
                if (!nested.evaluate(facts)) {
                    return EligibilityDecision.rejected(nested);
                }
            }
            return EligibilityDecision.accepted(condition);
        }
        return condition.evaluate(facts)
                ? EligibilityDecision.accepted(condition)
                : EligibilityDecision.rejected(condition);
    }

    @Override
    public boolean accepts(CourseFacts facts, SubRequirementCriteria criteria) {
        return conditionFor(criteria).evaluate(facts);
    }

    /**
     * Condition tree for the given criteria, built on first use.
     */
    public Condition conditionFor(SubRequirementCriteria criteria) {
        CriteriaShape shape = new CriteriaShape(criteria.codes(), criteria.acceptDivision(), criteria.rejectDivision());
        return conditions.computeIfAbsent(shape,
                s -> CriteriaConditionFactory.create(s.codes(), s.acceptDivision(), s.rejectDivision()));
    }

    public int cachedConditionCount() {
        return conditions.size();
    }

    private record CriteriaShape(CriteriaCodes codes, Division acceptDivision, Division rejectDivision) {
    }
}
