package com.subreq.condition;

import com.subreq.code.Division;
import com.subreq.condition.impl.AllCodesPresentCondition;
import com.subreq.condition.impl.AlwaysTrueCondition;
import com.subreq.condition.impl.AndCondition;
import com.subreq.condition.impl.AnyCodePresentCondition;
import com.subreq.condition.impl.DivisionCondition;
import com.subreq.condition.impl.NotCondition;
import com.subreq.requirement.CriteriaCodes;

import java.util.ArrayList;
import java.util.List;

/**
 * Factory that turns sub-requirement criteria into a condition tree:
 * <pre>
 * AND(
 *   ALL_OF ac_all,
 *   NOT(ALL_OF rc_and),     -- only when rc_and is not empty
 *   NOT(ANY_OF rc_ord),
 *   DIVISION == accept,     -- only when set
 *   NOT(DIVISION == reject) -- only when set
 * )
 * </pre>
 * Empty criteria parts are left out, so a row without any criteria becomes ALWAYS_TRUE.
 */
public final class CriteriaConditionFactory {

    private CriteriaConditionFactory() {
    }

    public static Condition create(CriteriaCodes codes, Division acceptDivision, Division rejectDivision) {
        List<Condition> conditions = new ArrayList<>();

        if (!codes.acceptAll().isEmpty()) {
            conditions.add(new AllCodesPresentCondition(codes.acceptAll()));
        }
        if (!codes.rejectAll().isEmpty()) {
            conditions.add(new NotCondition(new AllCodesPresentCondition(codes.rejectAll())));
        }
        if (!codes.rejectAny().isEmpty()) {
            conditions.add(new NotCondition(new AnyCodePresentCondition(codes.rejectAny())));
        }
        if (acceptDivision != null) {
            conditions.add(new DivisionCondition(acceptDivision));
        }
        if (rejectDivision != null) {
            conditions.add(new NotCondition(new DivisionCondition(rejectDivision)));
        }

        if (conditions.isEmpty()) {
            return AlwaysTrueCondition.INSTANCE;
        }
        return conditions.size() == 1 ? conditions.get(0) : new AndCondition(conditions);
    }
}
