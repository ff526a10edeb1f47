package com.subreq.requirement;

import com.subreq.code.CodeSet;

/**
 * The three code criteria of a sub-requirement row.
 *
 * @param acceptAll Every code must be present ({@code ac_all}); empty accepts any course
 * @param rejectAll Rejects when every code is present ({@code rc_and}); empty never rejects
 * @param rejectAny Rejects when any code is present ({@code rc_ord})
 */
public record CriteriaCodes(CodeSet acceptAll, CodeSet rejectAll, CodeSet rejectAny) {

    public static CriteriaCodes none() {
        return new CriteriaCodes(CodeSet.empty(), CodeSet.empty(), CodeSet.empty());
    }

    @Override
    public String toString() {
        return "ac_all=" + acceptAll + ", rc_and=" + rejectAll + ", rc_ord=" + rejectAny;
    }
}
