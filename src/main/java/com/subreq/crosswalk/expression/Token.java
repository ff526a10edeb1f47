package com.subreq.crosswalk.expression;

import com.subreq.code.ConditionCode;

/**
 * Represents a token in an eligibility expression.
 *
 * @param type     Token type
 * @param text     Original text
 * @param code     Condition code for CODE tokens, null otherwise
 * @param position Position in the input string
 */
public record Token(TokenType type, String text, ConditionCode code, int position) {

    @Override
    public String toString() {
        if (code != null) {
            return type + "(" + code.symbol() + ")";
        }
        return type + "(" + text + ")";
    }
}
