package com.subreq.condition;

/**
 * Supported condition types for eligibility evaluation.
 */
public enum ConditionType {
    // Codes
    ALL_CODES_PRESENT,
    ANY_CODE_PRESENT,

    // Division
    DIVISION_EQUALS,

    // Logical
    AND,
    NOT,

    // Special
    ALWAYS_TRUE
}
