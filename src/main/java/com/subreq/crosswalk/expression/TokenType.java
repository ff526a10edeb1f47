package com.subreq.crosswalk.expression;

/**
 * Token types for eligibility expressions.
 */
public enum TokenType {
    // Codes
    CODE,
    UNKNOWN,

    // Delimiters
    LPAREN,
    RPAREN,

    // Logical operators
    AND,
    OR,

    // Special
    EOF
}
