package com.subreq.crosswalk.expression;

/**
 * Keywords, operators and limits for eligibility expression parsing.
 */
public final class ExpressionConfig {

    private ExpressionConfig() {
    }

    /**
     * Alternative separator. Matched case-insensitively as a whole word.
     */
    public static final String OR_KEYWORD = "or";

    /**
     * Maximum number of AND-groups in a single alternative.
     */
    public static final int MAX_AND_GROUPS = 4;

    /**
     * Operator symbols.
     */
    public static final class Operators {
        public static final char AND = '&';
        public static final char LEFT_PAREN = '(';
        public static final char RIGHT_PAREN = ')';

        private Operators() {
        }
    }
}
