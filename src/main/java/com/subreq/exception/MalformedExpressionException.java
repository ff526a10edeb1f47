package com.subreq.exception;

/**
 * Exception thrown when an eligibility expression does not have one of the
 * recognized shapes. Scoped to a single crosswalk row; callers drop the row
 * and count it instead of aborting the batch.
 */
public class MalformedExpressionException extends SubReqException {

    private final String expression;
    private final int position;

    public MalformedExpressionException(String message, String expression, int position) {
        super("Malformed expression at position " + position + ": " + message + " in '" + expression + "'");
        this.expression = expression;
        this.position = position;
    }

    public String getExpression() {
        return expression;
    }

    public int getPosition() {
        return position;
    }
}
