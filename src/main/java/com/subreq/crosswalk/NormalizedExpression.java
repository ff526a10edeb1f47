package com.subreq.crosswalk;

/**
 * Eligibility expression whose legacy codes have already been replaced with
 * DARS condition codes.
 *
 * @param text Normalized text
 */
public record NormalizedExpression(String text) {

    public NormalizedExpression {
        text = text == null ? "" : text;
    }

    @Override
    public String toString() {
        return text;
    }
}
