package com.subreq.crosswalk;

import com.subreq.code.ConditionCode;
import com.subreq.code.LegacyCodeTable;
import com.subreq.exception.MalformedExpressionException;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits a gold condition code from the maroon combination that follows it.
 * <p>
 * Designation "GE11" maps to {@code HUAD OR (HU or SB) & C & H}. The leading gold
 * code is an independent alternative, not part of the combination, so after
 * normalization the expression becomes two expressions: {@code ¿} and
 * {@code (H or S) & c & h}.
 */
public final class ComboSplitter {

    private static final Pattern OR_TOKEN = Pattern.compile("(?i)(?<![a-zA-Z])or(?![a-zA-Z])");

    private ComboSplitter() {
    }

    /**
     * Split an expression that starts with {@code <gold code> or }.
     *
     * @param expression Normalized expression
     * @return The gold code and the remainder, or the expression alone
     * @throws MalformedExpressionException if nothing follows the {@code or}
     */
    public static List<NormalizedExpression> split(NormalizedExpression expression) {
        String value = OR_TOKEN.matcher(expression.text()).replaceAll("or");
        for (ConditionCode gold : LegacyCodeTable.gold().values()) {
            String prefix = gold.symbol() + " or ";
            if (value.startsWith(prefix)) {
                if (value.substring(prefix.length()).isBlank()) {
                    throw new MalformedExpressionException("Empty alternative after 'or'", value, value.length());
                }
                return List.of(
                        new NormalizedExpression(String.valueOf(gold.symbol())),
                        new NormalizedExpression(value.substring(prefix.length())));
            }
        }
        return List.of(new NormalizedExpression(value));
    }
}
