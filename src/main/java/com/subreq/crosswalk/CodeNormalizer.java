package com.subreq.crosswalk;

import com.subreq.code.ConditionCode;
import com.subreq.code.LegacyCodeTable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites legacy (PS style) condition codes into single-character DARS codes.
 * <p>
 * Matching is whole-token only: no ASCII letter may immediately precede or follow
 * the matched code, so "CS" becomes "Q" and never "cS", and "MATH" becomes "Æ"
 * rather than "MATh". Codes are applied in {@link LegacyCodeTable} order.
 */
public final class CodeNormalizer {

    private static final List<Replacement> REPLACEMENTS;

    static {
        List<Replacement> replacements = new ArrayList<>();
        for (Map.Entry<String, ConditionCode> entry : LegacyCodeTable.entries().entrySet()) {
            Pattern pattern = Pattern.compile("(?<![a-zA-Z])" + Pattern.quote(entry.getKey()) + "(?![a-zA-Z])");
            String symbol = Matcher.quoteReplacement(String.valueOf(entry.getValue().symbol()));
            replacements.add(new Replacement(pattern, symbol));
        }
        REPLACEMENTS = Collections.unmodifiableList(replacements);
    }

    private CodeNormalizer() {
    }

    /**
     * Replace every whole-token legacy code with its DARS code.
     *
     * @param value Raw expression, may be null
     * @return Normalized expression; text without legacy codes is returned unchanged
     */
    public static NormalizedExpression normalize(String value) {
        if (value == null || value.isEmpty()) {
            return new NormalizedExpression("");
        }
        String result = value;
        for (Replacement replacement : REPLACEMENTS) {
            result = replacement.pattern().matcher(result).replaceAll(replacement.symbol());
        }
        return new NormalizedExpression(result);
    }

    /**
     * Already normalized text is returned as is. The legacy and DARS alphabets share
     * the lexemes "G" and "H", so normalized text must never be fed back through
     * {@link #normalize(String)}.
     */
    public static NormalizedExpression normalize(NormalizedExpression value) {
        return value;
    }

    private record Replacement(Pattern pattern, String symbol) {
    }
}
