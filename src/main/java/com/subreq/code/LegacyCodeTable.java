package com.subreq.code;

import com.subreq.exception.ConfigurationException;

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Static crosswalk from legacy (PS style) condition codes to DARS condition codes.
 * <p>
 * Entries keep their declaration order, maroon first and gold second, which is the
 * order the normalizer applies them in. The table is validated once when the class
 * loads: every target must belong to the expected group and no two legacy codes may
 * share a target.
 */
public final class LegacyCodeTable {

    private static final Map<String, ConditionCode> MAROON;
    private static final Map<String, ConditionCode> GOLD;
    private static final Map<String, ConditionCode> ALL;

    static {
        Map<String, ConditionCode> maroon = new LinkedHashMap<>();
        maroon.put("C", ConditionCode.CULTURAL_DIVERSITY);
        maroon.put("CS", ConditionCode.COMPUTER_STATISTICS);
        maroon.put("G", ConditionCode.GLOBAL_AWARENESS);
        maroon.put("H", ConditionCode.HISTORICAL_AWARENESS);
        maroon.put("HU", ConditionCode.HUMANITIES);
        maroon.put("L", ConditionCode.LITERACY);
        maroon.put("MA", ConditionCode.MATHEMATICAL_STUDIES);
        maroon.put("SB", ConditionCode.SOCIAL_BEHAVIORAL);
        maroon.put("SG", ConditionCode.SCIENCE_GENERAL);
        maroon.put("SQ", ConditionCode.SCIENCE_QUANTITATIVE);

        Map<String, ConditionCode> gold = new LinkedHashMap<>();
        gold.put("HUAD", ConditionCode.HUMANITIES_ARTS_DESIGN);
        gold.put("SOBE", ConditionCode.SOCIAL_BEHAVIORAL_SCIENCES);
        gold.put("SCIT", ConditionCode.SCIENTIFIC_THINKING);
        gold.put("QTRS", ConditionCode.QUANTITATIVE_REASONING);
        gold.put("MATH", ConditionCode.MATHEMATICAL_FOUNDATIONS);
        gold.put("AMIT", ConditionCode.AMERICAN_INSTITUTIONS);
        gold.put("CIVI", ConditionCode.CIVIC_ENGAGEMENT);
        gold.put("GCSI", ConditionCode.GLOBAL_COMMUNITIES);
        gold.put("SUST", ConditionCode.SUSTAINABILITY);

        Map<String, ConditionCode> all = new LinkedHashMap<>(maroon);
        all.putAll(gold);

        validate(maroon, CodeGroup.MAROON);
        validate(gold, CodeGroup.GOLD);
        validateInjective(all);

        MAROON = Collections.unmodifiableMap(maroon);
        GOLD = Collections.unmodifiableMap(gold);
        ALL = Collections.unmodifiableMap(all);
    }

    private LegacyCodeTable() {
    }

    /**
     * All legacy codes in application order.
     */
    public static Map<String, ConditionCode> entries() {
        return ALL;
    }

    public static Map<String, ConditionCode> maroon() {
        return MAROON;
    }

    public static Map<String, ConditionCode> gold() {
        return GOLD;
    }

    static void validate(Map<String, ConditionCode> table, CodeGroup group) {
        for (Map.Entry<String, ConditionCode> entry : table.entrySet()) {
            String legacy = entry.getKey();
            if (legacy.isEmpty() || legacy.length() > 4 || !legacy.chars().allMatch(Character::isLetter)) {
                throw new ConfigurationException("Legacy code '" + legacy + "' must be 1-4 letters");
            }
            if (entry.getValue().group() != group) {
                throw new ConfigurationException("Legacy code '" + legacy + "' maps to "
                        + entry.getValue() + " which is not a " + group + " code");
            }
        }
    }

    static void validateInjective(Map<String, ConditionCode> table) {
        Set<ConditionCode> seen = EnumSet.noneOf(ConditionCode.class);
        for (Map.Entry<String, ConditionCode> entry : table.entrySet()) {
            if (!seen.add(entry.getValue())) {
                throw new ConfigurationException("Condition code '" + entry.getValue().symbol()
                        + "' is the target of more than one legacy code (found again at '" + entry.getKey() + "')");
            }
        }
    }
}
