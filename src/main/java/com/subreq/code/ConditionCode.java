package com.subreq.code;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Single-character DARS condition codes, the engine's canonical unit.
 * <p>
 * The ordinal of each constant is its bit index inside a {@link CodeSet}.
 * Symbols are case-sensitive.
 */
public enum ConditionCode {
    // Maroon
    MAROON_G('G', CodeGroup.MAROON),
    HUMANITIES('H', CodeGroup.MAROON),
    COMPUTER_STATISTICS('Q', CodeGroup.MAROON),
    SOCIAL_BEHAVIORAL('S', CodeGroup.MAROON),
    CULTURAL_DIVERSITY('c', CodeGroup.MAROON),
    GLOBAL_AWARENESS('g', CodeGroup.MAROON),
    HISTORICAL_AWARENESS('h', CodeGroup.MAROON),
    LITERACY('t', CodeGroup.MAROON),
    MATHEMATICAL_STUDIES('v', CodeGroup.MAROON),
    MAROON_W('w', CodeGroup.MAROON),
    MAROON_X('x', CodeGroup.MAROON),
    SCIENCE_QUANTITATIVE('y', CodeGroup.MAROON),
    SCIENCE_GENERAL('z', CodeGroup.MAROON),

    // Gold
    HUMANITIES_ARTS_DESIGN('¿', CodeGroup.GOLD),
    SOCIAL_BEHAVIORAL_SCIENCES('Ñ', CodeGroup.GOLD),
    SCIENTIFIC_THINKING('ß', CodeGroup.GOLD),
    QUANTITATIVE_REASONING('£', CodeGroup.GOLD),
    MATHEMATICAL_FOUNDATIONS('Æ', CodeGroup.GOLD),
    AMERICAN_INSTITUTIONS('ÿ', CodeGroup.GOLD),
    CIVIC_ENGAGEMENT('«', CodeGroup.GOLD),
    GLOBAL_COMMUNITIES('ñ', CodeGroup.GOLD),
    SUSTAINABILITY('ù', CodeGroup.GOLD);

    private static final Map<Character, ConditionCode> BY_SYMBOL;

    static {
        Map<Character, ConditionCode> bySymbol = new HashMap<>();
        for (ConditionCode code : values()) {
            bySymbol.put(code.symbol, code);
        }
        BY_SYMBOL = Collections.unmodifiableMap(bySymbol);
    }

    private final char symbol;
    private final CodeGroup group;

    ConditionCode(char symbol, CodeGroup group) {
        this.symbol = symbol;
        this.group = group;
    }

    public char symbol() {
        return symbol;
    }

    public CodeGroup group() {
        return group;
    }

    /**
     * Bit of this code inside a {@link CodeSet} mask.
     */
    public int bit() {
        return 1 << ordinal();
    }

    public static Optional<ConditionCode> fromSymbol(char symbol) {
        return Optional.ofNullable(BY_SYMBOL.get(symbol));
    }

    /**
     * Resolve a whole field value that must be exactly one code symbol.
     *
     * @param value Field value, may be null
     * @return Code, or empty if the value is anything else
     */
    public static Optional<ConditionCode> fromValue(String value) {
        if (value == null || value.length() != 1) {
            return Optional.empty();
        }
        return fromSymbol(value.charAt(0));
    }

    public static boolean isSymbol(char symbol) {
        return BY_SYMBOL.containsKey(symbol);
    }
}
