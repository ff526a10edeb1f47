package com.subreq.code;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable set of condition codes backed by a bitmask.
 * One bit per {@link ConditionCode}, so set operations are single integer operations.
 */
public final class CodeSet {

    private static final CodeSet EMPTY = new CodeSet(0);

    private final int mask;

    private CodeSet(int mask) {
        this.mask = mask;
    }

    public static CodeSet empty() {
        return EMPTY;
    }

    public static CodeSet of(ConditionCode... codes) {
        int mask = 0;
        for (ConditionCode code : codes) {
            mask |= code.bit();
        }
        return ofMask(mask);
    }

    static CodeSet ofMask(int mask) {
        return mask == 0 ? EMPTY : new CodeSet(mask);
    }

    /**
     * Build a set from a string of code symbols.
     * Characters that are not code symbols contribute nothing.
     *
     * @param symbols Code symbols, may be null
     * @return Code set
     */
    public static CodeSet parse(CharSequence symbols) {
        if (symbols == null) {
            return EMPTY;
        }
        int mask = 0;
        for (int i = 0; i < symbols.length(); i++) {
            mask |= ConditionCode.fromSymbol(symbols.charAt(i)).map(ConditionCode::bit).orElse(0);
        }
        return ofMask(mask);
    }

    public CodeSet with(ConditionCode code) {
        return ofMask(mask | code.bit());
    }

    public CodeSet union(CodeSet other) {
        return ofMask(mask | other.mask);
    }

    public boolean contains(ConditionCode code) {
        return (mask & code.bit()) != 0;
    }

    /**
     * Every code of {@code other} is present in this set. Always true for an empty {@code other}.
     */
    public boolean containsAll(CodeSet other) {
        return (mask & other.mask) == other.mask;
    }

    /**
     * At least one code of {@code other} is present in this set.
     */
    public boolean intersects(CodeSet other) {
        return (mask & other.mask) != 0;
    }

    public boolean isEmpty() {
        return mask == 0;
    }

    public int size() {
        return Integer.bitCount(mask);
    }

    /**
     * Codes in alphabet order.
     */
    public List<ConditionCode> codes() {
        List<ConditionCode> codes = new ArrayList<>(size());
        for (ConditionCode code : ConditionCode.values()) {
            if (contains(code)) {
                codes.add(code);
            }
        }
        return Collections.unmodifiableList(codes);
    }

    /**
     * Canonical symbol string in alphabet order, e.g. "Hch".
     */
    public String toSymbols() {
        StringBuilder sb = new StringBuilder(size());
        for (ConditionCode code : codes()) {
            sb.append(code.symbol());
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CodeSet other)) return false;
        return mask == other.mask;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(mask);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        for (ConditionCode code : codes()) {
            if (sb.length() > 1) {
                sb.append(',');
            }
            sb.append(code.symbol());
        }
        return sb.append('}').toString();
    }
}
