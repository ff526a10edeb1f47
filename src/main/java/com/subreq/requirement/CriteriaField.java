package com.subreq.requirement;

/**
 * Code-bearing columns of a sub-requirement row.
 * <p>
 * Requirement level columns ({@code r_*}) come from the requirement master,
 * {@code ac}/{@code rc} from the sub-requirement course entry and
 * {@code ac1..ac5}/{@code rc1..rc5} from the sub-requirement itself.
 */
public enum CriteriaField {
    R_AC1("r_ac1", Side.ACCEPT),
    R_AC2("r_ac2", Side.ACCEPT),
    R_RC1("r_rc1", Side.REJECT),
    R_RC2("r_rc2", Side.REJECT),
    AC("ac", Side.ACCEPT),
    RC("rc", Side.REJECT),
    AC1("ac1", Side.ACCEPT),
    AC2("ac2", Side.ACCEPT),
    AC3("ac3", Side.ACCEPT),
    AC4("ac4", Side.ACCEPT),
    AC5("ac5", Side.ACCEPT),
    RC1("rc1", Side.REJECT),
    RC2("rc2", Side.REJECT),
    RC3("rc3", Side.REJECT),
    RC4("rc4", Side.REJECT),
    RC5("rc5", Side.REJECT);

    private final String column;
    private final Side side;

    CriteriaField(String column, Side side) {
        this.column = column;
        this.side = side;
    }

    public String column() {
        return column;
    }

    public Side side() {
        return side;
    }

    public enum Side {
        ACCEPT,
        REJECT
    }
}
