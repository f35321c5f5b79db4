package com.structurescout.domain.enums;

/**
 * The individual milestone checks evaluated before a phase may advance.
 */
public enum MilestoneCriterion {

    /** Fewer outcomes than the configured minimum sample. */
    SAMPLE_SIZE,

    /** Win rate below the configured minimum. */
    ACCURACY,

    /** Peak-to-trough drawdown of cumulative P&L above the configured maximum. */
    DRAWDOWN,

    /** Average realized R-multiple below the configured minimum. */
    AVERAGE_R_MULTIPLE,

    /** Not enough calendar days spent in the current phase. */
    ELAPSED_TIME
}
