package com.structurescout.domain.enums;

/**
 * The four operating phases of the trading system, in their fixed order.
 *
 * <p>Advancement is strictly forward and one step at a time ({@link #next()}), and only ever
 * happens through an explicitly authorized call on the PhaseController. The two paper phases
 * never put capital at risk: the gate still runs for them, but every admitted size is zero.
 */
public enum OperatingPhase {

    /** Setups are evaluated and tracked; nothing is traded. */
    OBSERVATION,

    /** Setups are paper-traded to build a performance record. */
    PAPER_TRADING,

    /** Live trading with a fixed minimal size. */
    MICRO_LIVE,

    /** Live trading with risk-based sizing. */
    FULL_LIVE;

    /** Returns the phase one step forward, or null when already at FULL_LIVE. */
    public OperatingPhase next() {
        OperatingPhase[] phases = values();
        return ordinal() + 1 < phases.length ? phases[ordinal() + 1] : null;
    }

    /** True for MICRO_LIVE and FULL_LIVE. */
    public boolean capitalAtRisk() {
        return this == MICRO_LIVE || this == FULL_LIVE;
    }

    public boolean isBefore(OperatingPhase other) {
        return ordinal() < other.ordinal();
    }
}
