package com.structurescout.domain.enums;

/**
 * Machine-readable codes for every check the engine can fire.
 *
 * <p>Declaration order follows the order in which the RiskGate runs its checks, so sorting a
 * set of codes by ordinal reproduces evaluation order.
 */
public enum ReasonCode {

    // Setup validation
    MALFORMED_INPUT(ReasonCategory.MALFORMED),
    LOW_CONFIDENCE(ReasonCategory.VALIDATION),
    LOW_REWARD_RISK(ReasonCategory.VALIDATION),
    EXCLUDED_SETUP_TYPE(ReasonCategory.VALIDATION),

    // Gate: system state
    RECOVERY_PENDING(ReasonCategory.GATE),
    TRADING_HALTED(ReasonCategory.GATE),
    DUPLICATE_CANDIDATE(ReasonCategory.MALFORMED),

    // Gate: session and news
    NON_TRADING_DAY(ReasonCategory.GATE),
    MARKET_HOLIDAY(ReasonCategory.GATE),
    OUTSIDE_SESSION(ReasonCategory.GATE),
    NEWS_BLACKOUT(ReasonCategory.GATE),

    // Gate: ledger limits
    DAILY_LIMIT_BREACHED(ReasonCategory.GATE),
    WEEKLY_LIMIT_BREACHED(ReasonCategory.GATE),
    DAILY_TRADE_CAP_REACHED(ReasonCategory.GATE),
    WEEKLY_TRADE_CAP_REACHED(ReasonCategory.GATE),
    MAX_OPEN_POSITIONS_REACHED(ReasonCategory.GATE),

    // Gate: sizing
    INVALID_STOP(ReasonCategory.GATE),
    ZERO_SIZE(ReasonCategory.GATE),

    // Attached to admissions only
    PAPER_TRACKING_ONLY(ReasonCategory.DIAGNOSTIC),
    DAILY_LOSS_WARNING(ReasonCategory.DIAGNOSTIC);

    private final ReasonCategory category;

    ReasonCode(ReasonCategory category) {
        this.category = category;
    }

    public ReasonCategory getCategory() {
        return category;
    }

    public boolean isDiagnostic() {
        return category == ReasonCategory.DIAGNOSTIC;
    }
}
