package com.structurescout.event;

/**
 * Classifies the type of risk condition that triggered a {@link RiskEvent}.
 */
public enum RiskEventType {

    /** Daily loss has passed the warning fraction of the daily limit. */
    DAILY_LOSS_LIMIT_APPROACH,

    /** Daily loss reached the daily limit; the day is latched closed. */
    DAILY_LOSS_LIMIT_BREACH,

    /** Weekly loss reached the weekly limit; the week is latched closed. */
    WEEKLY_LOSS_LIMIT_BREACH,

    /** Daily or weekly trade cap reached. */
    TRADE_CAP_REACHED,

    /** Maximum number of simultaneous open positions reached. */
    MAX_POSITIONS_REACHED,

    /** Trading halt engaged, manually or automatically. */
    TRADING_HALTED,

    /** Trading halt lifted by an authorized operator. */
    TRADING_RESUMED
}
