package com.structurescout.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Closed-period aggregate archived by the ledger on rollover.
 * {@code periodKey} is the session date for DAY periods and the Monday of the week for WEEK.
 */
@Getter
@Builder
@ToString
public class PeriodSummary {

    public enum PeriodType {
        DAY,
        WEEK
    }

    private final PeriodType periodType;
    private final LocalDate periodKey;
    private final BigDecimal realizedPnl;
    private final int tradeCount;
    private final boolean limitBreached;
}
