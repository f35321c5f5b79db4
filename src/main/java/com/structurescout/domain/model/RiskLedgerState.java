package com.structurescout.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Immutable snapshot of the ledger's aggregates at one point in time.
 * P&L values are fractions of equity; {@code lastSequence} is null before any outcome.
 */
@Getter
@Builder
@ToString
public class RiskLedgerState {

    private final LocalDate dayKey;
    private final LocalDate weekKey;
    private final BigDecimal dailyPnl;
    private final BigDecimal weeklyPnl;
    private final int tradesToday;
    private final int tradesThisWeek;
    private final boolean dailyLimitBreached;
    private final boolean weeklyLimitBreached;
    private final int windowSize;
    private final Long lastSequence;
    private final List<PeriodSummary> archivedPeriods;
}
