package com.structurescout.domain.model;

import com.structurescout.domain.enums.OperatingPhase;
import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Getter;

/**
 * Point-in-time risk summary for dashboards and the notification collaborator.
 * P&L values are fractions of equity; the *Amount fields convert them at current equity.
 */
@Getter
@Builder
public class RiskStatus {

    private final String accountId;
    private final OperatingPhase phase;
    private final BigDecimal equity;
    private final LocalDate sessionDate;
    private final LocalDate weekStart;
    private final BigDecimal dailyPnl;
    private final BigDecimal dailyPnlAmount;
    private final BigDecimal weeklyPnl;
    private final BigDecimal weeklyPnlAmount;
    private final int tradesToday;
    private final int tradesThisWeek;
    private final int openPositions;
    private final BigDecimal dailyLimitUsedPct;
    private final BigDecimal weeklyLimitUsedPct;
    private final boolean dailyLimitBreached;
    private final boolean weeklyLimitBreached;
    private final boolean halted;
    private final String haltReason;
    private final boolean canTrade;
}
