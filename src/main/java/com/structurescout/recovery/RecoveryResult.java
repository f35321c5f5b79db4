package com.structurescout.recovery;

import com.structurescout.domain.enums.OperatingPhase;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Data;

/**
 * Captures the outcome of the startup recovery sequence, one group of fields per step.
 */
@Data
@Builder
public class RecoveryResult {

    private boolean success;
    private long startedAt;
    private long durationMs;
    private String error;

    // Step 1: Account state
    private OperatingPhase phase;
    private boolean halted;

    // Step 2: Ledger replay
    private int outcomesReplayed;
    private BigDecimal dailyPnl;
    private BigDecimal weeklyPnl;
    private boolean dailyLimitBreached;
    private boolean weeklyLimitBreached;

    // Step 3: Admissions
    private int openAdmissions;
    private int admissionsExpired;
}
