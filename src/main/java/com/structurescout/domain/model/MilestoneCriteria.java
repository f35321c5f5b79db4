package com.structurescout.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Thresholds a phase's track record must clear before advancing to the next phase.
 * Fractions (accuracy, drawdown) are in [0, 1]; drawdown is a positive fraction of equity.
 */
@Getter
@Builder
@ToString
public class MilestoneCriteria {

    private final int minSampleSize;
    private final BigDecimal minAccuracy;
    private final BigDecimal maxDrawdown;
    private final BigDecimal minAverageRMultiple;
    private final int minElapsedDays;
}
