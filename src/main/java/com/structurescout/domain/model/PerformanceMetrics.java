package com.structurescout.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Track-record statistics computed from a set of outcomes.
 * Accuracy and average R are null when there are no outcomes.
 */
@Getter
@Builder
@ToString
public class PerformanceMetrics {

    private final int sampleSize;
    private final int wins;
    private final BigDecimal accuracy;
    private final BigDecimal maxDrawdown;
    private final BigDecimal averageRMultiple;
    private final BigDecimal totalPnl;
    private final long elapsedDays;
}
