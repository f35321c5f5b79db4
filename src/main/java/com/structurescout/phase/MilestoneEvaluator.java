package com.structurescout.phase;

import com.structurescout.domain.enums.MilestoneCriterion;
import com.structurescout.domain.enums.OperatingPhase;
import com.structurescout.domain.model.AdvancementEvaluation;
import com.structurescout.domain.model.MilestoneCriteria;
import com.structurescout.domain.model.PerformanceMetrics;
import com.structurescout.domain.model.TradeOutcome;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Computes track-record metrics and compares them with a phase's milestone criteria.
 * Pure: no state, no I/O.
 */
@Component
public class MilestoneEvaluator {

    private static final int SCALE = 4;

    public AdvancementEvaluation evaluate(
            OperatingPhase phase,
            MilestoneCriteria criteria,
            List<TradeOutcome> outcomes,
            Instant phaseEnteredAt,
            Instant now) {
        PerformanceMetrics metrics = computeMetrics(outcomes, phaseEnteredAt, now);

        if (phase.next() == null || criteria == null) {
            return AdvancementEvaluation.builder()
                    .currentPhase(phase)
                    .targetPhase(null)
                    .eligible(false)
                    .unmetCriteria(List.of())
                    .criteria(null)
                    .metrics(metrics)
                    .evaluatedAt(now)
                    .build();
        }

        List<MilestoneCriterion> unmet = unmetCriteria(criteria, metrics);
        return AdvancementEvaluation.builder()
                .currentPhase(phase)
                .targetPhase(phase.next())
                .eligible(unmet.isEmpty())
                .unmetCriteria(unmet)
                .criteria(criteria)
                .metrics(metrics)
                .evaluatedAt(now)
                .build();
    }

    /**
     * Metrics over {@code outcomes}, which must be in sequence order.
     *
     * <p>Drawdown is the largest peak-to-trough fall of cumulative P&L, starting from a peak of
     * zero, so a losing first trade already counts as drawdown.
     */
    public PerformanceMetrics computeMetrics(List<TradeOutcome> outcomes, Instant phaseEnteredAt, Instant now) {
        int sampleSize = outcomes.size();
        int wins = 0;
        BigDecimal cumulative = BigDecimal.ZERO;
        BigDecimal peak = BigDecimal.ZERO;
        BigDecimal maxDrawdown = BigDecimal.ZERO;
        BigDecimal totalR = BigDecimal.ZERO;

        for (TradeOutcome outcome : outcomes) {
            if (outcome.isWin()) {
                wins++;
            }
            totalR = totalR.add(outcome.getRealizedR());
            cumulative = cumulative.add(outcome.getPnlFraction());
            peak = peak.max(cumulative);
            maxDrawdown = maxDrawdown.max(peak.subtract(cumulative));
        }

        BigDecimal accuracy = null;
        BigDecimal averageR = null;
        if (sampleSize > 0) {
            BigDecimal n = BigDecimal.valueOf(sampleSize);
            accuracy = BigDecimal.valueOf(wins).divide(n, SCALE, RoundingMode.HALF_UP);
            averageR = totalR.divide(n, SCALE, RoundingMode.HALF_UP);
        }

        long elapsedDays = phaseEnteredAt == null || now.isBefore(phaseEnteredAt)
                ? 0
                : Duration.between(phaseEnteredAt, now).toDays();

        return PerformanceMetrics.builder()
                .sampleSize(sampleSize)
                .wins(wins)
                .accuracy(accuracy)
                .maxDrawdown(maxDrawdown)
                .averageRMultiple(averageR)
                .totalPnl(cumulative)
                .elapsedDays(elapsedDays)
                .build();
    }

    /** Unmet criteria in declaration order. With no outcomes, accuracy and average R are unmet. */
    public List<MilestoneCriterion> unmetCriteria(MilestoneCriteria criteria, PerformanceMetrics metrics) {
        List<MilestoneCriterion> unmet = new ArrayList<>();
        if (metrics.getSampleSize() < criteria.getMinSampleSize()) {
            unmet.add(MilestoneCriterion.SAMPLE_SIZE);
        }
        if (metrics.getAccuracy() == null || metrics.getAccuracy().compareTo(criteria.getMinAccuracy()) < 0) {
            unmet.add(MilestoneCriterion.ACCURACY);
        }
        if (metrics.getMaxDrawdown().compareTo(criteria.getMaxDrawdown()) > 0) {
            unmet.add(MilestoneCriterion.DRAWDOWN);
        }
        if (metrics.getAverageRMultiple() == null
                || metrics.getAverageRMultiple().compareTo(criteria.getMinAverageRMultiple()) < 0) {
            unmet.add(MilestoneCriterion.AVERAGE_R_MULTIPLE);
        }
        if (metrics.getElapsedDays() < criteria.getMinElapsedDays()) {
            unmet.add(MilestoneCriterion.ELAPSED_TIME);
        }
        return unmet;
    }
}
