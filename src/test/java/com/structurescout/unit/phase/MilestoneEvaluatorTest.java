package com.structurescout.unit.phase;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.structurescout.domain.enums.MilestoneCriterion;
import com.structurescout.domain.enums.OperatingPhase;
import com.structurescout.domain.model.AdvancementEvaluation;
import com.structurescout.domain.model.MilestoneCriteria;
import com.structurescout.domain.model.PerformanceMetrics;
import com.structurescout.domain.model.TradeOutcome;
import com.structurescout.exception.ConfigurationException;
import com.structurescout.phase.MilestoneConfig;
import com.structurescout.phase.MilestoneEvaluator;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class MilestoneEvaluatorTest {

    private static final Instant NOW = Instant.parse("2026-03-10T21:00:00Z");

    private MilestoneEvaluator evaluator;
    private MilestoneConfig config;

    @BeforeEach
    void setUp() {
        evaluator = new MilestoneEvaluator();
        config = new MilestoneConfig();
        config.validate();
    }

    private static TradeOutcome outcome(String pnl, String r) {
        return TradeOutcome.builder()
                .correlationId("c-" + pnl + "-" + r)
                .pnlFraction(new BigDecimal(pnl))
                .realizedR(new BigDecimal(r))
                .closedAt(NOW.minus(Duration.ofDays(1)))
                .build();
    }

    /** {@code wins} winners of +1% / 2R followed by losers of -0.5% / -1R. */
    private static List<TradeOutcome> record(int wins, int losses) {
        List<TradeOutcome> outcomes = new ArrayList<>();
        for (int i = 0; i < wins; i++) {
            outcomes.add(outcome("0.01", "2.0"));
        }
        for (int i = 0; i < losses; i++) {
            outcomes.add(outcome("-0.005", "-1.0"));
        }
        return outcomes;
    }

    @Nested
    @DisplayName("Metrics")
    class Metrics {

        @Test
        @DisplayName("Accuracy and average R are rounded to four places")
        void accuracyAndAverageR() {
            PerformanceMetrics metrics = evaluator.computeMetrics(record(1, 2), NOW.minus(Duration.ofDays(3)), NOW);

            assertThat(metrics.getSampleSize()).isEqualTo(3);
            assertThat(metrics.getWins()).isEqualTo(1);
            assertThat(metrics.getAccuracy()).isEqualByComparingTo("0.3333");
            assertThat(metrics.getAverageRMultiple()).isEqualByComparingTo("0.0000");
            assertThat(metrics.getElapsedDays()).isEqualTo(3);
        }

        @Test
        @DisplayName("Drawdown is the largest fall from a running peak")
        void peakToTrough() {
            List<TradeOutcome> outcomes =
                    List.of(outcome("0.02", "2"), outcome("-0.05", "-1"), outcome("0.01", "1"));

            assertThat(evaluator.computeMetrics(outcomes, NOW, NOW).getMaxDrawdown()).isEqualByComparingTo("0.05");
        }

        @Test
        @DisplayName("A losing first trade counts as drawdown from zero")
        void drawdownFromZero() {
            assertThat(evaluator.computeMetrics(List.of(outcome("-0.01", "-1")), NOW, NOW).getMaxDrawdown())
                    .isEqualByComparingTo("0.01");
        }

        @Test
        @DisplayName("No outcomes leaves accuracy and average R undefined")
        void emptyRecord() {
            PerformanceMetrics metrics = evaluator.computeMetrics(List.of(), null, NOW);

            assertThat(metrics.getAccuracy()).isNull();
            assertThat(metrics.getAverageRMultiple()).isNull();
            assertThat(metrics.getElapsedDays()).isZero();
        }
    }

    @Nested
    @DisplayName("Eligibility")
    class Eligibility {

        @Test
        @DisplayName("10 good trades in OBSERVATION fail on sample size only")
        void sampleSizeOnly() {
            AdvancementEvaluation evaluation = evaluator.evaluate(
                    OperatingPhase.OBSERVATION,
                    config.criteriaFor(OperatingPhase.OBSERVATION),
                    record(10, 0),
                    NOW.minus(Duration.ofDays(15)),
                    NOW);

            assertThat(evaluation.isEligible()).isFalse();
            assertThat(evaluation.getTargetPhase()).isEqualTo(OperatingPhase.PAPER_TRADING);
            assertThat(evaluation.getUnmetCriteria()).containsExactly(MilestoneCriterion.SAMPLE_SIZE);
        }

        @Test
        @DisplayName("Meeting every OBSERVATION criterion is eligible")
        void eligible() {
            AdvancementEvaluation evaluation = evaluator.evaluate(
                    OperatingPhase.OBSERVATION,
                    config.criteriaFor(OperatingPhase.OBSERVATION),
                    record(10, 10),
                    NOW.minus(Duration.ofDays(11)),
                    NOW);

            assertThat(evaluation.isEligible()).isTrue();
            assertThat(evaluation.getUnmetCriteria()).isEmpty();
        }

        @Test
        @DisplayName("Every failing criterion is listed in declaration order")
        void allUnmet() {
            MilestoneCriteria strict = MilestoneCriteria.builder()
                    .minSampleSize(5)
                    .minAccuracy(new BigDecimal("0.90"))
                    .maxDrawdown(new BigDecimal("0.001"))
                    .minAverageRMultiple(new BigDecimal("3.0"))
                    .minElapsedDays(30)
                    .build();

            AdvancementEvaluation evaluation =
                    evaluator.evaluate(OperatingPhase.PAPER_TRADING, strict, record(1, 2), NOW, NOW);

            assertThat(evaluation.getUnmetCriteria())
                    .containsExactly(
                            MilestoneCriterion.SAMPLE_SIZE,
                            MilestoneCriterion.ACCURACY,
                            MilestoneCriterion.DRAWDOWN,
                            MilestoneCriterion.AVERAGE_R_MULTIPLE,
                            MilestoneCriterion.ELAPSED_TIME);
        }

        @Test
        @DisplayName("FULL_LIVE is terminal: no target and never eligible")
        void terminal() {
            AdvancementEvaluation evaluation = evaluator.evaluate(
                    OperatingPhase.FULL_LIVE,
                    config.criteriaFor(OperatingPhase.FULL_LIVE),
                    record(100, 0),
                    NOW.minus(Duration.ofDays(365)),
                    NOW);

            assertThat(evaluation.isTerminal()).isTrue();
            assertThat(evaluation.isEligible()).isFalse();
            assertThat(evaluation.getUnmetCriteria()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Milestone configuration")
    class Configuration {

        @Test
        @DisplayName("Defaults are filled in for every non-terminal phase")
        void defaults() {
            assertThat(config.criteriaFor(OperatingPhase.PAPER_TRADING).getMinSampleSize()).isEqualTo(30);
            assertThat(config.criteriaFor(OperatingPhase.MICRO_LIVE).getMinAccuracy()).isEqualByComparingTo("0.50");
            assertThat(config.criteriaFor(OperatingPhase.FULL_LIVE)).isNull();
        }

        @Test
        @DisplayName("Accuracy above 1 fails validation")
        void badAccuracy() {
            MilestoneConfig bad = new MilestoneConfig();
            bad.getMilestones().put(
                    OperatingPhase.OBSERVATION,
                    new MilestoneConfig.Milestone(20, new BigDecimal("1.5"), new BigDecimal("0.1"), BigDecimal.ZERO, 10));

            assertThatThrownBy(bad::validate)
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("min-accuracy");
        }
    }
}
