package com.structurescout.phase;

import com.structurescout.domain.enums.OperatingPhase;
import com.structurescout.domain.model.MilestoneCriteria;
import com.structurescout.exception.ConfigurationException;
import jakarta.annotation.PostConstruct;
import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.Map;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Per-phase milestone criteria, bound from {@code structurescout.phase.milestones.<PHASE>.*}.
 *
 * <p>The criteria attached to a phase are the ones that phase must clear to advance to the next.
 * FULL_LIVE has none. A phase missing from the configuration falls back to the defaults below.
 */
@Data
@Component
@ConfigurationProperties(prefix = "structurescout.phase")
public class MilestoneConfig {

    private Map<OperatingPhase, Milestone> milestones = new EnumMap<>(OperatingPhase.class);

    @PostConstruct
    public void validate() {
        for (OperatingPhase phase : OperatingPhase.values()) {
            if (phase.next() == null) {
                continue;
            }
            Milestone milestone = milestones.computeIfAbsent(phase, MilestoneConfig::defaultsFor);
            String prefix = "structurescout.phase.milestones." + phase + ".";
            if (milestone.getMinSampleSize() <= 0) {
                throw new ConfigurationException(
                        prefix + "min-sample-size", milestone.getMinSampleSize(), "must be positive");
            }
            requireFraction(prefix + "min-accuracy", milestone.getMinAccuracy());
            requireFraction(prefix + "max-drawdown", milestone.getMaxDrawdown());
            if (milestone.getMinAverageRMultiple() == null) {
                throw new ConfigurationException(prefix + "min-average-r-multiple", null, "is required");
            }
            if (milestone.getMinElapsedDays() < 0) {
                throw new ConfigurationException(
                        prefix + "min-elapsed-days", milestone.getMinElapsedDays(), "must not be negative");
            }
        }
    }

    /** Criteria the given phase must meet to advance, or null for FULL_LIVE. */
    public MilestoneCriteria criteriaFor(OperatingPhase phase) {
        if (phase.next() == null) {
            return null;
        }
        Milestone milestone = milestones.getOrDefault(phase, defaultsFor(phase));
        return MilestoneCriteria.builder()
                .minSampleSize(milestone.getMinSampleSize())
                .minAccuracy(milestone.getMinAccuracy())
                .maxDrawdown(milestone.getMaxDrawdown())
                .minAverageRMultiple(milestone.getMinAverageRMultiple())
                .minElapsedDays(milestone.getMinElapsedDays())
                .build();
    }

    static Milestone defaultsFor(OperatingPhase phase) {
        switch (phase) {
            case OBSERVATION:
                return new Milestone(20, new BigDecimal("0.40"), new BigDecimal("0.10"), BigDecimal.ZERO, 10);
            case PAPER_TRADING:
                return new Milestone(30, new BigDecimal("0.45"), new BigDecimal("0.06"), new BigDecimal("0.20"), 20);
            default:
                return new Milestone(40, new BigDecimal("0.50"), new BigDecimal("0.06"), new BigDecimal("0.30"), 30);
        }
    }

    private static void requireFraction(String property, BigDecimal value) {
        if (value == null || value.signum() < 0 || value.compareTo(BigDecimal.ONE) > 0) {
            throw new ConfigurationException(property, value, "must be in [0, 1]");
        }
    }

    @Data
    public static class Milestone {

        private int minSampleSize;
        private BigDecimal minAccuracy;

        /** Largest tolerated peak-to-trough drop of cumulative P&L, as a fraction of equity. */
        private BigDecimal maxDrawdown;

        private BigDecimal minAverageRMultiple;
        private int minElapsedDays;

        public Milestone() {}

        public Milestone(
                int minSampleSize,
                BigDecimal minAccuracy,
                BigDecimal maxDrawdown,
                BigDecimal minAverageRMultiple,
                int minElapsedDays) {
            this.minSampleSize = minSampleSize;
            this.minAccuracy = minAccuracy;
            this.maxDrawdown = maxDrawdown;
            this.minAverageRMultiple = minAverageRMultiple;
            this.minElapsedDays = minElapsedDays;
        }
    }
}
