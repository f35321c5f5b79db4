package com.structurescout.risk;

import com.structurescout.exception.ConfigurationException;
import jakarta.annotation.PostConstruct;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Setup filters and loss/trade limits, bound from {@code structurescout.risk.*}.
 *
 * <p>Loss limits are positive fractions of equity: a daily limit of 0.03 blocks new entries once
 * the day's realized P&L reaches -3%. The warning fraction is relative to the limit (0.8 warns at
 * 80% of the daily limit).
 *
 * <p>Defaults follow the bot's live configuration:
 * <ul>
 *   <li>dailyLossLimit: 0.03, weeklyLossLimit: 0.06</li>
 *   <li>maxTradesPerDay: 3, maxTradesPerWeek: 12, maxOpenPositions: 3</li>
 *   <li>minConfidence: 0.65, minRewardRisk: 1.5</li>
 * </ul>
 */
@Data
@Component
@ConfigurationProperties(prefix = "structurescout.risk")
public class RiskLimitsConfig {

    // ==================== Setup Filters ====================

    /** Minimum model confidence, in [0, 1]. */
    private BigDecimal minConfidence = new BigDecimal("0.65");

    private BigDecimal minRewardRisk = new BigDecimal("1.5");

    /** Setup types that are never traded, matched case-insensitively. */
    private List<String> excludedSetupTypes = new ArrayList<>(List.of("none"));

    // ==================== Loss Limits ====================

    private BigDecimal dailyLossLimit = new BigDecimal("0.03");

    private BigDecimal weeklyLossLimit = new BigDecimal("0.06");

    /** Fraction of the daily limit at which admissions carry DAILY_LOSS_WARNING. */
    private BigDecimal dailyLossWarningThreshold = new BigDecimal("0.8");

    // ==================== Trade Caps ====================

    private int maxTradesPerDay = 3;

    private int maxTradesPerWeek = 12;

    private int maxOpenPositions = 3;

    // ==================== Ledger ====================

    /** How far back the ledger keeps outcomes for milestone evaluation. */
    private int lookbackWeeks = 12;

    /** Engage the trading halt automatically when the weekly loss limit is breached. */
    private boolean haltOnWeeklyBreach = true;

    @PostConstruct
    public void validate() {
        requireFraction("structurescout.risk.min-confidence", minConfidence, true);
        requireNonNegative("structurescout.risk.min-reward-risk", minRewardRisk);
        requireFraction("structurescout.risk.daily-loss-limit", dailyLossLimit, false);
        requireFraction("structurescout.risk.weekly-loss-limit", weeklyLossLimit, false);
        requireFraction("structurescout.risk.daily-loss-warning-threshold", dailyLossWarningThreshold, false);
        requirePositive("structurescout.risk.max-trades-per-day", maxTradesPerDay);
        requirePositive("structurescout.risk.max-trades-per-week", maxTradesPerWeek);
        requirePositive("structurescout.risk.max-open-positions", maxOpenPositions);
        requirePositive("structurescout.risk.lookback-weeks", lookbackWeeks);
        if (excludedSetupTypes == null) {
            excludedSetupTypes = new ArrayList<>();
        }
    }

    public boolean isExcluded(String setupType) {
        if (setupType == null) {
            return false;
        }
        String normalized = setupType.trim().toLowerCase(Locale.ROOT);
        return excludedSetupTypes.stream()
                .anyMatch(excluded -> excluded.trim().toLowerCase(Locale.ROOT).equals(normalized));
    }

    /** A fraction in (0, 1], or [0, 1] when zero is allowed. */
    static void requireFraction(String property, BigDecimal value, boolean zeroAllowed) {
        if (value == null
                || value.compareTo(BigDecimal.ONE) > 0
                || (zeroAllowed ? value.signum() < 0 : value.signum() <= 0)) {
            throw new ConfigurationException(property, value, zeroAllowed ? "must be in [0, 1]" : "must be in (0, 1]");
        }
    }

    static void requireNonNegative(String property, BigDecimal value) {
        if (value == null || value.signum() < 0) {
            throw new ConfigurationException(property, value, "must not be negative");
        }
    }

    static void requirePositive(String property, int value) {
        if (value <= 0) {
            throw new ConfigurationException(property, value, "must be positive");
        }
    }
}
