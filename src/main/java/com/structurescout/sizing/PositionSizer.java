package com.structurescout.sizing;

import com.structurescout.domain.enums.OperatingPhase;
import com.structurescout.domain.enums.ReasonCode;
import com.structurescout.risk.RiskViolation;
import java.math.BigDecimal;
import java.math.RoundingMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Phase-aware position sizing.
 *
 * <ul>
 *   <li>OBSERVATION, PAPER_TRADING: always 0, nothing goes to market</li>
 *   <li>MICRO_LIVE: the configured fixed size</li>
 *   <li>FULL_LIVE: {@code floor(equity * riskFraction / (stopDistance * contractRiskPerUnit))},
 *       capped at maxContracts</li>
 * </ul>
 *
 * <p>A live phase with a missing, NaN or non-positive stop distance yields INVALID_STOP; a
 * FULL_LIVE computation that floors to zero yields ZERO_SIZE. Pure arithmetic, no state.
 */
@Component
public class PositionSizer {

    private static final Logger log = LoggerFactory.getLogger(PositionSizer.class);

    private final PositionSizingConfig positionSizingConfig;

    public PositionSizer(PositionSizingConfig positionSizingConfig) {
        this.positionSizingConfig = positionSizingConfig;
    }

    public SizingResult size(OperatingPhase phase, BigDecimal equity, Double stopDistance) {
        return size(phase, equity, stopDistance, positionSizingConfig);
    }

    public SizingResult size(OperatingPhase phase, BigDecimal equity, Double stopDistance, PositionSizingConfig config) {
        if (!phase.capitalAtRisk()) {
            return SizingResult.of(0);
        }

        if (stopDistance == null || stopDistance.isNaN() || stopDistance.isInfinite() || stopDistance <= 0) {
            return SizingResult.rejected(
                    RiskViolation.of(ReasonCode.INVALID_STOP, "Stop distance must be a positive number: " + stopDistance));
        }

        if (phase == OperatingPhase.MICRO_LIVE) {
            return SizingResult.of(config.getMicroLiveFixedSize());
        }

        BigDecimal riskBudget = equity.multiply(config.getRiskFraction());
        BigDecimal riskPerContract = BigDecimal.valueOf(stopDistance).multiply(config.getContractRiskPerUnit());
        int contracts = riskBudget.divide(riskPerContract, 0, RoundingMode.FLOOR).intValue();
        int size = Math.max(0, Math.min(contracts, config.getMaxContracts()));

        log.debug(
                "FULL_LIVE sizing: equity={}, riskBudget={}, riskPerContract={}, raw={}, size={}",
                equity,
                riskBudget,
                riskPerContract,
                contracts,
                size);

        if (size == 0) {
            return SizingResult.rejected(RiskViolation.of(
                    ReasonCode.ZERO_SIZE,
                    String.format(
                            "Risk budget %s does not cover one contract at %s per contract",
                            riskBudget.setScale(2, RoundingMode.HALF_UP),
                            riskPerContract.setScale(2, RoundingMode.HALF_UP))));
        }
        return SizingResult.of(size);
    }
}
