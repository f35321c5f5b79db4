package com.structurescout.risk;

import com.structurescout.domain.enums.ReasonCode;
import com.structurescout.domain.model.SetupCandidate;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * First stage of the gate: structural and quality checks on a candidate, with no I/O.
 *
 * <p>A structurally malformed candidate short-circuits with a single MALFORMED_INPUT. Otherwise
 * the quality checks accumulate in fixed order: LOW_CONFIDENCE, LOW_REWARD_RISK,
 * EXCLUDED_SETUP_TYPE.
 */
@Component
public class SetupValidator {

    private final RiskLimitsConfig riskLimitsConfig;

    public SetupValidator(RiskLimitsConfig riskLimitsConfig) {
        this.riskLimitsConfig = riskLimitsConfig;
    }

    public RiskValidationResult validate(SetupCandidate candidate) {
        return validate(candidate, riskLimitsConfig);
    }

    public RiskValidationResult validate(SetupCandidate candidate, RiskLimitsConfig limits) {
        String malformed = findMalformation(candidate);
        if (malformed != null) {
            return RiskValidationResult.rejected(List.of(RiskViolation.of(ReasonCode.MALFORMED_INPUT, malformed)));
        }

        List<RiskViolation> violations = new ArrayList<>();

        BigDecimal confidence = BigDecimal.valueOf(candidate.getConfidence());
        if (confidence.compareTo(limits.getMinConfidence()) < 0) {
            violations.add(RiskViolation.of(
                    ReasonCode.LOW_CONFIDENCE,
                    "Confidence " + candidate.getConfidence() + " below minimum " + limits.getMinConfidence()));
        }

        BigDecimal rewardRisk = BigDecimal.valueOf(candidate.getRewardRiskRatio());
        if (rewardRisk.compareTo(limits.getMinRewardRisk()) < 0) {
            violations.add(RiskViolation.of(
                    ReasonCode.LOW_REWARD_RISK,
                    "R:R " + candidate.getRewardRiskRatio() + " below minimum " + limits.getMinRewardRisk()));
        }

        if (limits.isExcluded(candidate.getSetupType())) {
            violations.add(RiskViolation.of(
                    ReasonCode.EXCLUDED_SETUP_TYPE, "Setup type '" + candidate.getSetupType() + "' is excluded"));
        }

        return RiskValidationResult.of(violations);
    }

    /** Describes the first structural problem, or null if the candidate is well-formed. */
    private String findMalformation(SetupCandidate candidate) {
        if (candidate == null) {
            return "Candidate is missing";
        }
        if (candidate.getCorrelationId() == null || candidate.getCorrelationId().isBlank()) {
            return "Correlation id is missing";
        }
        if (candidate.getTimestamp() == null) {
            return "Timestamp is missing";
        }
        if (candidate.getDirection() == null) {
            return "Direction is missing";
        }
        if (!isFinite(candidate.getConfidence())) {
            return "Confidence is missing or not a number: " + candidate.getConfidence();
        }
        if (candidate.getConfidence() < 0 || candidate.getConfidence() > 1) {
            return "Confidence must be in [0, 1]: " + candidate.getConfidence();
        }
        if (!isFinite(candidate.getRewardRiskRatio())) {
            return "Reward:risk is missing or not a number: " + candidate.getRewardRiskRatio();
        }
        if (candidate.getRewardRiskRatio() < 0) {
            return "Reward:risk must not be negative: " + candidate.getRewardRiskRatio();
        }
        if (!isFinite(candidate.getStopDistance())) {
            return "Stop distance is missing or not a number: " + candidate.getStopDistance();
        }
        return null;
    }

    private static boolean isFinite(Double value) {
        return value != null && !value.isNaN() && !value.isInfinite();
    }
}
