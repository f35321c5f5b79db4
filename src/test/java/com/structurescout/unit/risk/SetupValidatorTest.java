package com.structurescout.unit.risk;

import static org.assertj.core.api.Assertions.assertThat;

import com.structurescout.domain.enums.ReasonCode;
import com.structurescout.domain.enums.TradeDirection;
import com.structurescout.domain.model.SetupCandidate;
import com.structurescout.risk.RiskLimitsConfig;
import com.structurescout.risk.RiskValidationResult;
import com.structurescout.risk.RiskViolation;
import com.structurescout.risk.SetupValidator;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for SetupValidator: structural short-circuit and ordered quality checks.
 */
class SetupValidatorTest {

    private RiskLimitsConfig riskLimitsConfig;
    private SetupValidator setupValidator;

    @BeforeEach
    void setUp() {
        riskLimitsConfig = new RiskLimitsConfig();
        setupValidator = new SetupValidator(riskLimitsConfig);
    }

    private SetupCandidate.SetupCandidateBuilder validCandidate() {
        return SetupCandidate.builder()
                .timestamp(Instant.parse("2026-03-10T14:00:00Z"))
                .direction(TradeDirection.LONG)
                .confidence(0.80)
                .rewardRiskRatio(2.0)
                .stopDistance(50.0)
                .setupType("BREAK_AND_RETEST")
                .correlationId("c-1");
    }

    private List<ReasonCode> codes(RiskValidationResult result) {
        return result.getViolations().stream().map(RiskViolation::getCode).toList();
    }

    @Test
    @DisplayName("Well-formed candidate above every threshold is approved")
    void validCandidateApproved() {
        RiskValidationResult result = setupValidator.validate(validCandidate().build());

        assertThat(result.isApproved()).isTrue();
        assertThat(result.getViolations()).isEmpty();
    }

    @Test
    @DisplayName("Candidate exactly at the minimum confidence and R:R passes")
    void boundaryValuesPass() {
        RiskValidationResult result = setupValidator.validate(
                validCandidate().confidence(0.65).rewardRiskRatio(1.5).build());

        assertThat(result.isApproved()).isTrue();
    }

    @Nested
    @DisplayName("Quality checks")
    class QualityChecks {

        @Test
        @DisplayName("Confidence 0.5 against minimum 0.65 is rejected with LOW_CONFIDENCE only")
        void lowConfidence() {
            RiskValidationResult result = setupValidator.validate(validCandidate().confidence(0.5).build());

            assertThat(result.isRejected()).isTrue();
            assertThat(codes(result)).containsExactly(ReasonCode.LOW_CONFIDENCE);
        }

        @Test
        @DisplayName("Low R:R is rejected with LOW_REWARD_RISK")
        void lowRewardRisk() {
            RiskValidationResult result = setupValidator.validate(validCandidate().rewardRiskRatio(1.2).build());

            assertThat(codes(result)).containsExactly(ReasonCode.LOW_REWARD_RISK);
        }

        @Test
        @DisplayName("Excluded setup type matches case-insensitively")
        void excludedSetupType() {
            RiskValidationResult result = setupValidator.validate(validCandidate().setupType("NONE").build());

            assertThat(codes(result)).containsExactly(ReasonCode.EXCLUDED_SETUP_TYPE);
        }

        @Test
        @DisplayName("All quality failures accumulate in fixed order")
        void failuresAccumulateInOrder() {
            RiskValidationResult result = setupValidator.validate(validCandidate()
                    .confidence(0.3)
                    .rewardRiskRatio(0.5)
                    .setupType("none")
                    .build());

            assertThat(codes(result))
                    .containsExactly(
                            ReasonCode.LOW_CONFIDENCE, ReasonCode.LOW_REWARD_RISK, ReasonCode.EXCLUDED_SETUP_TYPE);
        }

        @Test
        @DisplayName("Per-call limits override the configured ones")
        void explicitLimitsUsed() {
            RiskLimitsConfig strict = new RiskLimitsConfig();
            strict.setMinConfidence(new java.math.BigDecimal("0.9"));

            RiskValidationResult result = setupValidator.validate(validCandidate().build(), strict);

            assertThat(codes(result)).containsExactly(ReasonCode.LOW_CONFIDENCE);
        }
    }

    @Nested
    @DisplayName("Malformed input")
    class MalformedInput {

        @Test
        @DisplayName("Null candidate is MALFORMED_INPUT")
        void nullCandidate() {
            assertThat(codes(setupValidator.validate(null))).containsExactly(ReasonCode.MALFORMED_INPUT);
        }

        @Test
        @DisplayName("NaN confidence short-circuits before the quality checks")
        void nanConfidenceShortCircuits() {
            RiskValidationResult result = setupValidator.validate(validCandidate()
                    .confidence(Double.NaN)
                    .rewardRiskRatio(0.1)
                    .setupType("none")
                    .build());

            assertThat(codes(result)).containsExactly(ReasonCode.MALFORMED_INPUT);
        }

        @Test
        @DisplayName("Missing correlation id, timestamp or direction is malformed")
        void missingIdentityFields() {
            assertThat(codes(setupValidator.validate(validCandidate().correlationId(" ").build())))
                    .containsExactly(ReasonCode.MALFORMED_INPUT);
            assertThat(codes(setupValidator.validate(validCandidate().timestamp(null).build())))
                    .containsExactly(ReasonCode.MALFORMED_INPUT);
            assertThat(codes(setupValidator.validate(validCandidate().direction(null).build())))
                    .containsExactly(ReasonCode.MALFORMED_INPUT);
        }

        @Test
        @DisplayName("Confidence above 1 and negative R:R are malformed, not low quality")
        void outOfRangeValues() {
            assertThat(codes(setupValidator.validate(validCandidate().confidence(1.2).build())))
                    .containsExactly(ReasonCode.MALFORMED_INPUT);
            assertThat(codes(setupValidator.validate(validCandidate().rewardRiskRatio(-1.0).build())))
                    .containsExactly(ReasonCode.MALFORMED_INPUT);
        }

        @Test
        @DisplayName("Infinite stop distance is malformed")
        void infiniteStop() {
            assertThat(codes(setupValidator.validate(
                            validCandidate().stopDistance(Double.POSITIVE_INFINITY).build())))
                    .containsExactly(ReasonCode.MALFORMED_INPUT);
        }
    }
}
