package com.structurescout.unit.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;

import com.structurescout.calendar.HolidayCalendarConfig;
import com.structurescout.calendar.TradingCalendarService;
import com.structurescout.domain.enums.DecisionOutcome;
import com.structurescout.domain.enums.DecisionSeverity;
import com.structurescout.domain.enums.DecisionSource;
import com.structurescout.domain.enums.DecisionType;
import com.structurescout.domain.enums.OperatingPhase;
import com.structurescout.domain.enums.ReasonCode;
import com.structurescout.domain.model.AdmissionDecision;
import com.structurescout.domain.model.DecisionRecord;
import com.structurescout.domain.model.OutcomeRecordResult;
import com.structurescout.domain.model.TradeOutcome;
import com.structurescout.event.DecisionLogEvent;
import com.structurescout.observability.DecisionArchiveService;
import com.structurescout.observability.DecisionLogger;
import com.structurescout.risk.RiskViolation;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

@ExtendWith(MockitoExtension.class)
class DecisionLoggerTest {

    /** 21:30 New York on Tuesday 2026-03-10; already Wednesday in UTC. */
    private static final Instant LATE_EVENING = Instant.parse("2026-03-11T01:30:00Z");

    @Mock
    private ApplicationEventPublisher eventPublisher;

    @Mock
    private DecisionArchiveService decisionArchiveService;

    private DecisionLogger decisionLogger;

    @BeforeEach
    void setUp() {
        decisionLogger = new DecisionLogger(
                eventPublisher, decisionArchiveService, new TradingCalendarService(new HolidayCalendarConfig()));
    }

    private static AdmissionDecision rejected(ReasonCode... codes) {
        List<RiskViolation> violations = Arrays.stream(codes)
                .map(code -> RiskViolation.of(code, code.name()))
                .toList();
        return AdmissionDecision.rejected(violations, "c-1", OperatingPhase.PAPER_TRADING, LATE_EVENING);
    }

    @Nested
    @DisplayName("Record shape")
    class RecordShape {

        @Test
        @DisplayName("Timestamp and session date are in the exchange time zone")
        void exchangeTime() {
            DecisionRecord record = decisionLogger.log(
                    LATE_EVENING,
                    DecisionSource.SYSTEM,
                    null,
                    DecisionType.STARTUP_RECOVERY,
                    DecisionOutcome.INFO,
                    "test",
                    Map.of(),
                    DecisionSeverity.INFO);

            assertThat(record.getTimestamp()).isEqualTo(LocalDateTime.of(2026, 3, 10, 21, 30));
            assertThat(record.getSessionDate()).isEqualTo(LocalDate.of(2026, 3, 10));
        }

        @Test
        @DisplayName("Every record is published and queued for the archive")
        void publishedAndQueued() {
            decisionLogger.logAdmission(
                    AdmissionDecision.admitted(2, List.of(), "c-9", OperatingPhase.MICRO_LIVE, LATE_EVENING), null);

            verify(eventPublisher).publishEvent(any(DecisionLogEvent.class));
            verify(decisionArchiveService).queue(any(DecisionRecord.class));
        }

        @Test
        @DisplayName("A failing listener does not fail the decision")
        void listenerFailureContained() {
            doThrow(new IllegalStateException("listener broke"))
                    .when(eventPublisher)
                    .publishEvent(any(DecisionLogEvent.class));

            decisionLogger.logAdmission(rejected(ReasonCode.OUTSIDE_SESSION), Map.of());

            assertThat(decisionLogger.getBufferSize()).isEqualTo(1);
            verify(decisionArchiveService).queue(any(DecisionRecord.class));
        }
    }

    @Nested
    @DisplayName("Admission severity")
    class AdmissionSeverity {

        @Test
        @DisplayName("Validation-only rejection is DEBUG")
        void validationDebug() {
            decisionLogger.logAdmission(rejected(ReasonCode.LOW_CONFIDENCE, ReasonCode.LOW_REWARD_RISK), Map.of());

            DecisionRecord record = decisionLogger.getRecentDecisions(1).get(0);
            assertThat(record.getSeverity()).isEqualTo(DecisionSeverity.DEBUG);
            assertThat(record.getDecisionType()).isEqualTo(DecisionType.CANDIDATE_REJECTED);
            assertThat(record.getReasoning()).contains("LOW_CONFIDENCE").contains("LOW_REWARD_RISK");
        }

        @Test
        @DisplayName("Malformed input is WARNING; gate rejection is INFO")
        void malformedAndGate() {
            decisionLogger.logAdmission(rejected(ReasonCode.MALFORMED_INPUT), Map.of());
            decisionLogger.logAdmission(rejected(ReasonCode.DAILY_LIMIT_BREACHED), Map.of());

            List<DecisionRecord> recent = decisionLogger.getRecentDecisions(2);
            assertThat(recent.get(1).getSeverity()).isEqualTo(DecisionSeverity.WARNING);
            assertThat(recent.get(0).getSeverity()).isEqualTo(DecisionSeverity.INFO);
        }

        @Test
        @DisplayName("Context carries phase, size and reason codes plus the caller's extras")
        void context() {
            decisionLogger.logAdmission(rejected(ReasonCode.NEWS_BLACKOUT), Map.of("setupType", "SWEEP"));

            Map<String, Object> context = decisionLogger.getDecisionsFor("c-1").get(0).getDataContext();
            assertThat(context)
                    .containsEntry("phase", OperatingPhase.PAPER_TRADING)
                    .containsEntry("size", 0)
                    .containsEntry("setupType", "SWEEP")
                    .containsKey("reasonCodes");
        }
    }

    @Nested
    @DisplayName("Other decisions")
    class OtherDecisions {

        @Test
        @DisplayName("Outcome rejection is logged as a WARNING from the ledger")
        void outcomeRejected() {
            TradeOutcome outcome = TradeOutcome.builder()
                    .correlationId("c-2")
                    .pnlFraction(new BigDecimal("-0.01"))
                    .realizedR(new BigDecimal("-1"))
                    .closedAt(LATE_EVENING)
                    .build();

            decisionLogger.logOutcome(outcome, OutcomeRecordResult.duplicate("c-2"), LATE_EVENING);

            DecisionRecord record = decisionLogger.getRecentDecisions(1, DecisionSource.RISK_LEDGER).get(0);
            assertThat(record.getDecisionType()).isEqualTo(DecisionType.OUTCOME_REJECTED);
            assertThat(record.getSeverity()).isEqualTo(DecisionSeverity.WARNING);
        }

        @Test
        @DisplayName("Phase advance is CRITICAL; a refused change is WARNING")
        void phaseChanges() {
            decisionLogger.logPhaseChange(
                    DecisionType.PHASE_ADVANCED,
                    OperatingPhase.OBSERVATION,
                    OperatingPhase.PAPER_TRADING,
                    "alice",
                    "Milestones met",
                    LATE_EVENING);
            decisionLogger.logPhaseChange(
                    DecisionType.PHASE_CHANGE_REFUSED,
                    OperatingPhase.PAPER_TRADING,
                    OperatingPhase.PAPER_TRADING,
                    null,
                    "Unauthorized advance request",
                    LATE_EVENING);

            List<DecisionRecord> recent = decisionLogger.getRecentDecisions(10, DecisionSource.PHASE_CONTROLLER);
            assertThat(recent).extracting(DecisionRecord::getSeverity)
                    .containsExactly(DecisionSeverity.WARNING, DecisionSeverity.CRITICAL);
        }
    }

    @Test
    @DisplayName("Ring buffer keeps the newest 1000 records")
    void ringBufferBounded() {
        for (int i = 0; i < 1005; i++) {
            decisionLogger.logSystemEvent(
                    DecisionType.STARTUP_RECOVERY, "event " + i, Map.of(), DecisionSeverity.INFO, LATE_EVENING);
        }

        assertThat(decisionLogger.getBufferSize()).isEqualTo(1000);
        assertThat(decisionLogger.getRecentDecisions(1).get(0).getReasoning()).isEqualTo("event 1004");
    }
}
