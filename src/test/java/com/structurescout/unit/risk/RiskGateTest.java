package com.structurescout.unit.risk;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.atLeast;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.structurescout.account.AccountStateService;
import com.structurescout.calendar.HolidayCalendarConfig;
import com.structurescout.calendar.TradabilityGate;
import com.structurescout.calendar.TradingCalendarService;
import com.structurescout.domain.enums.EventImpact;
import com.structurescout.domain.enums.OperatingPhase;
import com.structurescout.domain.enums.ReasonCode;
import com.structurescout.domain.enums.TradeDirection;
import com.structurescout.domain.model.AccountState;
import com.structurescout.domain.model.Admission;
import com.structurescout.domain.model.AdmissionDecision;
import com.structurescout.domain.model.OutcomeRecordResult;
import com.structurescout.domain.model.RiskStatus;
import com.structurescout.domain.model.SetupCandidate;
import com.structurescout.domain.model.TradeOutcome;
import com.structurescout.event.RiskEvent;
import com.structurescout.event.RiskEventType;
import com.structurescout.exception.PersistenceFailureException;
import com.structurescout.news.EventImpactClassifier;
import com.structurescout.news.NewsCalendarConfig;
import com.structurescout.news.NewsCalendarService;
import com.structurescout.observability.DecisionLogger;
import com.structurescout.risk.AdmissionRegistry;
import com.structurescout.risk.RiskGate;
import com.structurescout.risk.RiskLedger;
import com.structurescout.risk.RiskLedgerPersistenceService;
import com.structurescout.risk.RiskLimitsConfig;
import com.structurescout.risk.SetupValidator;
import com.structurescout.risk.TradingHaltService;
import com.structurescout.sizing.PositionSizer;
import com.structurescout.sizing.PositionSizingConfig;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEvent;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataAccessResourceFailureException;

/**
 * Unit tests for RiskGate. Ledger, registry, calendar, validator and sizer are real; persistence,
 * account state, halt service and the decision logger are mocked.
 */
@ExtendWith(MockitoExtension.class)
class RiskGateTest {

    /** Tuesday 2026-03-10, 10:00 New York. */
    private static final Instant TUESDAY_10AM = Instant.parse("2026-03-10T14:00:00Z");

    private static final Instant WEDNESDAY_10AM = Instant.parse("2026-03-11T14:00:00Z");

    @Mock
    private RiskLedgerPersistenceService persistenceService;

    @Mock
    private AccountStateService accountStateService;

    @Mock
    private TradingHaltService tradingHaltService;

    @Mock
    private DecisionLogger decisionLogger;

    @Mock
    private ApplicationEventPublisher eventPublisher;

    private RiskLimitsConfig limits;
    private TradingCalendarService calendar;
    private NewsCalendarService newsCalendarService;
    private RiskLedger ledger;
    private AdmissionRegistry admissionRegistry;
    private RiskGate riskGate;
    private final AtomicReference<AccountState> state = new AtomicReference<>();
    private final AtomicLong sequence = new AtomicLong();

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        limits = new RiskLimitsConfig();
        calendar = new TradingCalendarService(new HolidayCalendarConfig());
        NewsCalendarConfig newsConfig = new NewsCalendarConfig();
        newsConfig.setPreBufferMinutes(15);
        newsConfig.setPostBufferMinutes(15);
        newsCalendarService = new NewsCalendarService(newsConfig, new EventImpactClassifier(newsConfig), calendar);

        ledger = new RiskLedger(calendar, limits, persistenceService, accountStateService, eventPublisher);
        ledger.replay(List.of(), TUESDAY_10AM);
        admissionRegistry = new AdmissionRegistry(persistenceService, accountStateService);
        riskGate = gateOver(ledger);

        setPhase(OperatingPhase.MICRO_LIVE);
        lenient().when(accountStateService.getState()).thenAnswer(inv -> state.get());
        lenient().when(accountStateService.getAccountId()).thenReturn("acct-1");
        lenient()
                .when(accountStateService.withLock(any(Supplier.class)))
                .thenAnswer(inv -> ((Supplier<Object>) inv.getArgument(0)).get());
        lenient()
                .when(persistenceService.saveAdmission(any(Admission.class)))
                .thenAnswer(inv -> Optional.of(inv.getArgument(0)));
        lenient().when(persistenceService.updateAdmissions(anyList())).thenAnswer(inv -> inv.getArgument(0));
        lenient()
                .when(persistenceService.appendOutcome(any(TradeOutcome.class), anyString(), any(Instant.class)))
                .thenAnswer(inv -> {
                    TradeOutcome outcome = inv.getArgument(0);
                    return Optional.of(TradeOutcome.builder()
                            .correlationId(outcome.getCorrelationId())
                            .pnlFraction(outcome.getPnlFraction())
                            .realizedR(outcome.getRealizedR())
                            .closedAt(outcome.getClosedAt())
                            .sequence(sequence.incrementAndGet())
                            .build());
                });
    }

    private RiskGate gateOver(RiskLedger riskLedger) {
        return new RiskGate(
                new SetupValidator(limits),
                new TradabilityGate(calendar, newsCalendarService),
                calendar,
                riskLedger,
                admissionRegistry,
                new PositionSizer(new PositionSizingConfig()),
                tradingHaltService,
                accountStateService,
                limits,
                decisionLogger,
                eventPublisher);
    }

    private void setPhase(OperatingPhase phase) {
        state.set(AccountState.builder()
                .accountId("acct-1")
                .phase(phase)
                .phaseEnteredAt(TUESDAY_10AM.minusSeconds(86400L * 30))
                .equity(new BigDecimal("10000.00"))
                .halted(false)
                .build());
    }

    private static SetupCandidate candidate(String correlationId) {
        return SetupCandidate.builder()
                .timestamp(TUESDAY_10AM)
                .direction(TradeDirection.LONG)
                .confidence(0.80)
                .rewardRiskRatio(2.0)
                .stopDistance(50.0)
                .setupType("BREAK_AND_RETEST")
                .correlationId(correlationId)
                .build();
    }

    private static TradeOutcome loss(String correlationId, String pnl, Instant closedAt) {
        return TradeOutcome.builder()
                .correlationId(correlationId)
                .pnlFraction(new BigDecimal(pnl))
                .realizedR(new BigDecimal("-1.0"))
                .closedAt(closedAt)
                .build();
    }

    private List<RiskEventType> publishedRiskEvents() {
        ArgumentCaptor<ApplicationEvent> captor = ArgumentCaptor.forClass(ApplicationEvent.class);
        verify(eventPublisher, atLeast(0)).publishEvent(captor.capture());
        List<RiskEventType> types = new ArrayList<>();
        for (ApplicationEvent event : captor.getAllValues()) {
            if (event instanceof RiskEvent riskEvent) {
                types.add(riskEvent.getEventType());
            }
        }
        return types;
    }

    // ========================
    // ADMISSION
    // ========================

    @Nested
    @DisplayName("Admission")
    class Admitting {

        @Test
        @DisplayName("Valid candidate in MICRO_LIVE is admitted at the fixed micro size")
        void admittedMicroLive() {
            AdmissionDecision decision = riskGate.evaluate(candidate("c-1"), TUESDAY_10AM);

            assertThat(decision.isAdmitted()).isTrue();
            assertThat(decision.getSize()).isEqualTo(2);
            assertThat(decision.getViolations()).isEmpty();
            assertThat(admissionRegistry.openCount()).isEqualTo(1);
            verify(decisionLogger).logAdmission(eq(decision), anyMap());
        }

        @Test
        @DisplayName("OBSERVATION admits at size zero with PAPER_TRACKING_ONLY")
        void observationTracksOnly() {
            setPhase(OperatingPhase.OBSERVATION);

            AdmissionDecision decision = riskGate.evaluate(candidate("c-1"), TUESDAY_10AM);

            assertThat(decision.isAdmitted()).isTrue();
            assertThat(decision.getSize()).isZero();
            assertThat(decision.getReasonCodes()).containsExactly(ReasonCode.PAPER_TRACKING_ONLY);
        }

        @Test
        @DisplayName("Prior-day open admissions expire and stop counting")
        void priorDayAdmissionsExpire() {
            riskGate.evaluate(candidate("c-1"), TUESDAY_10AM);
            riskGate.evaluate(candidate("c-2"), TUESDAY_10AM);

            AdmissionDecision decision = riskGate.evaluate(candidate("c-3"), WEDNESDAY_10AM);

            assertThat(decision.isAdmitted()).isTrue();
            assertThat(admissionRegistry.getOpenAdmissions())
                    .extracting(Admission::getCorrelationId)
                    .containsExactly("c-3");
        }

        @Test
        @DisplayName("Recording the outcome closes the open admission")
        void outcomeClosesAdmission() {
            riskGate.evaluate(candidate("c-1"), TUESDAY_10AM);

            OutcomeRecordResult result =
                    riskGate.recordOutcome(loss("c-1", "-0.01", TUESDAY_10AM.plusSeconds(1800)), TUESDAY_10AM);

            assertThat(result.isRecorded()).isTrue();
            assertThat(admissionRegistry.openCount()).isZero();
            verify(decisionLogger).logOutcome(any(TradeOutcome.class), eq(result), eq(TUESDAY_10AM));
        }
    }

    // ========================
    // REJECTION ORDER
    // ========================

    @Nested
    @DisplayName("Rejections")
    class Rejections {

        @Test
        @DisplayName("Malformed candidate is rejected before anything else and never registered")
        void malformed() {
            state.set(state.get().toBuilder().halted(true).haltReason("manual").build());

            AdmissionDecision decision = riskGate.evaluate(
                    candidate("c-1").toBuilder().confidence(null).build(), TUESDAY_10AM);

            assertThat(decision.getReasonCodes()).containsExactly(ReasonCode.MALFORMED_INPUT);
            verify(persistenceService, never()).saveAdmission(any());
        }

        @Test
        @DisplayName("Confidence 0.5 against 0.65 is LOW_CONFIDENCE only; session and limits are never checked")
        void lowConfidenceShortCircuits() {
            riskGate.recordOutcome(loss("t-1", "-0.036", TUESDAY_10AM), TUESDAY_10AM);
            assertThat(ledger.isDailyLimitBreached()).isTrue();

            Instant wednesdayAfterClose = Instant.parse("2026-03-11T21:00:00Z");
            AdmissionDecision decision = riskGate.evaluate(
                    candidate("c-1").toBuilder().confidence(0.5).build(), wednesdayAfterClose);

            assertThat(decision.getReasonCodes()).containsExactly(ReasonCode.LOW_CONFIDENCE);
            assertThat(ledger.getDayKey()).isEqualTo(calendar.sessionDate(TUESDAY_10AM));
            assertThat(ledger.isDailyLimitBreached()).isTrue();
            verify(persistenceService, never()).saveAdmission(any());
        }

        @Test
        @DisplayName("Before the ledger is restored every valid candidate is RECOVERY_PENDING")
        void recoveryPending() {
            RiskLedger unrestored =
                    new RiskLedger(calendar, limits, persistenceService, accountStateService, eventPublisher);
            RiskGate gate = gateOver(unrestored);

            AdmissionDecision decision = gate.evaluate(candidate("c-1"), TUESDAY_10AM);

            assertThat(decision.isAdmitted()).isFalse();
            assertThat(decision.getReasonCodes()).containsExactly(ReasonCode.RECOVERY_PENDING);
            assertThat(unrestored.getDayKey()).isNull();
            verify(persistenceService, never()).saveAdmission(any());
        }

        @Test
        @DisplayName("Once replay has run the same candidate is admitted")
        void admittedAfterReplay() {
            RiskLedger unrestored =
                    new RiskLedger(calendar, limits, persistenceService, accountStateService, eventPublisher);
            RiskGate gate = gateOver(unrestored);
            gate.evaluate(candidate("c-1"), TUESDAY_10AM);

            unrestored.replay(List.of(), TUESDAY_10AM);

            assertThat(gate.evaluate(candidate("c-1"), TUESDAY_10AM).isAdmitted()).isTrue();
        }

        @Test
        @DisplayName("Halt wins over a closed session")
        void haltBeforeSession() {
            state.set(state.get().toBuilder().halted(true).haltReason("manual").build());

            AdmissionDecision decision =
                    riskGate.evaluate(candidate("c-1"), Instant.parse("2026-03-14T15:00:00Z"));

            assertThat(decision.getReasonCodes()).containsExactly(ReasonCode.TRADING_HALTED);
        }

        @Test
        @DisplayName("Second evaluation of an admitted correlation id is DUPLICATE_CANDIDATE")
        void duplicate() {
            riskGate.evaluate(candidate("c-1"), TUESDAY_10AM);

            AdmissionDecision again = riskGate.evaluate(candidate("c-1"), TUESDAY_10AM.plusSeconds(60));

            assertThat(again.getReasonCodes()).containsExactly(ReasonCode.DUPLICATE_CANDIDATE);
            verify(persistenceService, times(1)).saveAdmission(any());
        }

        @Test
        @DisplayName("Admission already stored in the database is DUPLICATE_CANDIDATE")
        void storedDuplicate() {
            when(persistenceService.saveAdmission(any(Admission.class))).thenReturn(Optional.empty());

            AdmissionDecision decision = riskGate.evaluate(candidate("c-1"), TUESDAY_10AM);

            assertThat(decision.getReasonCodes()).containsExactly(ReasonCode.DUPLICATE_CANDIDATE);
            assertThat(admissionRegistry.openCount()).isZero();
        }

        @Test
        @DisplayName("After the close the candidate is OUTSIDE_SESSION")
        void outsideSession() {
            AdmissionDecision decision = riskGate.evaluate(candidate("c-1"), Instant.parse("2026-03-10T21:00:00Z"));

            assertThat(decision.getReasonCodes()).containsExactly(ReasonCode.OUTSIDE_SESSION);
        }

        @Test
        @DisplayName("09:50 ET with a HIGH release at 10:00 ET is NEWS_BLACKOUT")
        void newsBlackout() {
            newsCalendarService.register("CPI m/m", TUESDAY_10AM, EventImpact.HIGH);

            AdmissionDecision decision =
                    riskGate.evaluate(candidate("c-1"), Instant.parse("2026-03-10T13:50:00Z"));

            assertThat(decision.getReasonCodes()).containsExactly(ReasonCode.NEWS_BLACKOUT);
        }

        @Test
        @DisplayName("$360 realized loss on $10,000 rejects with DAILY_LIMIT_BREACHED")
        void dailyLimitBreached() {
            riskGate.recordOutcome(loss("t-1", "-0.036", TUESDAY_10AM), TUESDAY_10AM);

            AdmissionDecision decision =
                    riskGate.evaluate(candidate("c-1"), TUESDAY_10AM.plusSeconds(600));

            assertThat(decision.getReasonCodes()).containsExactly(ReasonCode.DAILY_LIMIT_BREACHED);
        }

        @Test
        @DisplayName("Trade cap and open-position limit are reported together")
        void capsAccumulate() {
            riskGate.evaluate(candidate("c-1"), TUESDAY_10AM);
            riskGate.evaluate(candidate("c-2"), TUESDAY_10AM);
            riskGate.evaluate(candidate("c-3"), TUESDAY_10AM);

            AdmissionDecision fourth = riskGate.evaluate(candidate("c-4"), TUESDAY_10AM);

            assertThat(fourth.getReasonCodes())
                    .containsExactly(ReasonCode.DAILY_TRADE_CAP_REACHED, ReasonCode.MAX_OPEN_POSITIONS_REACHED);
            assertThat(publishedRiskEvents())
                    .containsExactly(RiskEventType.TRADE_CAP_REACHED, RiskEventType.MAX_POSITIONS_REACHED);
        }

        @Test
        @DisplayName("FULL_LIVE with a stop too wide for the risk budget is ZERO_SIZE")
        void zeroSize() {
            setPhase(OperatingPhase.FULL_LIVE);

            AdmissionDecision decision = riskGate.evaluate(
                    candidate("c-1").toBuilder().stopDistance(80.0).build(), TUESDAY_10AM);

            assertThat(decision.getReasonCodes()).containsExactly(ReasonCode.ZERO_SIZE);
            assertThat(admissionRegistry.openCount()).isZero();
        }
    }

    // ========================
    // OUTCOMES AND STATUS
    // ========================

    @Nested
    @DisplayName("Outcomes and status")
    class OutcomesAndStatus {

        @Test
        @DisplayName("Latching the weekly limit engages the halt")
        void weeklyBreachHalts() {
            riskGate.recordOutcome(loss("t-1", "-0.06", TUESDAY_10AM), TUESDAY_10AM);

            verify(tradingHaltService).halt(startsWith("Weekly loss limit breached"), eq(TUESDAY_10AM));
            verify(decisionLogger, times(2)).logLimitBreach(eq("acct-1"), anyString(), anyMap(), eq(TUESDAY_10AM));
        }

        @Test
        @DisplayName("Weekly breach does not halt when halt-on-weekly-breach is off")
        void weeklyBreachWithoutHalt() {
            limits.setHaltOnWeeklyBreach(false);

            riskGate.recordOutcome(loss("t-1", "-0.06", TUESDAY_10AM), TUESDAY_10AM);

            verify(tradingHaltService, never()).halt(anyString(), any());
        }

        @Test
        @DisplayName("An outcome without an open admission is recorded and its stored admission looked up")
        void outcomeWithoutOpenAdmission() {
            OutcomeRecordResult result = riskGate.recordOutcome(loss("x-1", "-0.01", TUESDAY_10AM), TUESDAY_10AM);

            assertThat(result.isRecorded()).isTrue();
            verify(persistenceService).findAdmission("acct-1", "x-1");
        }

        @Test
        @DisplayName("A failed admission update after a durable outcome still reports RECORDED")
        void admissionCloseFailureStillRecorded() {
            riskGate.evaluate(candidate("c-1"), TUESDAY_10AM);
            doThrow(new PersistenceFailureException(
                            "Failed to update admissions", new DataAccessResourceFailureException("db down")))
                    .when(persistenceService)
                    .updateAdmissions(anyList());

            OutcomeRecordResult result =
                    riskGate.recordOutcome(loss("c-1", "-0.01", TUESDAY_10AM.plusSeconds(600)), TUESDAY_10AM);

            assertThat(result.isRecorded()).isTrue();
            assertThat(admissionRegistry.openCount()).isEqualTo(1);
            assertThat(ledger.hasRecorded("c-1")).isTrue();
        }

        @Test
        @DisplayName("A failed halt write still reports RECORDED and the weekly latch keeps blocking entries")
        void haltFailureStillRecorded() {
            when(tradingHaltService.halt(anyString(), any(Instant.class)))
                    .thenThrow(new PersistenceFailureException(
                            "Failed to persist halt", new DataAccessResourceFailureException("db down")));

            OutcomeRecordResult result = riskGate.recordOutcome(loss("t-1", "-0.06", TUESDAY_10AM), TUESDAY_10AM);

            assertThat(result.isRecorded()).isTrue();
            assertThat(riskGate.evaluate(candidate("c-1"), TUESDAY_10AM.plusSeconds(60)).getReasonCodes())
                    .contains(ReasonCode.WEEKLY_LIMIT_BREACHED);
        }

        @Test
        @DisplayName("Status converts fractions to amounts and limit usage")
        void status() {
            riskGate.recordOutcome(loss("t-1", "-0.036", TUESDAY_10AM), TUESDAY_10AM);

            RiskStatus status = riskGate.getStatus(TUESDAY_10AM.plusSeconds(60));

            assertThat(status.getDailyPnlAmount()).isEqualByComparingTo("-360.00");
            assertThat(status.getDailyLimitUsedPct()).isEqualByComparingTo("120.0");
            assertThat(status.getWeeklyLimitUsedPct()).isEqualByComparingTo("60.0");
            assertThat(status.isDailyLimitBreached()).isTrue();
            assertThat(status.isCanTrade()).isFalse();
            assertThat(status.getTradesToday()).isEqualTo(1);
        }

        @Test
        @DisplayName("Status on the next day reports the rolled-over ledger")
        void statusRollsOver() {
            riskGate.recordOutcome(loss("t-1", "-0.036", TUESDAY_10AM), TUESDAY_10AM);

            RiskStatus status = riskGate.getStatus(WEDNESDAY_10AM);

            assertThat(status.getDailyPnl()).isEqualByComparingTo("0");
            assertThat(status.getDailyLimitUsedPct()).isEqualByComparingTo("0.0");
            assertThat(status.isCanTrade()).isTrue();
        }
    }
}
