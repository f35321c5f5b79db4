package com.structurescout.risk;

import com.structurescout.account.AccountStateService;
import com.structurescout.calendar.TradabilityGate;
import com.structurescout.calendar.TradingCalendarService;
import com.structurescout.domain.enums.AdmissionStatus;
import com.structurescout.domain.enums.ReasonCode;
import com.structurescout.domain.model.AccountState;
import com.structurescout.domain.model.Admission;
import com.structurescout.domain.model.AdmissionDecision;
import com.structurescout.domain.model.OutcomeRecordResult;
import com.structurescout.domain.model.RiskStatus;
import com.structurescout.domain.model.SetupCandidate;
import com.structurescout.domain.model.TradeOutcome;
import com.structurescout.event.RiskEvent;
import com.structurescout.event.RiskEventType;
import com.structurescout.event.RiskLevel;
import com.structurescout.exception.PersistenceFailureException;
import com.structurescout.observability.DecisionLogger;
import com.structurescout.sizing.PositionSizer;
import com.structurescout.sizing.SizingResult;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Single entry point deciding whether a candidate may be acted upon, and at what size.
 *
 * <p><b>Evaluation order</b> (first failing stage wins, except where noted):
 * <ol>
 *   <li>Setup validation (quality checks accumulate)</li>
 *   <li>Ledger not yet restored, then trading halt</li>
 *   <li>Duplicate correlation id</li>
 *   <li>Session and news blackout (both reported when both fail)</li>
 *   <li>Ledger rollover and expiry of prior-day open admissions</li>
 *   <li>Daily and weekly loss latches, trade caps, open positions (accumulate)</li>
 *   <li>Position sizing at the current phase</li>
 *   <li>Durable registration of the admission</li>
 * </ol>
 *
 * <p>Rejections are returned, never thrown. The only exception that escapes is
 * PersistenceFailureException, when the admission (or an outcome) could not be written; in that
 * case no in-memory state has changed. Writes that follow a durable outcome (closing its
 * admission, engaging the weekly halt) are logged on failure and the outcome is still RECORDED.
 *
 * <p>{@link #evaluate} and {@link #recordOutcome} run under the account lock, so the
 * check-then-admit sequence cannot interleave with another evaluation or an outcome report.
 */
@Service
public class RiskGate {

    private static final Logger log = LoggerFactory.getLogger(RiskGate.class);

    private static final BigDecimal HUNDRED = new BigDecimal("100");

    private final SetupValidator setupValidator;
    private final TradabilityGate tradabilityGate;
    private final TradingCalendarService tradingCalendarService;
    private final RiskLedger riskLedger;
    private final AdmissionRegistry admissionRegistry;
    private final PositionSizer positionSizer;
    private final TradingHaltService tradingHaltService;
    private final AccountStateService accountStateService;
    private final RiskLimitsConfig riskLimitsConfig;
    private final DecisionLogger decisionLogger;
    private final ApplicationEventPublisher applicationEventPublisher;

    public RiskGate(
            SetupValidator setupValidator,
            TradabilityGate tradabilityGate,
            TradingCalendarService tradingCalendarService,
            RiskLedger riskLedger,
            AdmissionRegistry admissionRegistry,
            PositionSizer positionSizer,
            TradingHaltService tradingHaltService,
            AccountStateService accountStateService,
            RiskLimitsConfig riskLimitsConfig,
            DecisionLogger decisionLogger,
            ApplicationEventPublisher applicationEventPublisher) {
        this.setupValidator = setupValidator;
        this.tradabilityGate = tradabilityGate;
        this.tradingCalendarService = tradingCalendarService;
        this.riskLedger = riskLedger;
        this.admissionRegistry = admissionRegistry;
        this.positionSizer = positionSizer;
        this.tradingHaltService = tradingHaltService;
        this.accountStateService = accountStateService;
        this.riskLimitsConfig = riskLimitsConfig;
        this.decisionLogger = decisionLogger;
        this.applicationEventPublisher = applicationEventPublisher;
    }

    // ========================
    // EVALUATE
    // ========================

    /**
     * Evaluates a candidate at {@code now}.
     *
     * @throws com.structurescout.exception.PersistenceFailureException if an admission could not
     *     be persisted
     */
    public AdmissionDecision evaluate(SetupCandidate candidate, Instant now) {
        AdmissionDecision decision = accountStateService.withLock(() -> doEvaluate(candidate, now));
        decisionLogger.logAdmission(decision, candidateContext(candidate));
        return decision;
    }

    private AdmissionDecision doEvaluate(SetupCandidate candidate, Instant now) {
        AccountState state = accountStateService.getState();
        String correlationId = candidate != null ? candidate.getCorrelationId() : null;

        // Stage 1: setup validation
        RiskValidationResult validation = setupValidator.validate(candidate);
        if (validation.isRejected()) {
            if (validation.getViolations().get(0).getCode() == ReasonCode.MALFORMED_INPUT) {
                log.warn("Malformed candidate {}: {}", correlationId, validation.getViolations());
            } else {
                log.debug("Candidate {} failed validation: {}", correlationId, validation.getViolations());
            }
            return reject(validation.getViolations(), correlationId, state, now);
        }

        // Stage 2: system state
        if (!riskLedger.isRestored()) {
            log.warn("Candidate {} rejected: ledger not yet restored from the outcome log", correlationId);
            return reject(
                    List.of(RiskViolation.of(
                            ReasonCode.RECOVERY_PENDING, "Startup recovery has not completed")),
                    correlationId,
                    state,
                    now);
        }
        if (state.isHalted()) {
            log.info("Candidate {} rejected: trading halted ({})", correlationId, state.getHaltReason());
            return reject(
                    List.of(RiskViolation.of(ReasonCode.TRADING_HALTED, "Trading halted: " + state.getHaltReason())),
                    correlationId,
                    state,
                    now);
        }

        // Stage 3: duplicate
        if (admissionRegistry.isAdmitted(correlationId) || riskLedger.hasRecorded(correlationId)) {
            log.warn("Candidate {} rejected: correlation id already seen", correlationId);
            return reject(
                    List.of(RiskViolation.of(
                            ReasonCode.DUPLICATE_CANDIDATE, "Correlation id " + correlationId + " already admitted")),
                    correlationId,
                    state,
                    now);
        }

        // Stage 4: session and news
        RiskValidationResult tradability = tradabilityGate.isTradable(now);
        if (tradability.isRejected()) {
            log.info("Candidate {} rejected: {}", correlationId, tradability.getViolations());
            return reject(tradability.getViolations(), correlationId, state, now);
        }

        // Stage 5: rollover
        LocalDate today = tradingCalendarService.sessionDate(now);
        riskLedger.rollover(now);
        admissionRegistry.expireBefore(today, now);

        // Stage 6: limits
        RiskValidationResult limits = checkLimits(today);
        if (limits.isRejected()) {
            log.info("Candidate {} rejected: {}", correlationId, limits.getViolations());
            return reject(limits.getViolations(), correlationId, state, now);
        }

        // Stage 7: sizing
        SizingResult sizing = positionSizer.size(state.getPhase(), state.getEquity(), candidate.getStopDistance());
        if (sizing.isRejected()) {
            log.info("Candidate {} rejected by sizing: {}", correlationId, sizing.getViolation());
            return reject(List.of(sizing.getViolation()), correlationId, state, now);
        }

        // Stage 8: admit
        List<RiskViolation> diagnostics = new ArrayList<>();
        if (!state.getPhase().capitalAtRisk()) {
            diagnostics.add(RiskViolation.of(
                    ReasonCode.PAPER_TRACKING_ONLY, state.getPhase() + " tracks the setup without trading it"));
        }
        if (riskLedger.isDailyWarningReached()) {
            diagnostics.add(RiskViolation.of(
                    ReasonCode.DAILY_LOSS_WARNING,
                    "Daily P&L " + riskLedger.getDailyPnl() + " is past "
                            + riskLimitsConfig.getDailyLossWarningThreshold() + " of the limit"));
        }

        Admission admission = Admission.builder()
                .accountId(state.getAccountId())
                .correlationId(correlationId)
                .phase(state.getPhase())
                .direction(candidate.getDirection())
                .setupType(candidate.getSetupType())
                .size(sizing.getSize())
                .admittedAt(now)
                .sessionDate(today)
                .status(AdmissionStatus.OPEN)
                .build();
        if (!admissionRegistry.register(admission)) {
            log.warn("Candidate {} rejected: admission already stored", correlationId);
            return reject(
                    List.of(RiskViolation.of(
                            ReasonCode.DUPLICATE_CANDIDATE, "Correlation id " + correlationId + " already admitted")),
                    correlationId,
                    state,
                    now);
        }

        log.info(
                "Candidate {} ADMITTED: {} {} size={} phase={}",
                correlationId,
                candidate.getDirection(),
                candidate.getSetupType(),
                sizing.getSize(),
                state.getPhase());
        publishCapEvents(today);
        return AdmissionDecision.admitted(sizing.getSize(), diagnostics, correlationId, state.getPhase(), now);
    }

    // ========================
    // OUTCOMES
    // ========================

    /**
     * Records a realized outcome, closes its admission, and engages the halt when this outcome
     * latches the weekly loss limit and halt-on-weekly-breach is enabled.
     *
     * @throws com.structurescout.exception.PersistenceFailureException if the outcome could not
     *     be persisted
     */
    public OutcomeRecordResult recordOutcome(TradeOutcome outcome, Instant now) {
        OutcomeRecordResult result = accountStateService.withLock(() -> doRecordOutcome(outcome, now));
        decisionLogger.logOutcome(outcome, result, now);
        return result;
    }

    private OutcomeRecordResult doRecordOutcome(TradeOutcome outcome, Instant now) {
        riskLedger.rollover(now);
        boolean dailyBefore = riskLedger.isDailyLimitBreached();
        boolean weeklyBefore = riskLedger.isWeeklyLimitBreached();

        OutcomeRecordResult result = riskLedger.recordOutcome(outcome, now);
        if (!result.isRecorded()) {
            return result;
        }

        closeAdmission(outcome);

        if (!dailyBefore && riskLedger.isDailyLimitBreached()) {
            decisionLogger.logLimitBreach(
                    accountStateService.getAccountId(),
                    "Daily loss limit reached",
                    Map.of("dailyPnl", riskLedger.getDailyPnl(), "limit", riskLimitsConfig.getDailyLossLimit()),
                    now);
        }
        if (!weeklyBefore && riskLedger.isWeeklyLimitBreached()) {
            decisionLogger.logLimitBreach(
                    accountStateService.getAccountId(),
                    "Weekly loss limit reached",
                    Map.of("weeklyPnl", riskLedger.getWeeklyPnl(), "limit", riskLimitsConfig.getWeeklyLossLimit()),
                    now);
            if (riskLimitsConfig.isHaltOnWeeklyBreach()) {
                engageWeeklyHalt(now);
            }
        }
        return result;
    }

    /**
     * The outcome is already durable at this point, so a failed admission update is logged and the
     * admission stays OPEN until the next rollover or recovery expires it.
     */
    private void closeAdmission(TradeOutcome outcome) {
        String correlationId = outcome.getCorrelationId();
        try {
            if (admissionRegistry.close(correlationId, outcome.getClosedAt()).isPresent()) {
                return;
            }
        } catch (PersistenceFailureException e) {
            log.error("Outcome {} recorded but its admission could not be closed; left OPEN", correlationId, e);
            return;
        }
        Optional<Admission> known = admissionRegistry.find(correlationId);
        if (known.isPresent()) {
            log.warn("Outcome {} arrived for a {} admission; recorded anyway", correlationId, known.get().getStatus());
        } else {
            log.warn("Outcome {} has no admission; recorded anyway", correlationId);
        }
    }

    /** A failed halt write leaves the weekly latch in place, which still blocks new entries. */
    private void engageWeeklyHalt(Instant now) {
        try {
            tradingHaltService.halt("Weekly loss limit breached (" + riskLedger.getWeeklyPnl() + ")", now);
        } catch (PersistenceFailureException e) {
            log.error("Weekly loss limit latched but the halt could not be persisted", e);
        }
    }

    // ========================
    // STATUS
    // ========================

    /**
     * Point-in-time risk summary. Rolls the ledger forward to {@code now} first so that a status
     * read after midnight does not report yesterday's aggregates.
     */
    public RiskStatus getStatus(Instant now) {
        return accountStateService.withLock(() -> {
            riskLedger.rollover(now);
            AccountState state = accountStateService.getState();
            LocalDate today = tradingCalendarService.sessionDate(now);

            BigDecimal dailyPnl = riskLedger.getDailyPnl();
            BigDecimal weeklyPnl = riskLedger.getWeeklyPnl();
            boolean dailyBreached = riskLedger.isDailyLimitBreached();
            boolean weeklyBreached = riskLedger.isWeeklyLimitBreached();

            boolean canTrade = riskLedger.isRestored()
                    && !state.isHalted()
                    && tradingCalendarService.isSessionOpen(now)
                    && checkLimits(today).isApproved();

            return RiskStatus.builder()
                    .accountId(state.getAccountId())
                    .phase(state.getPhase())
                    .equity(state.getEquity())
                    .sessionDate(today)
                    .weekStart(tradingCalendarService.weekStart(today))
                    .dailyPnl(dailyPnl)
                    .dailyPnlAmount(toAmount(dailyPnl, state.getEquity()))
                    .weeklyPnl(weeklyPnl)
                    .weeklyPnlAmount(toAmount(weeklyPnl, state.getEquity()))
                    .tradesToday(riskLedger.getTradesToday() + openAdmissionsSince(today))
                    .tradesThisWeek(riskLedger.getTradesThisWeek()
                            + openAdmissionsSince(tradingCalendarService.weekStart(today)))
                    .openPositions(admissionRegistry.openCount())
                    .dailyLimitUsedPct(limitUsedPct(dailyPnl, riskLimitsConfig.getDailyLossLimit()))
                    .weeklyLimitUsedPct(limitUsedPct(weeklyPnl, riskLimitsConfig.getWeeklyLossLimit()))
                    .dailyLimitBreached(dailyBreached)
                    .weeklyLimitBreached(weeklyBreached)
                    .halted(state.isHalted())
                    .haltReason(state.getHaltReason())
                    .canTrade(canTrade)
                    .build();
        });
    }

    // ========================
    // INTERNALS
    // ========================

    private RiskValidationResult checkLimits(LocalDate today) {
        List<RiskViolation> violations = new ArrayList<>();

        if (riskLedger.isDailyLimitBreached()) {
            violations.add(RiskViolation.of(
                    ReasonCode.DAILY_LIMIT_BREACHED,
                    "Daily loss limit breached (pnl " + riskLedger.getDailyPnl() + ", limit -"
                            + riskLimitsConfig.getDailyLossLimit() + ")"));
        }
        if (riskLedger.isWeeklyLimitBreached()) {
            violations.add(RiskViolation.of(
                    ReasonCode.WEEKLY_LIMIT_BREACHED,
                    "Weekly loss limit breached (pnl " + riskLedger.getWeeklyPnl() + ", limit -"
                            + riskLimitsConfig.getWeeklyLossLimit() + ")"));
        }

        int tradesToday = riskLedger.getTradesToday() + openAdmissionsSince(today);
        if (tradesToday >= riskLimitsConfig.getMaxTradesPerDay()) {
            violations.add(RiskViolation.of(
                    ReasonCode.DAILY_TRADE_CAP_REACHED,
                    tradesToday + " trades today, cap " + riskLimitsConfig.getMaxTradesPerDay()));
        }

        int tradesThisWeek =
                riskLedger.getTradesThisWeek() + openAdmissionsSince(tradingCalendarService.weekStart(today));
        if (tradesThisWeek >= riskLimitsConfig.getMaxTradesPerWeek()) {
            violations.add(RiskViolation.of(
                    ReasonCode.WEEKLY_TRADE_CAP_REACHED,
                    tradesThisWeek + " trades this week, cap " + riskLimitsConfig.getMaxTradesPerWeek()));
        }

        int open = admissionRegistry.openCount();
        if (open >= riskLimitsConfig.getMaxOpenPositions()) {
            violations.add(RiskViolation.of(
                    ReasonCode.MAX_OPEN_POSITIONS_REACHED,
                    open + " open positions, max " + riskLimitsConfig.getMaxOpenPositions()));
        }

        return RiskValidationResult.of(violations);
    }

    private int openAdmissionsSince(LocalDate from) {
        return (int) admissionRegistry.getOpenAdmissions().stream()
                .filter(a -> !a.getSessionDate().isBefore(from))
                .count();
    }

    private void publishCapEvents(LocalDate today) {
        int tradesToday = riskLedger.getTradesToday() + openAdmissionsSince(today);
        if (tradesToday == riskLimitsConfig.getMaxTradesPerDay()) {
            applicationEventPublisher.publishEvent(new RiskEvent(
                    this,
                    RiskEventType.TRADE_CAP_REACHED,
                    RiskLevel.INFO,
                    "Daily trade cap reached",
                    Map.of("tradesToday", tradesToday, "limit", riskLimitsConfig.getMaxTradesPerDay())));
        }
        int open = admissionRegistry.openCount();
        if (open == riskLimitsConfig.getMaxOpenPositions()) {
            applicationEventPublisher.publishEvent(new RiskEvent(
                    this,
                    RiskEventType.MAX_POSITIONS_REACHED,
                    RiskLevel.INFO,
                    "Open position limit reached",
                    Map.of("openPositions", open, "limit", riskLimitsConfig.getMaxOpenPositions())));
        }
    }

    private AdmissionDecision reject(
            List<RiskViolation> violations, String correlationId, AccountState state, Instant now) {
        return AdmissionDecision.rejected(violations, correlationId, state.getPhase(), now);
    }

    private static Map<String, Object> candidateContext(SetupCandidate candidate) {
        Map<String, Object> context = new LinkedHashMap<>();
        if (candidate == null) {
            return context;
        }
        context.put("direction", candidate.getDirection());
        context.put("setupType", candidate.getSetupType());
        context.put("confidence", candidate.getConfidence());
        context.put("rewardRiskRatio", candidate.getRewardRiskRatio());
        context.put("stopDistance", candidate.getStopDistance());
        return context;
    }

    private static BigDecimal toAmount(BigDecimal fraction, BigDecimal equity) {
        return fraction.multiply(equity).setScale(2, RoundingMode.HALF_UP);
    }

    /** Share of the loss limit consumed, 0 when in profit. */
    private static BigDecimal limitUsedPct(BigDecimal pnl, BigDecimal limit) {
        if (pnl.signum() >= 0) {
            return BigDecimal.ZERO.setScale(1);
        }
        return pnl.negate().multiply(HUNDRED).divide(limit, 1, RoundingMode.HALF_UP);
    }
}
