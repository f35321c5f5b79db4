package com.structurescout.observability;

import com.structurescout.calendar.TradingCalendarService;
import com.structurescout.domain.enums.DecisionOutcome;
import com.structurescout.domain.enums.DecisionSeverity;
import com.structurescout.domain.enums.DecisionSource;
import com.structurescout.domain.enums.DecisionType;
import com.structurescout.domain.enums.OperatingPhase;
import com.structurescout.domain.enums.ReasonCategory;
import com.structurescout.domain.model.AdmissionDecision;
import com.structurescout.domain.model.AdvancementEvaluation;
import com.structurescout.domain.model.DecisionRecord;
import com.structurescout.domain.model.OutcomeRecordResult;
import com.structurescout.domain.model.TradeOutcome;
import com.structurescout.event.DecisionLogEvent;
import com.structurescout.risk.RiskViolation;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedDeque;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Structured audit trail of engine decisions.
 *
 * <p>Every gate evaluation, outcome report, phase decision and halt is captured as a
 * {@link DecisionRecord} carrying its reasoning and a data snapshot. Records go to:
 * <ul>
 *   <li>an in-memory ring buffer of the last {@value #RING_BUFFER_SIZE} decisions (newest first)</li>
 *   <li>a {@link DecisionLogEvent} for in-process listeners (metrics)</li>
 *   <li>the {@link DecisionArchiveService} queue for async persistence</li>
 * </ul>
 *
 * <p>Timestamps and session dates are in the exchange time zone.
 */
@Service
public class DecisionLogger {

    private static final Logger logger = LoggerFactory.getLogger(DecisionLogger.class);

    static final int RING_BUFFER_SIZE = 1000;

    private final ApplicationEventPublisher applicationEventPublisher;
    private final DecisionArchiveService decisionArchiveService;
    private final TradingCalendarService tradingCalendarService;

    private final ConcurrentLinkedDeque<DecisionRecord> ringBuffer = new ConcurrentLinkedDeque<>();

    public DecisionLogger(
            ApplicationEventPublisher applicationEventPublisher,
            DecisionArchiveService decisionArchiveService,
            TradingCalendarService tradingCalendarService) {
        this.applicationEventPublisher = applicationEventPublisher;
        this.decisionArchiveService = decisionArchiveService;
        this.tradingCalendarService = tradingCalendarService;
    }

    // ---- Core logging method ----

    public DecisionRecord log(
            Instant now,
            DecisionSource source,
            String sourceId,
            DecisionType decisionType,
            DecisionOutcome outcome,
            String reasoning,
            Map<String, Object> dataContext,
            DecisionSeverity severity) {

        DecisionRecord decisionRecord = DecisionRecord.builder()
                .timestamp(LocalDateTime.ofInstant(now, tradingCalendarService.getZoneId()))
                .source(source)
                .sourceId(sourceId)
                .decisionType(decisionType)
                .outcome(outcome)
                .reasoning(reasoning)
                .dataContext(dataContext)
                .severity(severity)
                .sessionDate(tradingCalendarService.sessionDate(now))
                .build();

        record(decisionRecord);
        return decisionRecord;
    }

    // ---- Gate decisions ----

    /**
     * Logs an admission or rejection. Validation-only rejections are DEBUG (routine filtering of
     * weak setups); gate rejections are INFO; malformed input is WARNING.
     */
    public void logAdmission(AdmissionDecision decision, Map<String, Object> extraContext) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("phase", decision.getPhase());
        context.put("size", decision.getSize());
        context.put("reasonCodes", decision.getReasonCodes());
        if (extraContext != null) {
            context.putAll(extraContext);
        }

        DecisionSeverity severity;
        if (decision.isAdmitted()) {
            severity = DecisionSeverity.INFO;
        } else if (decision.getReasonCodes().stream().anyMatch(c -> c.getCategory() == ReasonCategory.MALFORMED)) {
            severity = DecisionSeverity.WARNING;
        } else if (decision.getReasonCodes().stream()
                .allMatch(c -> c.getCategory() == ReasonCategory.VALIDATION)) {
            severity = DecisionSeverity.DEBUG;
        } else {
            severity = DecisionSeverity.INFO;
        }

        log(
                decision.getEvaluatedAt(),
                DecisionSource.RISK_GATE,
                decision.getCorrelationId(),
                decision.isAdmitted() ? DecisionType.CANDIDATE_ADMITTED : DecisionType.CANDIDATE_REJECTED,
                decision.isAdmitted() ? DecisionOutcome.ADMITTED : DecisionOutcome.REJECTED,
                summarize(decision.getViolations(), decision.isAdmitted() ? "Admitted" : "Rejected"),
                context,
                severity);
    }

    public void logOutcome(TradeOutcome outcome, OutcomeRecordResult result, Instant now) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("status", result.getStatus());
        if (outcome != null) {
            context.put("pnlFraction", outcome.getPnlFraction());
            context.put("realizedR", outcome.getRealizedR());
            context.put("closedAt", outcome.getClosedAt());
        }
        if (result.getSequence() != null) {
            context.put("sequence", result.getSequence());
        }

        log(
                now,
                DecisionSource.RISK_LEDGER,
                result.getCorrelationId(),
                result.isRecorded() ? DecisionType.OUTCOME_RECORDED : DecisionType.OUTCOME_REJECTED,
                result.isRecorded() ? DecisionOutcome.RECORDED : DecisionOutcome.REJECTED,
                result.getMessage(),
                context,
                result.isRecorded() ? DecisionSeverity.INFO : DecisionSeverity.WARNING);
    }

    public void logLimitBreach(String accountId, String reasoning, Map<String, Object> details, Instant now) {
        log(
                now,
                DecisionSource.RISK_LEDGER,
                accountId,
                DecisionType.LIMIT_BREACH,
                DecisionOutcome.INFO,
                reasoning,
                details,
                DecisionSeverity.WARNING);
    }

    // ---- Phase decisions ----

    public void logPhaseEvaluation(AdvancementEvaluation evaluation) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("eligible", evaluation.isEligible());
        context.put("unmetCriteria", evaluation.getUnmetCriteria());
        context.put("sampleSize", evaluation.getMetrics().getSampleSize());
        context.put("accuracy", evaluation.getMetrics().getAccuracy());
        context.put("maxDrawdown", evaluation.getMetrics().getMaxDrawdown());
        context.put("averageRMultiple", evaluation.getMetrics().getAverageRMultiple());
        context.put("elapsedDays", evaluation.getMetrics().getElapsedDays());

        log(
                evaluation.getEvaluatedAt(),
                DecisionSource.PHASE_CONTROLLER,
                evaluation.getCurrentPhase().name(),
                DecisionType.PHASE_EVALUATED,
                DecisionOutcome.INFO,
                evaluation.isEligible()
                        ? "Eligible for " + evaluation.getTargetPhase()
                        : "Not eligible: " + evaluation.getUnmetCriteria(),
                context,
                DecisionSeverity.DEBUG);
    }

    public void logPhaseChange(
            DecisionType decisionType,
            OperatingPhase from,
            OperatingPhase to,
            String operator,
            String reasoning,
            Instant now) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("from", from);
        context.put("to", to);
        context.put("operator", operator);

        boolean changed = decisionType == DecisionType.PHASE_ADVANCED || decisionType == DecisionType.PHASE_DOWNGRADED;
        log(
                now,
                DecisionSource.PHASE_CONTROLLER,
                from.name(),
                decisionType,
                changed ? DecisionOutcome.RECORDED : DecisionOutcome.REJECTED,
                reasoning,
                context,
                changed ? DecisionSeverity.CRITICAL : DecisionSeverity.WARNING);
    }

    // ---- Halt ----

    public void logHalt(boolean halted, String accountId, String reasoning, Map<String, Object> details, Instant now) {
        log(
                now,
                DecisionSource.TRADING_HALT,
                accountId,
                halted ? DecisionType.TRADING_HALTED : DecisionType.TRADING_RESUMED,
                DecisionOutcome.RECORDED,
                reasoning,
                details,
                DecisionSeverity.CRITICAL);
    }

    // ---- System events ----

    public void logSystemEvent(
            DecisionType decisionType,
            String reasoning,
            Map<String, Object> details,
            DecisionSeverity severity,
            Instant now) {
        log(now, DecisionSource.SYSTEM, null, decisionType, DecisionOutcome.INFO, reasoning, details, severity);
    }

    // ---- Ring buffer queries ----

    /**
     * Returns the most recent N decision records from the ring buffer, newest first.
     */
    public List<DecisionRecord> getRecentDecisions(int count) {
        return ringBuffer.stream().limit(count).toList();
    }

    public List<DecisionRecord> getRecentDecisions(int count, DecisionSource source) {
        return ringBuffer.stream()
                .filter(r -> r.getSource() == source)
                .limit(count)
                .toList();
    }

    /** Every buffered record for one correlation id, newest first. */
    public List<DecisionRecord> getDecisionsFor(String sourceId) {
        return ringBuffer.stream()
                .filter(r -> sourceId.equals(r.getSourceId()))
                .toList();
    }

    public int getBufferSize() {
        return ringBuffer.size();
    }

    // ---- Internal ----

    private void record(DecisionRecord decisionRecord) {
        ringBuffer.addFirst(decisionRecord);
        while (ringBuffer.size() > RING_BUFFER_SIZE) {
            ringBuffer.removeLast();
        }

        try {
            applicationEventPublisher.publishEvent(new DecisionLogEvent(this, decisionRecord));
        } catch (RuntimeException e) {
            // a failing listener must not fail the decision it observes
            logger.error("Failed to publish DecisionLogEvent: {}", e.getMessage());
        }

        decisionArchiveService.queue(decisionRecord);
    }

    private static String summarize(List<RiskViolation> violations, String verdict) {
        if (violations.isEmpty()) {
            return verdict;
        }
        return verdict + ": "
                + String.join("; ", violations.stream().map(RiskViolation::toString).toList());
    }
}
