package com.structurescout.observability;

import com.structurescout.account.AccountStateService;
import com.structurescout.domain.enums.DecisionType;
import com.structurescout.domain.model.DecisionRecord;
import com.structurescout.event.DecisionLogEvent;
import com.structurescout.event.PhaseEvent;
import com.structurescout.event.RiskEvent;
import com.structurescout.event.RiskEventType;
import com.structurescout.risk.AdmissionRegistry;
import com.structurescout.risk.RiskLedger;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Collection;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Registers and maintains the engine's Micrometer meters.
 *
 * <p>Counters:
 * <ul>
 *   <li>{@code structurescout.gate.admitted} / {@code structurescout.gate.rejected}, the latter
 *       tagged with the first reason code</li>
 *   <li>{@code structurescout.outcomes.recorded}</li>
 *   <li>{@code structurescout.risk.breaches}, tagged by event type</li>
 *   <li>{@code structurescout.phase.transitions}</li>
 * </ul>
 *
 * <p>Gauges: daily and weekly realized P&L fraction, open admissions, current phase ordinal and
 * the halt flag (1 = halted).
 */
@Service
public class CustomMetricsService {

    private static final Logger log = LoggerFactory.getLogger(CustomMetricsService.class);

    private final MeterRegistry meterRegistry;

    private final Counter admittedCounter;
    private final Counter outcomesRecordedCounter;
    private final Counter phaseTransitionCounter;
    private final Map<String, Counter> rejectedCounters = new ConcurrentHashMap<>();
    private final Map<RiskEventType, Counter> breachCounters = new ConcurrentHashMap<>();

    public CustomMetricsService(
            MeterRegistry meterRegistry,
            RiskLedger riskLedger,
            AdmissionRegistry admissionRegistry,
            AccountStateService accountStateService) {
        this.meterRegistry = meterRegistry;

        this.admittedCounter = Counter.builder("structurescout.gate.admitted")
                .description("Candidates admitted by the risk gate")
                .register(meterRegistry);
        this.outcomesRecordedCounter = Counter.builder("structurescout.outcomes.recorded")
                .description("Trade outcomes recorded in the ledger")
                .register(meterRegistry);
        this.phaseTransitionCounter = Counter.builder("structurescout.phase.transitions")
                .description("Operating phase transitions")
                .register(meterRegistry);

        meterRegistry.gauge(
                "structurescout.ledger.daily.pnl", riskLedger, l -> l.getDailyPnl().doubleValue());
        meterRegistry.gauge(
                "structurescout.ledger.weekly.pnl", riskLedger, l -> l.getWeeklyPnl().doubleValue());
        meterRegistry.gauge("structurescout.admissions.open", admissionRegistry, AdmissionRegistry::openCount);
        meterRegistry.gauge(
                "structurescout.phase.current", accountStateService, s -> s.getState().getPhase().ordinal());
        meterRegistry.gauge(
                "structurescout.trading.halted", accountStateService, s -> s.getState().isHalted() ? 1 : 0);
    }

    // ---- Event listeners ----

    @EventListener
    @Order(20)
    public void onDecisionLogEvent(DecisionLogEvent event) {
        DecisionRecord decisionRecord = event.getDecisionRecord();
        DecisionType type = decisionRecord.getDecisionType();
        if (type == DecisionType.CANDIDATE_ADMITTED) {
            admittedCounter.increment();
        } else if (type == DecisionType.CANDIDATE_REJECTED) {
            rejectedCounter(firstReason(decisionRecord)).increment();
        } else if (type == DecisionType.OUTCOME_RECORDED) {
            outcomesRecordedCounter.increment();
        }
    }

    @EventListener
    @Order(20)
    public void onRiskEvent(RiskEvent event) {
        switch (event.getEventType()) {
            case DAILY_LOSS_LIMIT_BREACH, WEEKLY_LOSS_LIMIT_BREACH, TRADING_HALTED -> breachCounters
                    .computeIfAbsent(event.getEventType(), t -> Counter.builder("structurescout.risk.breaches")
                            .description("Loss limit breaches and halts")
                            .tag("type", t.name())
                            .register(meterRegistry))
                    .increment();
            default -> log.debug("Risk event {} not counted", event.getEventType());
        }
    }

    @EventListener
    @Order(20)
    public void onPhaseEvent(PhaseEvent event) {
        phaseTransitionCounter.increment();
    }

    // ---- Internal ----

    private Counter rejectedCounter(String reason) {
        return rejectedCounters.computeIfAbsent(reason, r -> Counter.builder("structurescout.gate.rejected")
                .description("Candidates rejected by the risk gate")
                .tag("reason", r)
                .register(meterRegistry));
    }

    private static String firstReason(DecisionRecord decisionRecord) {
        if (decisionRecord.getDataContext() != null
                && decisionRecord.getDataContext().get("reasonCodes") instanceof Collection<?> codes
                && !codes.isEmpty()) {
            return String.valueOf(codes.iterator().next());
        }
        return "UNKNOWN";
    }
}
