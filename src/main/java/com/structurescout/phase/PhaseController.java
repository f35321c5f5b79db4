package com.structurescout.phase;

import com.structurescout.account.AccountStateService;
import com.structurescout.auth.OperatorAuthorizationService;
import com.structurescout.domain.enums.DecisionType;
import com.structurescout.domain.enums.OperatingPhase;
import com.structurescout.domain.enums.OperatorScope;
import com.structurescout.domain.enums.PhaseTransitionType;
import com.structurescout.domain.model.AccountState;
import com.structurescout.domain.model.AdvancementEvaluation;
import com.structurescout.domain.model.PhaseTransition;
import com.structurescout.domain.model.PhaseTransitionResult;
import com.structurescout.event.PhaseEligibilityEvent;
import com.structurescout.event.PhaseEvent;
import com.structurescout.observability.DecisionLogger;
import com.structurescout.risk.RiskLedger;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Owns the account's operating phase.
 *
 * <p>The phase only moves forward one step at a time, and only when both hold:
 * <ul>
 *   <li>the current phase's milestones are met by outcomes closed since the phase was entered</li>
 *   <li>the caller presents an operator token with the {@code phase:advance} scope</li>
 * </ul>
 * Eligibility alone never advances the phase; {@link #publishEligibilityReport} only informs the
 * operator. A downgrade to any strictly lower phase is an administrative override with its own
 * {@code phase:downgrade} scope and skips the milestone check.
 *
 * <p>Transitions are persisted together with their audit row before the new phase takes effect,
 * then announced with a {@link PhaseEvent}.
 */
@Service
public class PhaseController {

    private static final Logger log = LoggerFactory.getLogger(PhaseController.class);

    private final AccountStateService accountStateService;
    private final RiskLedger riskLedger;
    private final MilestoneEvaluator milestoneEvaluator;
    private final MilestoneConfig milestoneConfig;
    private final OperatorAuthorizationService operatorAuthorizationService;
    private final DecisionLogger decisionLogger;
    private final ApplicationEventPublisher applicationEventPublisher;
    private final Clock clock;

    public PhaseController(
            AccountStateService accountStateService,
            RiskLedger riskLedger,
            MilestoneEvaluator milestoneEvaluator,
            MilestoneConfig milestoneConfig,
            OperatorAuthorizationService operatorAuthorizationService,
            DecisionLogger decisionLogger,
            ApplicationEventPublisher applicationEventPublisher,
            Clock clock) {
        this.accountStateService = accountStateService;
        this.riskLedger = riskLedger;
        this.milestoneEvaluator = milestoneEvaluator;
        this.milestoneConfig = milestoneConfig;
        this.operatorAuthorizationService = operatorAuthorizationService;
        this.decisionLogger = decisionLogger;
        this.applicationEventPublisher = applicationEventPublisher;
        this.clock = clock;
    }

    // ========================
    // EVALUATION
    // ========================

    /**
     * Evaluates the current phase's track record against its milestones. Read-only.
     */
    public AdvancementEvaluation evaluateAdvancement(Instant now) {
        AccountState state = accountStateService.getState();
        AdvancementEvaluation evaluation = milestoneEvaluator.evaluate(
                state.getPhase(),
                milestoneConfig.criteriaFor(state.getPhase()),
                riskLedger.outcomesSince(state.getPhaseEnteredAt()),
                state.getPhaseEnteredAt(),
                now);
        decisionLogger.logPhaseEvaluation(evaluation);
        return evaluation;
    }

    /**
     * Evaluates and publishes a {@link PhaseEligibilityEvent} for the approval collaborator.
     */
    public AdvancementEvaluation publishEligibilityReport(Instant now) {
        AdvancementEvaluation evaluation = evaluateAdvancement(now);
        log.info(
                "Eligibility report: phase={}, eligible={}, unmet={}",
                evaluation.getCurrentPhase(),
                evaluation.isEligible(),
                evaluation.getUnmetCriteria());
        applicationEventPublisher.publishEvent(new PhaseEligibilityEvent(this, evaluation));
        return evaluation;
    }

    @Scheduled(
            cron = "${structurescout.phase.report-cron:0 30 16 * * MON-FRI}",
            zone = "${trading-calendar.timezone:America/New_York}")
    public void scheduledEligibilityReport() {
        if (accountStateService.getState().getPhase().next() == null) {
            return;
        }
        publishEligibilityReport(clock.instant());
    }

    // ========================
    // ADVANCE
    // ========================

    /**
     * Advances one phase if the token authorizes it and the milestones are met.
     * Authorization is checked first, so an unauthorized caller learns nothing about eligibility.
     */
    public PhaseTransitionResult advance(String token, Instant now) {
        return accountStateService.withLock(() -> {
            OperatingPhase current = accountStateService.getState().getPhase();

            Optional<String> operator =
                    operatorAuthorizationService.authorize(token, OperatorScope.PHASE_ADVANCE, now);
            if (operator.isEmpty()) {
                decisionLogger.logPhaseChange(
                        DecisionType.PHASE_CHANGE_REFUSED, current, current, null, "Unauthorized advance request", now);
                return PhaseTransitionResult.unauthorized(current, "A valid phase:advance operator token is required");
            }

            AdvancementEvaluation evaluation = evaluateAdvancement(now);
            if (!evaluation.isEligible()) {
                PhaseTransitionResult result = PhaseTransitionResult.notEligible(current, evaluation);
                log.info("Advance by '{}' refused: {}", operator.get(), result.getMessage());
                decisionLogger.logPhaseChange(
                        DecisionType.PHASE_CHANGE_REFUSED, current, current, operator.get(), result.getMessage(), now);
                return result;
            }

            PhaseTransition saved = transition(
                    current,
                    evaluation.getTargetPhase(),
                    PhaseTransitionType.ADVANCE,
                    operator.get(),
                    "Milestones met: " + evaluation.getMetrics(),
                    now);
            return PhaseTransitionResult.transitioned(saved, evaluation);
        });
    }

    // ========================
    // DOWNGRADE
    // ========================

    /**
     * Moves the account to a strictly lower phase. The phase's track record restarts from
     * {@code now}.
     */
    public PhaseTransitionResult downgrade(OperatingPhase target, String token, String reason, Instant now) {
        return accountStateService.withLock(() -> {
            OperatingPhase current = accountStateService.getState().getPhase();

            Optional<String> operator =
                    operatorAuthorizationService.authorize(token, OperatorScope.PHASE_DOWNGRADE, now);
            if (operator.isEmpty()) {
                decisionLogger.logPhaseChange(
                        DecisionType.PHASE_CHANGE_REFUSED,
                        current,
                        target != null ? target : current,
                        null,
                        "Unauthorized downgrade request",
                        now);
                return PhaseTransitionResult.unauthorized(
                        current, "A valid phase:downgrade operator token is required");
            }

            if (target == null || !target.isBefore(current)) {
                return PhaseTransitionResult.invalidTarget(
                        current, "Downgrade target must be below " + current + ", got " + target);
            }

            PhaseTransition saved = transition(
                    current,
                    target,
                    PhaseTransitionType.DOWNGRADE,
                    operator.get(),
                    reason != null && !reason.isBlank() ? reason : "Administrative downgrade",
                    now);
            return PhaseTransitionResult.transitioned(saved, null);
        });
    }

    // ========================
    // HISTORY
    // ========================

    /** Every transition for the account, newest first. */
    public List<PhaseTransition> getHistory() {
        return accountStateService.getTransitionHistory();
    }

    public OperatingPhase getCurrentPhase() {
        return accountStateService.getState().getPhase();
    }

    private PhaseTransition transition(
            OperatingPhase from,
            OperatingPhase to,
            PhaseTransitionType type,
            String operator,
            String reason,
            Instant now) {
        PhaseTransition saved = accountStateService.changePhase(PhaseTransition.builder()
                .accountId(accountStateService.getAccountId())
                .fromPhase(from)
                .toPhase(to)
                .transitionType(type)
                .authorizedBy(operator)
                .reason(reason)
                .transitionedAt(now)
                .build());

        log.warn("PHASE {}: {} -> {} authorized by '{}' ({})", type, from, to, operator, reason);
        decisionLogger.logPhaseChange(
                type == PhaseTransitionType.ADVANCE ? DecisionType.PHASE_ADVANCED : DecisionType.PHASE_DOWNGRADED,
                from,
                to,
                operator,
                reason,
                now);
        applicationEventPublisher.publishEvent(new PhaseEvent(this, type, from, to, operator, reason, now));
        return saved;
    }
}
