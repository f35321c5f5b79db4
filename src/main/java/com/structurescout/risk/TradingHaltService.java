package com.structurescout.risk;

import com.structurescout.account.AccountStateService;
import com.structurescout.auth.OperatorAuthorizationService;
import com.structurescout.domain.enums.OperatorScope;
import com.structurescout.domain.model.AccountState;
import com.structurescout.event.RiskEvent;
import com.structurescout.event.RiskEventType;
import com.structurescout.event.RiskLevel;
import com.structurescout.exception.UnauthorizedException;
import com.structurescout.observability.DecisionLogger;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Account-wide trading halt.
 *
 * <p>While halted, the RiskGate rejects every candidate with TRADING_HALTED. The flag is persisted
 * with the account state, so a halt survives restarts. Halting needs no authorization (anything
 * may stop trading); resuming requires an operator token with the {@code halt:resume} scope.
 *
 * <p>Both operations are idempotent and run under the account lock.
 */
@Service
public class TradingHaltService {

    private static final Logger log = LoggerFactory.getLogger(TradingHaltService.class);

    private final AccountStateService accountStateService;
    private final OperatorAuthorizationService operatorAuthorizationService;
    private final DecisionLogger decisionLogger;
    private final ApplicationEventPublisher applicationEventPublisher;

    public TradingHaltService(
            AccountStateService accountStateService,
            OperatorAuthorizationService operatorAuthorizationService,
            DecisionLogger decisionLogger,
            ApplicationEventPublisher applicationEventPublisher) {
        this.accountStateService = accountStateService;
        this.operatorAuthorizationService = operatorAuthorizationService;
        this.decisionLogger = decisionLogger;
        this.applicationEventPublisher = applicationEventPublisher;
    }

    // ========================
    // HALT
    // ========================

    /**
     * Halts all new admissions for the account.
     *
     * @return true if trading was running and is now halted, false if it was already halted
     */
    public boolean halt(String reason, Instant now) {
        String haltReason = reason == null || reason.isBlank() ? "unspecified" : reason;
        return accountStateService.withLock(() -> {
            AccountState state = accountStateService.getState();
            if (state.isHalted()) {
                log.warn("Trading already halted ({}), ignoring halt: {}", state.getHaltReason(), haltReason);
                return false;
            }

            accountStateService.updateHalt(true, haltReason, now);
            log.error("TRADING HALTED for account {}: {}", state.getAccountId(), haltReason);

            Map<String, Object> details = Map.of("reason", haltReason, "phase", state.getPhase());
            decisionLogger.logHalt(true, state.getAccountId(), "Trading halted: " + haltReason, details, now);
            applicationEventPublisher.publishEvent(new RiskEvent(
                    this, RiskEventType.TRADING_HALTED, RiskLevel.CRITICAL, "Trading halted: " + haltReason, details));
            return true;
        });
    }

    // ========================
    // RESUME
    // ========================

    /**
     * Clears the halt.
     *
     * @return true if trading was halted and has resumed, false if it was not halted
     * @throws UnauthorizedException if the token does not carry the halt:resume scope
     */
    public boolean resume(String token, Instant now) {
        Optional<String> operator = operatorAuthorizationService.authorize(token, OperatorScope.HALT_RESUME, now);
        if (operator.isEmpty()) {
            throw new UnauthorizedException("A valid halt:resume operator token is required");
        }

        return accountStateService.withLock(() -> {
            AccountState state = accountStateService.getState();
            if (!state.isHalted()) {
                log.info("Resume requested by '{}' but trading is not halted", operator.get());
                return false;
            }

            accountStateService.updateHalt(false, null, now);
            log.warn(
                    "Trading resumed for account {} by '{}' (was halted: {})",
                    state.getAccountId(),
                    operator.get(),
                    state.getHaltReason());

            Map<String, Object> details = Map.of(
                    "operator", operator.get(),
                    "previousReason", state.getHaltReason() != null ? state.getHaltReason() : "");
            decisionLogger.logHalt(
                    false, state.getAccountId(), "Trading resumed by " + operator.get(), details, now);
            applicationEventPublisher.publishEvent(new RiskEvent(
                    this,
                    RiskEventType.TRADING_RESUMED,
                    RiskLevel.WARNING,
                    "Trading resumed by " + operator.get(),
                    details));
            return true;
        });
    }

    public boolean isHalted() {
        return accountStateService.getState().isHalted();
    }

    public String getHaltReason() {
        return accountStateService.getState().getHaltReason();
    }
}
