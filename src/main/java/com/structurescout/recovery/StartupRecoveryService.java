package com.structurescout.recovery;

import com.structurescout.account.AccountStateService;
import com.structurescout.calendar.TradingCalendarService;
import com.structurescout.domain.enums.DecisionOutcome;
import com.structurescout.domain.enums.DecisionSeverity;
import com.structurescout.domain.enums.DecisionSource;
import com.structurescout.domain.enums.DecisionType;
import com.structurescout.domain.model.AccountState;
import com.structurescout.domain.model.Admission;
import com.structurescout.domain.model.TradeOutcome;
import com.structurescout.observability.DecisionLogger;
import com.structurescout.risk.AdmissionRegistry;
import com.structurescout.risk.RiskLedger;
import com.structurescout.risk.RiskLedgerPersistenceService;
import com.structurescout.risk.RiskLimitsConfig;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.stereotype.Service;

/**
 * Rebuilds engine state from the database once every singleton exists and before the embedded
 * web server starts, so no request reaches the gate ahead of the replay.
 *
 * <ol>
 *   <li>Load (or create) the account state: phase, equity, halt flag</li>
 *   <li>Replay the outcome log into the RiskLedger in sequence order</li>
 *   <li>Reload open admissions and the ids admitted within the lookback</li>
 *   <li>Expire open admissions left over from earlier session days</li>
 * </ol>
 *
 * <p>Unlike the rest of startup, a failure here is fatal: the gate must not run on aggregates
 * that do not match the log, so the exception is rethrown and the application stops.
 */
@Service
public class StartupRecoveryService implements SmartInitializingSingleton {

    private static final Logger log = LoggerFactory.getLogger(StartupRecoveryService.class);

    private final AccountStateService accountStateService;
    private final RiskLedger riskLedger;
    private final RiskLedgerPersistenceService riskLedgerPersistenceService;
    private final AdmissionRegistry admissionRegistry;
    private final TradingCalendarService tradingCalendarService;
    private final RiskLimitsConfig riskLimitsConfig;
    private final DecisionLogger decisionLogger;
    private final Clock clock;

    public StartupRecoveryService(
            AccountStateService accountStateService,
            RiskLedger riskLedger,
            RiskLedgerPersistenceService riskLedgerPersistenceService,
            AdmissionRegistry admissionRegistry,
            TradingCalendarService tradingCalendarService,
            RiskLimitsConfig riskLimitsConfig,
            DecisionLogger decisionLogger,
            Clock clock) {
        this.accountStateService = accountStateService;
        this.riskLedger = riskLedger;
        this.riskLedgerPersistenceService = riskLedgerPersistenceService;
        this.admissionRegistry = admissionRegistry;
        this.tradingCalendarService = tradingCalendarService;
        this.riskLimitsConfig = riskLimitsConfig;
        this.decisionLogger = decisionLogger;
        this.clock = clock;
    }

    @Override
    public void afterSingletonsInstantiated() {
        recover(clock.instant());
    }

    /**
     * Runs the recovery sequence under the account lock.
     */
    public RecoveryResult recover(Instant now) {
        log.info("Starting recovery sequence...");
        RecoveryResult recoveryResult =
                RecoveryResult.builder().startedAt(System.currentTimeMillis()).build();

        try {
            accountStateService.withLock(() -> {
                restoreAccount(recoveryResult, now);
                replayLedger(recoveryResult, now);
                restoreAdmissions(recoveryResult, now);
            });
            recoveryResult.setSuccess(true);
            log.info("Recovery sequence completed successfully");
        } catch (RuntimeException e) {
            recoveryResult.setSuccess(false);
            recoveryResult.setError(e.getMessage());
            log.error("Recovery sequence failed", e);
            throw e;
        } finally {
            recoveryResult.setDurationMs(System.currentTimeMillis() - recoveryResult.getStartedAt());
            logSummary(recoveryResult, now);
        }
        return recoveryResult;
    }

    void restoreAccount(RecoveryResult recoveryResult, Instant now) {
        AccountState state = accountStateService.load(now);
        recoveryResult.setPhase(state.getPhase());
        recoveryResult.setHalted(state.isHalted());
        if (state.isHalted()) {
            log.warn("Trading was halted before shutdown ({}); halt stays in force", state.getHaltReason());
        }
    }

    void replayLedger(RecoveryResult recoveryResult, Instant now) {
        List<TradeOutcome> outcomes = riskLedgerPersistenceService.loadOutcomes(accountStateService.getAccountId());
        riskLedger.replay(outcomes, now);
        recoveryResult.setOutcomesReplayed(outcomes.size());
        recoveryResult.setDailyPnl(riskLedger.getDailyPnl());
        recoveryResult.setWeeklyPnl(riskLedger.getWeeklyPnl());
        recoveryResult.setDailyLimitBreached(riskLedger.isDailyLimitBreached());
        recoveryResult.setWeeklyLimitBreached(riskLedger.isWeeklyLimitBreached());
    }

    void restoreAdmissions(RecoveryResult recoveryResult, Instant now) {
        String accountId = accountStateService.getAccountId();
        LocalDate today = tradingCalendarService.sessionDate(now);
        List<Admission> open = riskLedgerPersistenceService.loadOpenAdmissions(accountId);
        List<Admission> recent = riskLedgerPersistenceService.loadAdmissionsSince(
                accountId, today.minusWeeks(riskLimitsConfig.getLookbackWeeks()));
        admissionRegistry.load(open, recent);

        int expired = admissionRegistry.expireBefore(today, now);
        recoveryResult.setAdmissionsExpired(expired);
        recoveryResult.setOpenAdmissions(admissionRegistry.openCount());
    }

    private void logSummary(RecoveryResult recoveryResult, Instant now) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("success", recoveryResult.isSuccess());
        details.put("durationMs", recoveryResult.getDurationMs());
        details.put("phase", recoveryResult.getPhase());
        details.put("halted", recoveryResult.isHalted());
        details.put("outcomesReplayed", recoveryResult.getOutcomesReplayed());
        details.put("openAdmissions", recoveryResult.getOpenAdmissions());
        details.put("admissionsExpired", recoveryResult.getAdmissionsExpired());

        decisionLogger.log(
                now,
                DecisionSource.RECOVERY,
                accountStateService.getAccountId(),
                DecisionType.STARTUP_RECOVERY,
                recoveryResult.isSuccess() ? DecisionOutcome.INFO : DecisionOutcome.FAILED,
                String.format(
                        "Startup recovery %s: duration=%dms, outcomesReplayed=%d, dailyPnl=%s, weeklyPnl=%s, openAdmissions=%d, expired=%d",
                        recoveryResult.isSuccess() ? "completed" : "failed",
                        recoveryResult.getDurationMs(),
                        recoveryResult.getOutcomesReplayed(),
                        recoveryResult.getDailyPnl(),
                        recoveryResult.getWeeklyPnl(),
                        recoveryResult.getOpenAdmissions(),
                        recoveryResult.getAdmissionsExpired()),
                details,
                recoveryResult.isSuccess() ? DecisionSeverity.INFO : DecisionSeverity.CRITICAL);
    }
}
