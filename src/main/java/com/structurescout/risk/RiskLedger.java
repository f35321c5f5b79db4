package com.structurescout.risk;

import com.structurescout.account.AccountStateService;
import com.structurescout.calendar.TradingCalendarService;
import com.structurescout.domain.model.OutcomeRecordResult;
import com.structurescout.domain.model.PeriodSummary;
import com.structurescout.domain.model.RiskLedgerState;
import com.structurescout.domain.model.TradeOutcome;
import com.structurescout.event.RiskEvent;
import com.structurescout.event.RiskEventType;
import com.structurescout.event.RiskLevel;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Realized-P&L ledger: daily and weekly aggregates, trade counts, loss-limit latches and a
 * rolling window of outcomes for milestone evaluation.
 *
 * <p><b>Source of truth:</b> the append-only trade_outcome log. Aggregates are never persisted;
 * {@link #replay(List, Instant)} rebuilds them from the log at startup, applying outcomes in
 * sequence order so that the latches come out exactly as they were.
 *
 * <p><b>Buckets:</b> an outcome counts toward the session day and session week of its
 * {@code closedAt}, in the exchange time zone. A late report for an earlier period lands in the
 * window only. A report whose {@code closedAt} falls on a session day after the report time is
 * malformed.
 *
 * <p><b>Latches:</b> once an aggregate reaches {@code -limit} the breach flag stays set until
 * the period rolls over, even if later wins bring the aggregate back above the limit.
 *
 * <p><b>Thread safety:</b> methods are synchronized; multi-step sequences (rollover, check,
 * admit) additionally run under the account lock held by the RiskGate.
 */
@Service
public class RiskLedger {

    private static final Logger log = LoggerFactory.getLogger(RiskLedger.class);

    private final TradingCalendarService tradingCalendarService;
    private final RiskLimitsConfig riskLimitsConfig;
    private final RiskLedgerPersistenceService riskLedgerPersistenceService;
    private final AccountStateService accountStateService;
    private final ApplicationEventPublisher applicationEventPublisher;

    private LocalDate dayKey;
    private LocalDate weekKey;
    private BigDecimal dailyPnl = BigDecimal.ZERO;
    private BigDecimal weeklyPnl = BigDecimal.ZERO;
    private int tradesToday;
    private int tradesThisWeek;
    private boolean dailyLatched;
    private boolean weeklyLatched;
    private boolean dailyWarned;

    /** Set once the log has been replayed; until then the aggregates are not trustworthy. */
    private boolean restored;

    /** Outcomes within the lookback, in sequence order. */
    private final Deque<TradeOutcome> window = new ArrayDeque<>();

    /**
     * Correlation ids of outcomes in the window. Older duplicates are caught by the database
     * unique constraint.
     */
    private final Set<String> recordedIds = new HashSet<>();

    private final Deque<PeriodSummary> archive = new ArrayDeque<>();

    public RiskLedger(
            TradingCalendarService tradingCalendarService,
            RiskLimitsConfig riskLimitsConfig,
            RiskLedgerPersistenceService riskLedgerPersistenceService,
            AccountStateService accountStateService,
            ApplicationEventPublisher applicationEventPublisher) {
        this.tradingCalendarService = tradingCalendarService;
        this.riskLimitsConfig = riskLimitsConfig;
        this.riskLedgerPersistenceService = riskLedgerPersistenceService;
        this.accountStateService = accountStateService;
        this.applicationEventPublisher = applicationEventPublisher;
    }

    // ========================
    // RECORD OUTCOME
    // ========================

    /**
     * Records a realized outcome.
     *
     * <p>The outcome is persisted (and flushed) before any in-memory aggregate changes. A
     * duplicate correlation id, caught either by the in-memory id set or by the database unique
     * constraint, is rejected without touching the aggregates.
     *
     * @throws com.structurescout.exception.PersistenceFailureException if the write failed;
     *     the ledger is left unchanged
     */
    public synchronized OutcomeRecordResult recordOutcome(TradeOutcome outcome, Instant now) {
        String malformed = findMalformation(outcome, now);
        if (malformed != null) {
            log.warn("Rejected malformed outcome {}: {}", outcome != null ? outcome.getCorrelationId() : null, malformed);
            return OutcomeRecordResult.malformed(outcome != null ? outcome.getCorrelationId() : null, malformed);
        }

        if (recordedIds.contains(outcome.getCorrelationId())) {
            log.warn("Duplicate outcome report for {}", outcome.getCorrelationId());
            return OutcomeRecordResult.duplicate(outcome.getCorrelationId());
        }

        rollover(now);

        Optional<TradeOutcome> persisted =
                riskLedgerPersistenceService.appendOutcome(outcome, accountStateService.getAccountId(), now);
        if (persisted.isEmpty()) {
            recordedIds.add(outcome.getCorrelationId());
            return OutcomeRecordResult.duplicate(outcome.getCorrelationId());
        }

        TradeOutcome recorded = persisted.get();
        apply(recorded, true);
        log.info(
                "Outcome {} recorded (seq={}, pnl={}, R={}): daily={}, weekly={}",
                recorded.getCorrelationId(),
                recorded.getSequence(),
                recorded.getPnlFraction(),
                recorded.getRealizedR(),
                dailyPnl,
                weeklyPnl);
        return OutcomeRecordResult.recorded(recorded.getCorrelationId(), recorded.getSequence());
    }

    // ========================
    // ROLLOVER
    // ========================

    /**
     * Moves the day and week keys forward to the period containing {@code now}, archiving a
     * summary of each closed period and pruning outcomes older than the lookback. Never moves
     * backwards: an earlier {@code now} is a no-op.
     *
     * @return true if the session day changed
     */
    public synchronized boolean rollover(Instant now) {
        LocalDate today = tradingCalendarService.sessionDate(now);
        LocalDate thisWeek = tradingCalendarService.weekStart(today);

        if (dayKey == null) {
            dayKey = today;
            weekKey = thisWeek;
            return false;
        }
        if (!today.isAfter(dayKey)) {
            return false;
        }

        archive(PeriodSummary.PeriodType.DAY, dayKey, dailyPnl, tradesToday, dailyLatched);
        log.info("Session day rollover {} -> {} (closed day pnl={}, trades={})", dayKey, today, dailyPnl, tradesToday);
        dayKey = today;
        dailyPnl = BigDecimal.ZERO;
        tradesToday = 0;
        dailyLatched = false;
        dailyWarned = false;

        if (thisWeek.isAfter(weekKey)) {
            archive(PeriodSummary.PeriodType.WEEK, weekKey, weeklyPnl, tradesThisWeek, weeklyLatched);
            log.info("Session week rollover {} -> {} (closed week pnl={})", weekKey, thisWeek, weeklyPnl);
            weekKey = thisWeek;
            weeklyPnl = BigDecimal.ZERO;
            tradesThisWeek = 0;
            weeklyLatched = false;
        }

        prune(now);
        return true;
    }

    // ========================
    // REPLAY
    // ========================

    /**
     * Rebuilds every aggregate from the persisted log. Outcomes must be in sequence order.
     * Past periods inside the lookback are re-summarized into the archive.
     */
    public synchronized void replay(List<TradeOutcome> outcomes, Instant now) {
        dayKey = tradingCalendarService.sessionDate(now);
        weekKey = tradingCalendarService.weekStart(dayKey);
        dailyPnl = BigDecimal.ZERO;
        weeklyPnl = BigDecimal.ZERO;
        tradesToday = 0;
        tradesThisWeek = 0;
        dailyLatched = false;
        weeklyLatched = false;
        dailyWarned = false;
        window.clear();
        recordedIds.clear();
        archive.clear();

        for (TradeOutcome outcome : outcomes) {
            apply(outcome, false);
        }
        prune(now);
        rebuildArchive();
        restored = true;

        log.info(
                "Ledger replayed {} outcomes: day={} pnl={} trades={}, week={} pnl={} trades={}, latched={}/{}",
                outcomes.size(),
                dayKey,
                dailyPnl,
                tradesToday,
                weekKey,
                weeklyPnl,
                tradesThisWeek,
                dailyLatched,
                weeklyLatched);
    }

    // ========================
    // QUERIES
    // ========================

    public synchronized boolean isRestored() {
        return restored;
    }

    public synchronized boolean isDailyLimitBreached() {
        return dailyLatched;
    }

    public synchronized boolean isWeeklyLimitBreached() {
        return weeklyLatched;
    }

    /** True once the daily loss has passed the warning fraction of the daily limit. */
    public synchronized boolean isDailyWarningReached() {
        BigDecimal warnAt = riskLimitsConfig.getDailyLossLimit()
                .multiply(riskLimitsConfig.getDailyLossWarningThreshold())
                .negate();
        return dailyPnl.compareTo(warnAt) <= 0;
    }

    public synchronized BigDecimal getDailyPnl() {
        return dailyPnl;
    }

    public synchronized BigDecimal getWeeklyPnl() {
        return weeklyPnl;
    }

    public synchronized int getTradesToday() {
        return tradesToday;
    }

    public synchronized int getTradesThisWeek() {
        return tradesThisWeek;
    }

    public synchronized LocalDate getDayKey() {
        return dayKey;
    }

    public synchronized boolean hasRecorded(String correlationId) {
        return recordedIds.contains(correlationId);
    }

    /** Outcomes in the window closed at or after {@code since}, in sequence order. */
    public synchronized List<TradeOutcome> outcomesSince(Instant since) {
        return window.stream()
                .filter(o -> !o.getClosedAt().isBefore(since))
                .toList();
    }

    public synchronized List<TradeOutcome> getWindow() {
        return List.copyOf(window);
    }

    public synchronized RiskLedgerState snapshot() {
        return RiskLedgerState.builder()
                .dayKey(dayKey)
                .weekKey(weekKey)
                .dailyPnl(dailyPnl)
                .weeklyPnl(weeklyPnl)
                .tradesToday(tradesToday)
                .tradesThisWeek(tradesThisWeek)
                .dailyLimitBreached(dailyLatched)
                .weeklyLimitBreached(weeklyLatched)
                .windowSize(window.size())
                .lastSequence(window.isEmpty() ? null : window.peekLast().getSequence())
                .archivedPeriods(List.copyOf(archive))
                .build();
    }

    // ========================
    // INTERNALS
    // ========================

    private void apply(TradeOutcome outcome, boolean publish) {
        window.addLast(outcome);
        recordedIds.add(outcome.getCorrelationId());

        LocalDate closedDay = tradingCalendarService.sessionDate(outcome.getClosedAt());
        LocalDate closedWeek = tradingCalendarService.weekStart(closedDay);

        if (closedDay.equals(dayKey)) {
            dailyPnl = dailyPnl.add(outcome.getPnlFraction());
            tradesToday++;
            if (!dailyLatched && dailyPnl.compareTo(riskLimitsConfig.getDailyLossLimit().negate()) <= 0) {
                dailyLatched = true;
                log.warn("Daily loss limit reached: pnl={} limit={}", dailyPnl, riskLimitsConfig.getDailyLossLimit());
                if (publish) {
                    publishRiskEvent(
                            RiskEventType.DAILY_LOSS_LIMIT_BREACH,
                            RiskLevel.WARNING,
                            "Daily loss limit reached, no new entries until "
                                    + tradingCalendarService.getNextTradingDay(dayKey),
                            Map.of("dailyPnl", dailyPnl, "limit", riskLimitsConfig.getDailyLossLimit()));
                }
            } else if (!dailyLatched && !dailyWarned && isDailyWarningReached()) {
                dailyWarned = true;
                if (publish) {
                    publishRiskEvent(
                            RiskEventType.DAILY_LOSS_LIMIT_APPROACH,
                            RiskLevel.INFO,
                            "Daily loss approaching limit",
                            Map.of("dailyPnl", dailyPnl, "limit", riskLimitsConfig.getDailyLossLimit()));
                }
            }
        } else if (closedDay.isBefore(dayKey)) {
            log.debug("Outcome {} closed on earlier day {}; window only", outcome.getCorrelationId(), closedDay);
        }

        if (closedWeek.equals(weekKey)) {
            weeklyPnl = weeklyPnl.add(outcome.getPnlFraction());
            tradesThisWeek++;
            if (!weeklyLatched && weeklyPnl.compareTo(riskLimitsConfig.getWeeklyLossLimit().negate()) <= 0) {
                weeklyLatched = true;
                log.warn(
                        "Weekly loss limit reached: pnl={} limit={}", weeklyPnl, riskLimitsConfig.getWeeklyLossLimit());
                if (publish) {
                    publishRiskEvent(
                            RiskEventType.WEEKLY_LOSS_LIMIT_BREACH,
                            RiskLevel.CRITICAL,
                            "Weekly loss limit reached, no new entries until " + weekKey.plusWeeks(1),
                            Map.of("weeklyPnl", weeklyPnl, "limit", riskLimitsConfig.getWeeklyLossLimit()));
                }
            }
        }
    }

    private void prune(Instant now) {
        Instant cutoff = now.minus(Duration.ofDays(7L * riskLimitsConfig.getLookbackWeeks()));
        window.removeIf(o -> {
            if (o.getClosedAt().isBefore(cutoff)) {
                recordedIds.remove(o.getCorrelationId());
                return true;
            }
            return false;
        });
        LocalDate cutoffDay = tradingCalendarService.sessionDate(cutoff);
        archive.removeIf(s -> s.getPeriodKey().isBefore(cutoffDay));
    }

    private void archive(
            PeriodSummary.PeriodType type, LocalDate key, BigDecimal pnl, int trades, boolean breached) {
        archive.addLast(PeriodSummary.builder()
                .periodType(type)
                .periodKey(key)
                .realizedPnl(pnl)
                .tradeCount(trades)
                .limitBreached(breached)
                .build());
    }

    /** Summaries for every closed day and week still represented in the window. */
    private void rebuildArchive() {
        Map<LocalDate, List<TradeOutcome>> byDay = new LinkedHashMap<>();
        Map<LocalDate, List<TradeOutcome>> byWeek = new LinkedHashMap<>();
        for (TradeOutcome outcome : window) {
            LocalDate day = tradingCalendarService.sessionDate(outcome.getClosedAt());
            LocalDate week = tradingCalendarService.weekStart(day);
            if (day.isBefore(dayKey)) {
                byDay.computeIfAbsent(day, d -> new ArrayList<>()).add(outcome);
            }
            if (week.isBefore(weekKey)) {
                byWeek.computeIfAbsent(week, w -> new ArrayList<>()).add(outcome);
            }
        }
        List<PeriodSummary> summaries = new ArrayList<>();
        byDay.forEach((day, list) -> summaries.add(
                summarize(PeriodSummary.PeriodType.DAY, day, list, riskLimitsConfig.getDailyLossLimit())));
        byWeek.forEach((week, list) -> summaries.add(
                summarize(PeriodSummary.PeriodType.WEEK, week, list, riskLimitsConfig.getWeeklyLossLimit())));
        summaries.sort((a, b) -> a.getPeriodKey().compareTo(b.getPeriodKey()));
        archive.addAll(summaries);
    }

    private PeriodSummary summarize(
            PeriodSummary.PeriodType type, LocalDate key, List<TradeOutcome> outcomes, BigDecimal limit) {
        BigDecimal running = BigDecimal.ZERO;
        boolean breached = false;
        for (TradeOutcome outcome : outcomes) {
            running = running.add(outcome.getPnlFraction());
            breached |= running.compareTo(limit.negate()) <= 0;
        }
        return PeriodSummary.builder()
                .periodType(type)
                .periodKey(key)
                .realizedPnl(running)
                .tradeCount(outcomes.size())
                .limitBreached(breached)
                .build();
    }

    private String findMalformation(TradeOutcome outcome, Instant now) {
        if (outcome == null) {
            return "Outcome is missing";
        }
        if (outcome.getCorrelationId() == null || outcome.getCorrelationId().isBlank()) {
            return "Correlation id is missing";
        }
        if (outcome.getPnlFraction() == null) {
            return "P&L is missing";
        }
        if (outcome.getRealizedR() == null) {
            return "R multiple is missing";
        }
        if (outcome.getClosedAt() == null) {
            return "Close time is missing";
        }
        // No bucket exists yet for a later session day
        LocalDate closedDay = tradingCalendarService.sessionDate(outcome.getClosedAt());
        LocalDate reportedDay = tradingCalendarService.sessionDate(now);
        if (closedDay.isAfter(reportedDay)) {
            return "Close time " + outcome.getClosedAt() + " falls on session day " + closedDay + ", after " + reportedDay;
        }
        return null;
    }

    private void publishRiskEvent(
            RiskEventType eventType, RiskLevel level, String message, Map<String, Object> details) {
        applicationEventPublisher.publishEvent(new RiskEvent(this, eventType, level, message, details));
    }
}
