package com.structurescout.observability;

import com.structurescout.domain.enums.DecisionSeverity;
import com.structurescout.domain.model.DecisionRecord;
import com.structurescout.entity.DecisionLogEntity;
import com.structurescout.mapper.DecisionLogMapper;
import com.structurescout.repository.jpa.DecisionLogJpaRepository;
import jakarta.annotation.PreDestroy;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.ListIterator;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.mapstruct.factory.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Async;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Async batch persistence of decision records with circuit breaker protection.
 *
 * <p>Records are queued by the {@code DecisionLogger} and flushed to the decision_log table on
 * {@code structurescout.decision-log.flush-interval-ms}. The audit trail is not on the gate's
 * critical path: unlike outcomes and admissions, a failed decision-log write never fails an
 * evaluation.
 *
 * <p>Circuit breaker: after {@value #FAILURE_THRESHOLD} consecutive failures the circuit opens
 * and flushes are skipped for {@value #RECOVERY_INTERVAL_MS}ms. A failed batch goes back to the
 * head of the queue so records are written in the order they were decided.
 *
 * <p>Backlog: while the database is down the queue is capped at {@code max-pending}. Over the cap
 * the oldest DEBUG and INFO records are dropped; WARNING and CRITICAL records (rejections,
 * breaches, halts, recovery) are always kept.
 *
 * <p>DEBUG-severity records are only persisted when persist-debug is enabled.
 */
@Service
public class DecisionArchiveService {

    private static final Logger log = LoggerFactory.getLogger(DecisionArchiveService.class);

    static final int FAILURE_THRESHOLD = 3;
    static final long RECOVERY_INTERVAL_MS = 60_000;
    static final int MAX_BATCH_SIZE = 200;

    private final DecisionLogJpaRepository decisionLogJpaRepository;
    private final DecisionLogMapper decisionLogMapper = Mappers.getMapper(DecisionLogMapper.class);

    private final ConcurrentLinkedDeque<DecisionRecord> pendingQueue = new ConcurrentLinkedDeque<>();
    private final AtomicInteger consecutiveFailures = new AtomicInteger(0);
    private final AtomicLong droppedCount = new AtomicLong(0);
    private final int maxPending;
    private final AtomicBoolean circuitOpen = new AtomicBoolean(false);
    private volatile long circuitOpenedAt = 0;

    private volatile boolean persistDebug;

    public DecisionArchiveService(
            DecisionLogJpaRepository decisionLogJpaRepository,
            @Value("${structurescout.decision-log.persist-debug:false}") boolean persistDebug,
            @Value("${structurescout.decision-log.max-pending:5000}") int maxPending) {
        this.decisionLogJpaRepository = decisionLogJpaRepository;
        this.persistDebug = persistDebug;
        this.maxPending = maxPending;
    }

    /** Queues a record for the next flush; DEBUG records are dropped unless persist-debug is on. */
    public void queue(DecisionRecord decisionRecord) {
        if (decisionRecord.getSeverity() == DecisionSeverity.DEBUG && !persistDebug) {
            return;
        }
        pendingQueue.addLast(decisionRecord);
        if (pendingQueue.size() > maxPending) {
            trimBacklog();
        }
    }

    /**
     * Writes up to {@value #MAX_BATCH_SIZE} pending records. A failed batch goes back on the queue.
     */
    @Scheduled(fixedRateString = "${structurescout.decision-log.flush-interval-ms:5000}")
    public void flush() {
        if (pendingQueue.isEmpty()) {
            return;
        }

        if (circuitOpen.get()) {
            if (System.currentTimeMillis() - circuitOpenedAt < RECOVERY_INTERVAL_MS) {
                log.debug("Circuit open, skipping flush. {} records queued.", pendingQueue.size());
                return;
            }
            log.info("Circuit breaker recovery attempt. {} records queued.", pendingQueue.size());
        }

        List<DecisionRecord> batch = new ArrayList<>(MAX_BATCH_SIZE);
        for (int i = 0; i < MAX_BATCH_SIZE; i++) {
            DecisionRecord record = pendingQueue.pollFirst();
            if (record == null) {
                break;
            }
            batch.add(record);
        }
        if (batch.isEmpty()) {
            return;
        }

        try {
            List<DecisionLogEntity> entities = decisionLogMapper.toEntityList(batch);
            decisionLogJpaRepository.saveAll(entities);

            if (circuitOpen.compareAndSet(true, false)) {
                log.info("Circuit breaker closed after successful flush");
            }
            consecutiveFailures.set(0);
            log.debug("Flushed {} decision records", batch.size());
        } catch (RuntimeException e) {
            int failures = consecutiveFailures.incrementAndGet();
            log.error(
                    "Failed to persist {} decision records (failure {}/{}): {}",
                    batch.size(),
                    failures,
                    FAILURE_THRESHOLD,
                    e.getMessage());

            if (failures >= FAILURE_THRESHOLD && circuitOpen.compareAndSet(false, true)) {
                circuitOpenedAt = System.currentTimeMillis();
                log.warn(
                        "Circuit breaker opened after {} consecutive failures, retrying in {}ms ({} queued)",
                        failures,
                        RECOVERY_INTERVAL_MS,
                        pendingQueue.size());
            }
            ListIterator<DecisionRecord> reversed = batch.listIterator(batch.size());
            while (reversed.hasPrevious()) {
                pendingQueue.addFirst(reversed.previous());
            }
            if (pendingQueue.size() > maxPending) {
                trimBacklog();
            }
        }
    }

    /** Drops the oldest DEBUG and INFO records until the queue is back under the cap. */
    private void trimBacklog() {
        int excess = pendingQueue.size() - maxPending;
        int dropped = 0;
        Iterator<DecisionRecord> it = pendingQueue.iterator();
        while (dropped < excess && it.hasNext()) {
            DecisionSeverity severity = it.next().getSeverity();
            if (severity == DecisionSeverity.DEBUG || severity == DecisionSeverity.INFO) {
                it.remove();
                dropped++;
            }
        }
        if (dropped > 0) {
            droppedCount.addAndGet(dropped);
            log.warn("Decision backlog over {}: dropped {} oldest DEBUG/INFO records", maxPending, dropped);
        }
    }

    /**
     * Flushes immediately, bypassing the circuit breaker.
     */
    @Async("eventExecutor")
    public void forceFlush() {
        drain();
    }

    @PreDestroy
    void drainOnShutdown() {
        log.info("Flushing {} pending decision records before shutdown", pendingQueue.size());
        drain();
    }

    private void drain() {
        circuitOpen.set(false);
        consecutiveFailures.set(0);
        int before;
        do {
            before = pendingQueue.size();
            flush();
        } while (!pendingQueue.isEmpty() && pendingQueue.size() < before && !circuitOpen.get());
    }

    // ---- Persist-debug toggle ----

    public boolean isPersistDebug() {
        return persistDebug;
    }

    public void setPersistDebug(boolean persistDebug) {
        this.persistDebug = persistDebug;
        log.info("Persist-debug toggled to: {}", persistDebug);
    }

    // ---- Circuit breaker state ----

    public boolean isCircuitOpen() {
        return circuitOpen.get();
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures.get();
    }

    public int getPendingCount() {
        return pendingQueue.size();
    }

    public long getDroppedCount() {
        return droppedCount.get();
    }

    public void resetCircuitBreaker() {
        circuitOpen.set(false);
        consecutiveFailures.set(0);
        log.info("Circuit breaker manually reset");
    }
}
