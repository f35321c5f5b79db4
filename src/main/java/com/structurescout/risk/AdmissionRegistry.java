package com.structurescout.risk;

import com.structurescout.account.AccountStateService;
import com.structurescout.domain.enums.AdmissionStatus;
import com.structurescout.domain.model.Admission;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Tracks admitted candidates until their outcome arrives.
 *
 * <p>Open admissions count toward the trade caps and the open-position limit. An admission is
 * OPEN from the moment the gate admits it until its outcome is recorded (CLOSED) or its session
 * day ends without one (EXPIRED). Every admitted correlation id is remembered so that a second
 * evaluation of the same candidate is rejected as a duplicate.
 */
@Service
public class AdmissionRegistry {

    private static final Logger log = LoggerFactory.getLogger(AdmissionRegistry.class);

    private final RiskLedgerPersistenceService riskLedgerPersistenceService;
    private final AccountStateService accountStateService;

    /** Open admissions keyed by correlation id, in admission order. */
    private final Map<String, Admission> open = new LinkedHashMap<>();

    private final Set<String> admittedIds = new HashSet<>();

    public AdmissionRegistry(
            RiskLedgerPersistenceService riskLedgerPersistenceService, AccountStateService accountStateService) {
        this.riskLedgerPersistenceService = riskLedgerPersistenceService;
        this.accountStateService = accountStateService;
    }

    /** True if the correlation id was admitted before, whatever its current status. */
    public synchronized boolean isAdmitted(String correlationId) {
        return admittedIds.contains(correlationId);
    }

    /**
     * Persists and registers a new admission.
     *
     * @return false if the database already holds an admission with this correlation id
     */
    public synchronized boolean register(Admission admission) {
        Optional<Admission> saved = riskLedgerPersistenceService.saveAdmission(admission);
        admittedIds.add(admission.getCorrelationId());
        if (saved.isEmpty()) {
            return false;
        }
        open.put(admission.getCorrelationId(), saved.get());
        return true;
    }

    /**
     * Marks the matching open admission CLOSED. Unknown ids (outcomes for candidates admitted
     * before an expiry, or tracked outside the gate) are ignored.
     */
    public synchronized Optional<Admission> close(String correlationId, Instant closedAt) {
        Admission admission = open.get(correlationId);
        if (admission == null) {
            return Optional.empty();
        }
        Admission closed = copy(admission, AdmissionStatus.CLOSED, closedAt);
        riskLedgerPersistenceService.updateAdmissions(List.of(closed));
        open.remove(correlationId);
        return Optional.of(closed);
    }

    /**
     * Expires open admissions from session days before {@code sessionDate}.
     *
     * @return the number of admissions expired
     */
    public synchronized int expireBefore(LocalDate sessionDate, Instant now) {
        List<Admission> stale = new ArrayList<>();
        for (Admission admission : open.values()) {
            if (admission.getSessionDate().isBefore(sessionDate)) {
                stale.add(copy(admission, AdmissionStatus.EXPIRED, now));
            }
        }
        if (stale.isEmpty()) {
            return 0;
        }
        riskLedgerPersistenceService.updateAdmissions(stale);
        stale.forEach(a -> open.remove(a.getCorrelationId()));
        log.info("Expired {} open admissions from before {}", stale.size(), sessionDate);
        return stale.size();
    }

    public synchronized int openCount() {
        return open.size();
    }

    public synchronized List<Admission> getOpenAdmissions() {
        return List.copyOf(open.values());
    }

    /** Reloads state at startup: the open admissions plus every id admitted since {@code from}. */
    public synchronized void load(Collection<Admission> openAdmissions, Collection<Admission> recentAdmissions) {
        open.clear();
        admittedIds.clear();
        recentAdmissions.forEach(a -> admittedIds.add(a.getCorrelationId()));
        for (Admission admission : openAdmissions) {
            open.put(admission.getCorrelationId(), admission);
            admittedIds.add(admission.getCorrelationId());
        }
        log.info("Admission registry loaded: {} open, {} known ids", open.size(), admittedIds.size());
    }

    /** Looks up an admission regardless of status, falling back to the database. */
    public Optional<Admission> find(String correlationId) {
        synchronized (this) {
            Admission admission = open.get(correlationId);
            if (admission != null) {
                return Optional.of(admission);
            }
        }
        return riskLedgerPersistenceService.findAdmission(accountStateService.getAccountId(), correlationId);
    }

    private Admission copy(Admission admission, AdmissionStatus status, Instant closedAt) {
        return Admission.builder()
                .id(admission.getId())
                .accountId(admission.getAccountId())
                .correlationId(admission.getCorrelationId())
                .phase(admission.getPhase())
                .direction(admission.getDirection())
                .setupType(admission.getSetupType())
                .size(admission.getSize())
                .admittedAt(admission.getAdmittedAt())
                .sessionDate(admission.getSessionDate())
                .status(status)
                .closedAt(closedAt)
                .build();
    }
}
