package com.structurescout.risk;

import com.structurescout.domain.enums.AdmissionStatus;
import com.structurescout.domain.model.Admission;
import com.structurescout.domain.model.TradeOutcome;
import com.structurescout.entity.AdmissionEntity;
import com.structurescout.entity.TradeOutcomeEntity;
import com.structurescout.exception.PersistenceFailureException;
import com.structurescout.mapper.AdmissionMapper;
import com.structurescout.mapper.TradeOutcomeMapper;
import com.structurescout.repository.jpa.AdmissionJpaRepository;
import com.structurescout.repository.jpa.TradeOutcomeJpaRepository;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import org.mapstruct.factory.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

/**
 * Write-through persistence for the risk ledger and the admission registry.
 *
 * <p>Every write is flushed before returning, so the caller only mutates its in-memory state
 * once the row is durable. A unique-constraint violation is reported as an empty result (the
 * caller turns it into DUPLICATE_OUTCOME / DUPLICATE_CANDIDATE); any other data access failure
 * becomes a {@link PersistenceFailureException}.
 */
@Service
public class RiskLedgerPersistenceService {

    private static final Logger log = LoggerFactory.getLogger(RiskLedgerPersistenceService.class);

    private final TradeOutcomeJpaRepository tradeOutcomeJpaRepository;
    private final AdmissionJpaRepository admissionJpaRepository;
    private final TradeOutcomeMapper tradeOutcomeMapper = Mappers.getMapper(TradeOutcomeMapper.class);
    private final AdmissionMapper admissionMapper = Mappers.getMapper(AdmissionMapper.class);

    public RiskLedgerPersistenceService(
            TradeOutcomeJpaRepository tradeOutcomeJpaRepository, AdmissionJpaRepository admissionJpaRepository) {
        this.tradeOutcomeJpaRepository = tradeOutcomeJpaRepository;
        this.admissionJpaRepository = admissionJpaRepository;
    }

    // ========================
    // TRADE OUTCOMES
    // ========================

    /**
     * Appends an outcome to the log.
     *
     * @return the persisted outcome carrying its sequence number, or empty if the
     *     (account, correlation id) pair already exists
     * @throws PersistenceFailureException if the write failed for any other reason
     */
    public Optional<TradeOutcome> appendOutcome(TradeOutcome outcome, String accountId, Instant recordedAt) {
        TradeOutcomeEntity entity = tradeOutcomeMapper.toEntity(outcome, accountId, recordedAt);
        try {
            TradeOutcomeEntity saved = tradeOutcomeJpaRepository.saveAndFlush(entity);
            return Optional.of(tradeOutcomeMapper.toDomain(saved));
        } catch (DataIntegrityViolationException e) {
            log.warn("Outcome {} already persisted for account {}", outcome.getCorrelationId(), accountId);
            return Optional.empty();
        } catch (DataAccessException e) {
            log.error("Failed to persist outcome {}: {}", outcome.getCorrelationId(), e.getMessage(), e);
            throw new PersistenceFailureException("Failed to persist outcome " + outcome.getCorrelationId(), e);
        }
    }

    /** All outcomes of the account in sequence order. */
    public List<TradeOutcome> loadOutcomes(String accountId) {
        try {
            return tradeOutcomeMapper.toDomainList(tradeOutcomeJpaRepository.findByAccountIdOrderByIdAsc(accountId));
        } catch (DataAccessException e) {
            log.error("Failed to load outcomes for account {}: {}", accountId, e.getMessage(), e);
            throw new PersistenceFailureException("Failed to load outcomes for account " + accountId, e);
        }
    }

    // ========================
    // ADMISSIONS
    // ========================

    /**
     * Inserts a new admission.
     *
     * @return the persisted admission with its id, or empty if the correlation id was already admitted
     */
    public Optional<Admission> saveAdmission(Admission admission) {
        try {
            AdmissionEntity saved = admissionJpaRepository.saveAndFlush(admissionMapper.toEntity(admission));
            return Optional.of(admissionMapper.toDomain(saved));
        } catch (DataIntegrityViolationException e) {
            log.warn("Candidate {} was already admitted", admission.getCorrelationId());
            return Optional.empty();
        } catch (DataAccessException e) {
            log.error("Failed to persist admission {}: {}", admission.getCorrelationId(), e.getMessage(), e);
            throw new PersistenceFailureException("Failed to persist admission " + admission.getCorrelationId(), e);
        }
    }

    /** Updates the status of existing admissions (close or expire). */
    public List<Admission> updateAdmissions(List<Admission> admissions) {
        try {
            List<AdmissionEntity> saved = admissionJpaRepository.saveAllAndFlush(
                    admissions.stream().map(admissionMapper::toEntity).toList());
            return admissionMapper.toDomainList(saved);
        } catch (DataAccessException e) {
            log.error("Failed to update {} admissions: {}", admissions.size(), e.getMessage(), e);
            throw new PersistenceFailureException("Failed to update admissions", e);
        }
    }

    public Optional<Admission> findAdmission(String accountId, String correlationId) {
        try {
            return admissionJpaRepository
                    .findByAccountIdAndCorrelationId(accountId, correlationId)
                    .map(admissionMapper::toDomain);
        } catch (DataAccessException e) {
            throw new PersistenceFailureException("Failed to look up admission " + correlationId, e);
        }
    }

    public List<Admission> loadOpenAdmissions(String accountId) {
        try {
            return admissionMapper.toDomainList(
                    admissionJpaRepository.findByAccountIdAndStatus(accountId, AdmissionStatus.OPEN));
        } catch (DataAccessException e) {
            throw new PersistenceFailureException("Failed to load open admissions for account " + accountId, e);
        }
    }

    public List<Admission> loadAdmissionsSince(String accountId, LocalDate from) {
        try {
            return admissionMapper.toDomainList(admissionJpaRepository.findSince(accountId, from));
        } catch (DataAccessException e) {
            throw new PersistenceFailureException("Failed to load admissions for account " + accountId, e);
        }
    }
}
