package com.structurescout.account;

import com.structurescout.domain.model.AccountState;
import com.structurescout.domain.model.PhaseTransition;
import com.structurescout.entity.AccountStateEntity;
import com.structurescout.entity.PhaseTransitionEntity;
import com.structurescout.exception.PersistenceFailureException;
import com.structurescout.mapper.AccountStateMapper;
import com.structurescout.mapper.PhaseTransitionMapper;
import com.structurescout.repository.jpa.AccountStateJpaRepository;
import com.structurescout.repository.jpa.PhaseTransitionJpaRepository;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.mapstruct.factory.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Owner of the account's durable state (phase, equity, halt flag) and of the account lock.
 *
 * <p>Every mutation of engine state for this account (gate evaluation, outcome recording,
 * phase changes, halt and resume) runs inside {@link #withLock(Supplier)}, so the account has a
 * single writer at a time. State changes are persisted first and only then published to
 * {@link #getState()}; if the write fails the previous snapshot stays current.
 */
@Service
public class AccountStateService {

    private static final Logger log = LoggerFactory.getLogger(AccountStateService.class);

    private final AccountConfig accountConfig;
    private final AccountStateJpaRepository accountStateJpaRepository;
    private final PhaseTransitionJpaRepository phaseTransitionJpaRepository;
    private final Clock clock;
    private final AccountStateMapper accountStateMapper = Mappers.getMapper(AccountStateMapper.class);
    private final PhaseTransitionMapper phaseTransitionMapper = Mappers.getMapper(PhaseTransitionMapper.class);

    /** Single-writer gate for every engine mutation on this account. */
    private final ReentrantLock accountLock = new ReentrantLock();

    private final AtomicReference<AccountState> current = new AtomicReference<>();

    public AccountStateService(
            AccountConfig accountConfig,
            AccountStateJpaRepository accountStateJpaRepository,
            PhaseTransitionJpaRepository phaseTransitionJpaRepository,
            Clock clock) {
        this.accountConfig = accountConfig;
        this.accountStateJpaRepository = accountStateJpaRepository;
        this.phaseTransitionJpaRepository = phaseTransitionJpaRepository;
        this.clock = clock;
    }

    // ========================
    // LOCKING
    // ========================

    public <T> T withLock(Supplier<T> action) {
        accountLock.lock();
        try {
            return action.get();
        } finally {
            accountLock.unlock();
        }
    }

    public void withLock(Runnable action) {
        withLock(() -> {
            action.run();
            return null;
        });
    }

    // ========================
    // LOAD
    // ========================

    /**
     * Loads the account row, creating it from configuration the first time the account is seen.
     * Idempotent.
     */
    public AccountState load(Instant now) {
        return withLock(() -> {
            AccountState loaded = current.get();
            if (loaded != null) {
                return loaded;
            }
            String accountId = accountConfig.getAccountId();
            AccountState state;
            try {
                state = accountStateJpaRepository
                        .findById(accountId)
                        .map(accountStateMapper::toDomain)
                        .orElse(null);
            } catch (DataAccessException e) {
                throw new PersistenceFailureException("Failed to load account state for " + accountId, e);
            }
            if (state == null) {
                state = AccountState.builder()
                        .accountId(accountId)
                        .phase(accountConfig.getInitialPhase())
                        .phaseEnteredAt(now)
                        .equity(accountConfig.getInitialEquity())
                        .halted(false)
                        .updatedAt(now)
                        .build();
                persist(state);
                log.info(
                        "Created account {} in phase {} with equity {}",
                        accountId,
                        state.getPhase(),
                        state.getEquity());
            } else {
                log.info(
                        "Loaded account {}: phase={}, equity={}, halted={}",
                        accountId,
                        state.getPhase(),
                        state.getEquity(),
                        state.isHalted());
            }
            current.set(state);
            return state;
        });
    }

    public AccountState getState() {
        AccountState state = current.get();
        return state != null ? state : load(clock.instant());
    }

    public String getAccountId() {
        return accountConfig.getAccountId();
    }

    // ========================
    // MUTATIONS
    // ========================

    /**
     * Sets the account equity used for sizing and for converting P&L fractions to amounts.
     *
     * @throws IllegalArgumentException if equity is not positive
     */
    public AccountState updateEquity(BigDecimal equity, Instant now) {
        if (equity == null || equity.signum() <= 0) {
            throw new IllegalArgumentException("Equity must be positive: " + equity);
        }
        return withLock(() -> {
            AccountState previous = getState();
            AccountState updated =
                    previous.toBuilder().equity(equity).updatedAt(now).build();
            persist(updated);
            current.set(updated);
            log.info("Account {} equity updated: {} -> {}", updated.getAccountId(), previous.getEquity(), equity);
            return updated;
        });
    }

    /** Sets or clears the halt flag. Callers hold the lock via TradingHaltService. */
    public AccountState updateHalt(boolean halted, String reason, Instant now) {
        return withLock(() -> {
            AccountState updated = getState().toBuilder()
                    .halted(halted)
                    .haltReason(halted ? reason : null)
                    .haltedAt(halted ? now : null)
                    .updatedAt(now)
                    .build();
            persist(updated);
            current.set(updated);
            return updated;
        });
    }

    /**
     * Persists a phase change and its audit row in one transaction, then publishes the new phase.
     *
     * @return the saved transition with its id
     */
    @Transactional
    public PhaseTransition changePhase(PhaseTransition transition) {
        return withLock(() -> {
            AccountState updated = getState().toBuilder()
                    .phase(transition.getToPhase())
                    .phaseEnteredAt(transition.getTransitionedAt())
                    .updatedAt(transition.getTransitionedAt())
                    .build();
            PhaseTransition saved;
            try {
                PhaseTransitionEntity entity =
                        phaseTransitionJpaRepository.saveAndFlush(phaseTransitionMapper.toEntity(transition));
                accountStateJpaRepository.saveAndFlush(accountStateMapper.toEntity(updated));
                saved = phaseTransitionMapper.toDomain(entity);
            } catch (DataAccessException e) {
                log.error(
                        "Failed to persist phase change {} -> {}: {}",
                        transition.getFromPhase(),
                        transition.getToPhase(),
                        e.getMessage(),
                        e);
                throw new PersistenceFailureException("Failed to persist phase change", e);
            }
            current.set(updated);
            return saved;
        });
    }

    public List<PhaseTransition> getTransitionHistory() {
        try {
            return phaseTransitionMapper.toDomainList(
                    phaseTransitionJpaRepository.findByAccountIdOrderByTransitionedAtDesc(getAccountId()));
        } catch (DataAccessException e) {
            throw new PersistenceFailureException("Failed to load phase history", e);
        }
    }

    private void persist(AccountState state) {
        try {
            AccountStateEntity entity = accountStateMapper.toEntity(state);
            accountStateJpaRepository.saveAndFlush(entity);
        } catch (DataAccessException e) {
            log.error("Failed to persist account state {}: {}", state.getAccountId(), e.getMessage(), e);
            throw new PersistenceFailureException("Failed to persist account state " + state.getAccountId(), e);
        }
    }
}
