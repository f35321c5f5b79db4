package com.structurescout.domain.model;

import com.structurescout.domain.enums.OperatingPhase;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Durable per-account state that is not derivable from the outcome log:
 * the operating phase, account equity, and the trading halt flag.
 *
 * <p>Immutable snapshot; every change produces a new instance via {@code toBuilder()} that is
 * persisted before it replaces the current one.
 */
@Getter
@Builder(toBuilder = true)
@ToString
public class AccountState {

    private final String accountId;
    private final OperatingPhase phase;
    private final Instant phaseEnteredAt;
    private final BigDecimal equity;
    private final boolean halted;
    private final String haltReason;
    private final Instant haltedAt;
    private final Instant updatedAt;
}
