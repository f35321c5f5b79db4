package com.structurescout.entity;

import com.structurescout.domain.enums.OperatingPhase;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the account_state table. One row per account, updated in place.
 * Holds only what cannot be rebuilt from the outcome log.
 */
@Entity
@Table(name = "account_state")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AccountStateEntity {

    @Id
    @Column(name = "account_id", length = 50)
    private String accountId;

    @Enumerated(EnumType.STRING)
    @Column(name = "phase", nullable = false, columnDefinition = "varchar(30)")
    private OperatingPhase phase;

    @Column(name = "phase_entered_at", nullable = false)
    private Instant phaseEnteredAt;

    @Column(name = "equity", nullable = false, precision = 15, scale = 2)
    private BigDecimal equity;

    @Column(name = "halted", nullable = false)
    private boolean halted;

    @Column(name = "halt_reason", length = 500)
    private String haltReason;

    @Column(name = "halted_at")
    private Instant haltedAt;

    @Column(name = "updated_at")
    private Instant updatedAt;
}
