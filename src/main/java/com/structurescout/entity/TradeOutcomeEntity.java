package com.structurescout.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the trade_outcome table.
 *
 * <p>Append-only log of realized outcomes. The identity column doubles as the ledger sequence
 * number, so replaying rows by id reproduces the exact order in which outcomes were accepted.
 * The unique (account_id, correlation_id) constraint is the durable half of duplicate detection.
 */
@Entity
@Table(
        name = "trade_outcome",
        uniqueConstraints =
                @UniqueConstraint(
                        name = "uk_trade_outcome_account_correlation",
                        columnNames = {"account_id", "correlation_id"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TradeOutcomeEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "account_id", nullable = false, length = 50)
    private String accountId;

    @Column(name = "correlation_id", nullable = false, length = 100)
    private String correlationId;

    @Column(name = "pnl_fraction", nullable = false, precision = 18, scale = 8)
    private BigDecimal pnlFraction;

    @Column(name = "r_multiple", nullable = false, precision = 12, scale = 4)
    private BigDecimal realizedR;

    @Column(name = "closed_at", nullable = false)
    private Instant closedAt;

    @Column(name = "recorded_at", nullable = false)
    private Instant recordedAt;
}
