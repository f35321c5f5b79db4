package com.structurescout.domain.model;

import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Realized result of a trade, reported once by the execution collaborator (or by paper tracking).
 *
 * <p>P&L is expressed as a fraction of account equity (e.g. -0.012 for a $120 loss on $10,000)
 * so that loss limits stay meaningful as equity changes.
 */
@Getter
@Builder
@ToString
public class TradeOutcome {

    /** Id of the admitted candidate this outcome closes. */
    private final String correlationId;

    /** Realized profit/loss as a fraction of equity. Negative for losses. */
    private final BigDecimal pnlFraction;

    /** Realized profit/loss as a multiple of the initial risk (the trade's R multiple). */
    private final BigDecimal realizedR;

    private final Instant closedAt;

    /** Ledger sequence number; null until the outcome has been persisted. */
    private final Long sequence;

    public boolean isWin() {
        return pnlFraction != null && pnlFraction.signum() > 0;
    }
}
