package com.structurescout.api.dto.request;

import com.structurescout.domain.model.TradeOutcome;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for reporting a realized trade outcome.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OutcomeRequest {

    @Size(max = 128, message = "Correlation id must be 128 characters or less")
    private String correlationId;

    /** Realized P&L as a fraction of equity, e.g. -0.012. */
    private BigDecimal pnlFraction;

    private BigDecimal realizedR;

    private Instant closedAt;

    public TradeOutcome toOutcome() {
        return TradeOutcome.builder()
                .correlationId(correlationId)
                .pnlFraction(pnlFraction)
                .realizedR(realizedR)
                .closedAt(closedAt)
                .build();
    }
}
