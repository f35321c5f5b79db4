package com.structurescout.api.dto.request;

import com.structurescout.domain.enums.TradeDirection;
import com.structurescout.domain.model.SetupCandidate;
import jakarta.validation.constraints.Size;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for submitting a setup candidate to the gate.
 *
 * <p>Fields are deliberately not constrained: missing or out-of-range values reach the gate and
 * come back as a MALFORMED_INPUT rejection, the same as for in-process callers.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CandidateRequest {

    private Instant timestamp;
    private TradeDirection direction;
    private Double confidence;
    private Double rewardRiskRatio;
    private Double stopDistance;

    @Size(max = 64, message = "Setup type must be 64 characters or less")
    private String setupType;

    @Size(max = 128, message = "Correlation id must be 128 characters or less")
    private String correlationId;

    public SetupCandidate toCandidate() {
        return SetupCandidate.builder()
                .timestamp(timestamp)
                .direction(direction)
                .confidence(confidence)
                .rewardRiskRatio(rewardRiskRatio)
                .stopDistance(stopDistance)
                .setupType(setupType)
                .correlationId(correlationId)
                .build();
    }
}
