package com.structurescout.api.dto.response;

import com.structurescout.domain.enums.OperatingPhase;
import com.structurescout.domain.enums.ReasonCode;
import com.structurescout.domain.model.AdmissionDecision;
import com.structurescout.risk.RiskViolation;
import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Getter;

/**
 * Response DTO for a gate evaluation.
 */
@Getter
@Builder
public class AdmissionDecisionResponse {

    private final String correlationId;
    private final boolean admitted;
    private final int size;
    private final List<ReasonCode> reasonCodes;
    private final List<String> messages;
    private final OperatingPhase phase;
    private final Instant evaluatedAt;

    public static AdmissionDecisionResponse from(AdmissionDecision decision) {
        return AdmissionDecisionResponse.builder()
                .correlationId(decision.getCorrelationId())
                .admitted(decision.isAdmitted())
                .size(decision.getSize())
                .reasonCodes(List.copyOf(decision.getReasonCodes()))
                .messages(decision.getViolations().stream()
                        .map(RiskViolation::getMessage)
                        .toList())
                .phase(decision.getPhase())
                .evaluatedAt(decision.getEvaluatedAt())
                .build();
    }
}
