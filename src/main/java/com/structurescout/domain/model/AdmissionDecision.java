package com.structurescout.domain.model;

import com.structurescout.domain.enums.OperatingPhase;
import com.structurescout.domain.enums.ReasonCode;
import com.structurescout.risk.RiskViolation;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import lombok.Getter;

/**
 * Result of evaluating a SetupCandidate: either admitted with a size, or rejected.
 *
 * <p>Reason codes form an ordered set in the order the checks fired, so multi-reason rejections
 * are deterministic. An admitted decision may carry diagnostic-only codes
 * (PAPER_TRACKING_ONLY, DAILY_LOSS_WARNING); a rejected one always carries at least one
 * non-diagnostic code.
 */
@Getter
public class AdmissionDecision {

    private final boolean admitted;
    private final int size;
    private final List<RiskViolation> violations;
    private final String correlationId;
    private final OperatingPhase phase;
    private final Instant evaluatedAt;

    private AdmissionDecision(
            boolean admitted,
            int size,
            List<RiskViolation> violations,
            String correlationId,
            OperatingPhase phase,
            Instant evaluatedAt) {
        this.admitted = admitted;
        this.size = size;
        this.violations = List.copyOf(violations);
        this.correlationId = correlationId;
        this.phase = phase;
        this.evaluatedAt = evaluatedAt;
    }

    public static AdmissionDecision admitted(
            int size,
            List<RiskViolation> diagnostics,
            String correlationId,
            OperatingPhase phase,
            Instant evaluatedAt) {
        return new AdmissionDecision(true, size, diagnostics, correlationId, phase, evaluatedAt);
    }

    public static AdmissionDecision rejected(
            List<RiskViolation> violations, String correlationId, OperatingPhase phase, Instant evaluatedAt) {
        if (violations.isEmpty()) {
            throw new IllegalArgumentException("A rejection needs at least one violation");
        }
        return new AdmissionDecision(false, 0, violations, correlationId, phase, evaluatedAt);
    }

    public boolean isRejected() {
        return !admitted;
    }

    /** Distinct reason codes in firing order. */
    public Set<ReasonCode> getReasonCodes() {
        Set<ReasonCode> codes = new LinkedHashSet<>();
        violations.forEach(v -> codes.add(v.getCode()));
        return codes;
    }

    public boolean hasReason(ReasonCode code) {
        return violations.stream().anyMatch(v -> v.getCode() == code);
    }

    @Override
    public String toString() {
        return (admitted ? "ADMITTED(size=" + size + ")" : "REJECTED") + " " + getReasonCodes();
    }
}
