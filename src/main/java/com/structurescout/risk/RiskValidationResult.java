package com.structurescout.risk;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.Getter;

/**
 * Result of one stage of candidate checking (validation, session gating, limits).
 *
 * <p>Either APPROVED (empty violations list) or REJECTED (one or more violations, in the order
 * the checks fired). The RiskGate concatenates stage results into the final AdmissionDecision.
 */
@Getter
public class RiskValidationResult {

    private final boolean approved;
    private final List<RiskViolation> violations;

    private RiskValidationResult(boolean approved, List<RiskViolation> violations) {
        this.approved = approved;
        this.violations = violations;
    }

    public static RiskValidationResult approved() {
        return new RiskValidationResult(true, Collections.emptyList());
    }

    public static RiskValidationResult rejected(List<RiskViolation> violations) {
        return new RiskValidationResult(false, List.copyOf(violations));
    }

    /** Approved when {@code violations} is empty, rejected otherwise. */
    public static RiskValidationResult of(List<RiskViolation> violations) {
        return violations.isEmpty() ? approved() : rejected(violations);
    }

    public boolean isRejected() {
        return !approved;
    }

    /** Combines two stage results, keeping violation order. */
    public RiskValidationResult and(RiskValidationResult other) {
        if (approved && other.approved) {
            return this;
        }
        List<RiskViolation> combined = new ArrayList<>(violations);
        combined.addAll(other.violations);
        return rejected(combined);
    }
}
