package com.structurescout.risk;

import com.structurescout.domain.enums.ReasonCode;
import lombok.Builder;
import lombok.Getter;

/**
 * A single reason a candidate was rejected (or, for diagnostic codes, annotated).
 *
 * <p>The code is machine-readable and drives the caller's reaction; the message is for the
 * operator and the decision log. Multiple violations can be returned from one evaluation so the
 * complete picture of a rejection is visible, not just the first failure.
 */
@Getter
@Builder
public class RiskViolation {

    private final ReasonCode code;

    /** Human-readable description of the violation. */
    private final String message;

    public static RiskViolation of(ReasonCode code, String message) {
        return RiskViolation.builder().code(code).message(message).build();
    }

    @Override
    public String toString() {
        return code + ": " + message;
    }
}
