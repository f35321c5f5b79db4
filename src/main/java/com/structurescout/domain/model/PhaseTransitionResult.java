package com.structurescout.domain.model;

import com.structurescout.domain.enums.OperatingPhase;
import lombok.Getter;

/**
 * Typed result of an advance or downgrade request.
 */
@Getter
public class PhaseTransitionResult {

    public enum Status {
        TRANSITIONED,
        NOT_ELIGIBLE,
        UNAUTHORIZED,
        INVALID_TARGET
    }

    private final Status status;
    private final OperatingPhase phase;
    private final PhaseTransition transition;
    private final AdvancementEvaluation evaluation;
    private final String message;

    private PhaseTransitionResult(
            Status status,
            OperatingPhase phase,
            PhaseTransition transition,
            AdvancementEvaluation evaluation,
            String message) {
        this.status = status;
        this.phase = phase;
        this.transition = transition;
        this.evaluation = evaluation;
        this.message = message;
    }

    public static PhaseTransitionResult transitioned(PhaseTransition transition, AdvancementEvaluation evaluation) {
        return new PhaseTransitionResult(
                Status.TRANSITIONED,
                transition.getToPhase(),
                transition,
                evaluation,
                transition.getFromPhase() + " -> " + transition.getToPhase());
    }

    public static PhaseTransitionResult notEligible(OperatingPhase phase, AdvancementEvaluation evaluation) {
        String message = evaluation.isTerminal()
                ? phase + " is the final phase"
                : "Unmet milestone criteria: " + evaluation.getUnmetCriteria();
        return new PhaseTransitionResult(Status.NOT_ELIGIBLE, phase, null, evaluation, message);
    }

    public static PhaseTransitionResult unauthorized(OperatingPhase phase, String message) {
        return new PhaseTransitionResult(Status.UNAUTHORIZED, phase, null, null, message);
    }

    public static PhaseTransitionResult invalidTarget(OperatingPhase phase, String message) {
        return new PhaseTransitionResult(Status.INVALID_TARGET, phase, null, null, message);
    }

    public boolean isTransitioned() {
        return status == Status.TRANSITIONED;
    }
}
