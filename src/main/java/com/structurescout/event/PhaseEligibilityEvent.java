package com.structurescout.event;

import com.structurescout.domain.model.AdvancementEvaluation;
import org.springframework.context.ApplicationEvent;

/**
 * Carries an advancement report to the external approval collaborator. The operator reviews it
 * and, if satisfied, issues a phase:advance token.
 */
public class PhaseEligibilityEvent extends ApplicationEvent {

    private final AdvancementEvaluation evaluation;

    public PhaseEligibilityEvent(Object source, AdvancementEvaluation evaluation) {
        super(source);
        this.evaluation = evaluation;
    }

    public AdvancementEvaluation getEvaluation() {
        return evaluation;
    }
}
