package com.structurescout.event;

import com.structurescout.domain.enums.OperatingPhase;
import com.structurescout.domain.enums.PhaseTransitionType;
import java.time.Instant;
import org.springframework.context.ApplicationEvent;

/**
 * Published after a phase transition has been persisted.
 *
 * <p>Listeners react to capital-at-risk changes, e.g. the metrics gauge and the notification
 * collaborator announcing that live trading has started.
 */
public class PhaseEvent extends ApplicationEvent {

    private final PhaseTransitionType transitionType;
    private final OperatingPhase previousPhase;
    private final OperatingPhase newPhase;
    private final String authorizedBy;
    private final String reason;
    private final Instant occurredAt;

    public PhaseEvent(
            Object source,
            PhaseTransitionType transitionType,
            OperatingPhase previousPhase,
            OperatingPhase newPhase,
            String authorizedBy,
            String reason,
            Instant occurredAt) {
        super(source);
        this.transitionType = transitionType;
        this.previousPhase = previousPhase;
        this.newPhase = newPhase;
        this.authorizedBy = authorizedBy;
        this.reason = reason;
        this.occurredAt = occurredAt;
    }

    public PhaseTransitionType getTransitionType() {
        return transitionType;
    }

    public OperatingPhase getPreviousPhase() {
        return previousPhase;
    }

    public OperatingPhase getNewPhase() {
        return newPhase;
    }

    public String getAuthorizedBy() {
        return authorizedBy;
    }

    public String getReason() {
        return reason;
    }

    public Instant getOccurredAt() {
        return occurredAt;
    }

    /** True when this transition moves capital at risk from none to some, or the reverse. */
    public boolean changesCapitalAtRisk() {
        return previousPhase.capitalAtRisk() != newPhase.capitalAtRisk();
    }
}
