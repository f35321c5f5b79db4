package com.structurescout.domain.model;

import com.structurescout.domain.enums.OperatingPhase;
import com.structurescout.domain.enums.PhaseTransitionType;
import java.time.Instant;
import lombok.Builder;
import lombok.Data;

/**
 * Audit record of a phase change: who authorized it, why, and the evaluation behind it.
 */
@Data
@Builder
public class PhaseTransition {

    private Long id;
    private String accountId;
    private OperatingPhase fromPhase;
    private OperatingPhase toPhase;
    private PhaseTransitionType transitionType;

    /** Token subject of the operator who authorized the change. */
    private String authorizedBy;

    private String reason;
    private Instant transitionedAt;
}
