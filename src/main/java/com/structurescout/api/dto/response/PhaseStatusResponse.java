package com.structurescout.api.dto.response;

import com.structurescout.domain.enums.OperatingPhase;
import com.structurescout.domain.model.AdvancementEvaluation;
import lombok.Builder;
import lombok.Getter;

/**
 * Current phase together with its latest milestone evaluation.
 */
@Getter
@Builder
public class PhaseStatusResponse {

    private final OperatingPhase phase;
    private final boolean capitalAtRisk;
    private final AdvancementEvaluation evaluation;
}
