package com.structurescout.domain.model;

import com.structurescout.domain.enums.MilestoneCriterion;
import com.structurescout.domain.enums.OperatingPhase;
import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Read-only report of whether the current phase has met its milestones.
 *
 * <p>{@code targetPhase} is null at FULL_LIVE, which is terminal: the evaluation is then never
 * eligible even though no criterion is listed as unmet.
 */
@Getter
@Builder
@ToString
public class AdvancementEvaluation {

    private final OperatingPhase currentPhase;
    private final OperatingPhase targetPhase;
    private final boolean eligible;
    private final List<MilestoneCriterion> unmetCriteria;
    private final MilestoneCriteria criteria;
    private final PerformanceMetrics metrics;
    private final Instant evaluatedAt;

    public boolean isTerminal() {
        return targetPhase == null;
    }
}
