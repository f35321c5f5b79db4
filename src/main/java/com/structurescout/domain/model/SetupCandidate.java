package com.structurescout.domain.model;

import com.structurescout.domain.enums.TradeDirection;
import java.time.Instant;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * A proposed trading opportunity produced by the external chart-analysis collaborator.
 *
 * <p>Immutable. The numeric fields are boxed because the upstream producer is only partially
 * trusted: a missing value must reach the SetupValidator as null (and be rejected as
 * MALFORMED_INPUT) rather than silently defaulting to zero.
 */
@Getter
@Builder(toBuilder = true)
@ToString
public class SetupCandidate {

    /** When the setup was identified. */
    private final Instant timestamp;

    private final TradeDirection direction;

    /** Model confidence in [0, 1]. */
    private final Double confidence;

    /** Target distance divided by stop distance. */
    private final Double rewardRiskRatio;

    /** Distance from entry to stop, in index points. */
    private final Double stopDistance;

    /** Free-form setup label (e.g. "BREAK_AND_RETEST"). */
    private final String setupType;

    /** Opaque id linking this candidate to its later TradeOutcome. */
    private final String correlationId;
}
