package com.structurescout.domain.model;

import com.structurescout.domain.enums.DecisionOutcome;
import com.structurescout.domain.enums.DecisionSeverity;
import com.structurescout.domain.enums.DecisionSource;
import com.structurescout.domain.enums.DecisionType;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Map;
import lombok.Builder;
import lombok.Data;

/**
 * Domain model for a structured decision log entry.
 *
 * <p>Every gate evaluation, outcome report, phase decision and halt is captured as a
 * DecisionRecord with its reasoning and a snapshot of the data behind it, so that rejections
 * can be audited after the session.
 *
 * <p>Key fields:
 * <ul>
 *   <li>{@code source} -- which component made the decision</li>
 *   <li>{@code sourceId} -- candidate correlation id, account id, or phase name</li>
 *   <li>{@code dataContext} -- structured snapshot (reason codes, aggregates, size...)</li>
 * </ul>
 */
@Data
@Builder
public class DecisionRecord {

    private Long id;

    private LocalDateTime timestamp;

    private DecisionSource source;

    private String sourceId;

    private DecisionType decisionType;

    private DecisionOutcome outcome;

    /** Human-readable explanation of why this decision was made. */
    private String reasoning;

    /** Serialized to JSON for persistence. */
    private Map<String, Object> dataContext;

    private DecisionSeverity severity;

    /** Trading session date (for grouping and archival queries). */
    private LocalDate sessionDate;
}
