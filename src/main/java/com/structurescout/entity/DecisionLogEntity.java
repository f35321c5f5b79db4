package com.structurescout.entity;

import com.structurescout.domain.enums.DecisionOutcome;
import com.structurescout.domain.enums.DecisionSeverity;
import com.structurescout.domain.enums.DecisionSource;
import com.structurescout.domain.enums.DecisionType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.LocalDate;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the decision_log table.
 *
 * <p>Persists every structured engine decision with its source, type, outcome, reasoning and a
 * JSON snapshot of the data behind it (reason codes, aggregates, sizes). Persistence is async via
 * {@code DecisionArchiveService} so the gate never waits on the audit trail. DEBUG-severity
 * entries are only persisted when the persist-debug toggle is enabled at runtime.
 */
@Entity
@Table(name = "decision_log")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DecisionLogEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "timestamp", nullable = false)
    private LocalDateTime timestamp;

    @Enumerated(EnumType.STRING)
    @Column(name = "source", nullable = false, columnDefinition = "varchar(50)")
    private DecisionSource source;

    /** Correlation id, account id or phase name. */
    @Column(name = "source_id", length = 100)
    private String sourceId;

    @Enumerated(EnumType.STRING)
    @Column(name = "decision_type", nullable = false, columnDefinition = "varchar(100)")
    private DecisionType decisionType;

    @Enumerated(EnumType.STRING)
    @Column(name = "outcome", nullable = false, columnDefinition = "varchar(50)")
    private DecisionOutcome outcome;

    @Column(name = "reasoning", nullable = false, columnDefinition = "TEXT")
    private String reasoning;

    @Column(name = "data_context", columnDefinition = "TEXT")
    private String dataContext;

    @Enumerated(EnumType.STRING)
    @Column(name = "severity", columnDefinition = "varchar(50)")
    private DecisionSeverity severity;

    @Column(name = "session_date")
    private LocalDate sessionDate;
}
