package com.structurescout.entity;

import com.structurescout.domain.enums.OperatingPhase;
import com.structurescout.domain.enums.PhaseTransitionType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the phase_transition audit table. Rows are never updated.
 */
@Entity
@Table(name = "phase_transition")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PhaseTransitionEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "account_id", nullable = false, length = 50)
    private String accountId;

    @Enumerated(EnumType.STRING)
    @Column(name = "from_phase", nullable = false, columnDefinition = "varchar(30)")
    private OperatingPhase fromPhase;

    @Enumerated(EnumType.STRING)
    @Column(name = "to_phase", nullable = false, columnDefinition = "varchar(30)")
    private OperatingPhase toPhase;

    @Enumerated(EnumType.STRING)
    @Column(name = "transition_type", nullable = false, columnDefinition = "varchar(20)")
    private PhaseTransitionType transitionType;

    @Column(name = "authorized_by", nullable = false, length = 100)
    private String authorizedBy;

    @Column(name = "reason", columnDefinition = "TEXT")
    private String reason;

    @Column(name = "transitioned_at", nullable = false)
    private Instant transitionedAt;
}
