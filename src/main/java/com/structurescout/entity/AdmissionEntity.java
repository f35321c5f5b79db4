package com.structurescout.entity;

import com.structurescout.domain.enums.AdmissionStatus;
import com.structurescout.domain.enums.OperatingPhase;
import com.structurescout.domain.enums.TradeDirection;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;
import java.time.LocalDate;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the admission table: every admitted candidate, whatever the phase,
 * with its lifecycle status (OPEN until the outcome arrives or the session day ends).
 */
@Entity
@Table(
        name = "admission",
        uniqueConstraints =
                @UniqueConstraint(
                        name = "uk_admission_account_correlation",
                        columnNames = {"account_id", "correlation_id"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AdmissionEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "account_id", nullable = false, length = 50)
    private String accountId;

    @Column(name = "correlation_id", nullable = false, length = 100)
    private String correlationId;

    @Enumerated(EnumType.STRING)
    @Column(name = "phase", nullable = false, columnDefinition = "varchar(30)")
    private OperatingPhase phase;

    @Enumerated(EnumType.STRING)
    @Column(name = "direction", columnDefinition = "varchar(10)")
    private TradeDirection direction;

    @Column(name = "setup_type", length = 100)
    private String setupType;

    @Column(name = "size", nullable = false)
    private int size;

    @Column(name = "admitted_at", nullable = false)
    private Instant admittedAt;

    @Column(name = "session_date", nullable = false)
    private LocalDate sessionDate;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, columnDefinition = "varchar(20)")
    private AdmissionStatus status;

    @Column(name = "closed_at")
    private Instant closedAt;
}
