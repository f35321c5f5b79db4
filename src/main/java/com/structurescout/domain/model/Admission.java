package com.structurescout.domain.model;

import com.structurescout.domain.enums.AdmissionStatus;
import com.structurescout.domain.enums.OperatingPhase;
import com.structurescout.domain.enums.TradeDirection;
import java.time.Instant;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Data;

/**
 * An admitted candidate, tracked until its outcome is reported.
 */
@Data
@Builder
public class Admission {

    private Long id;
    private String accountId;
    private String correlationId;
    private OperatingPhase phase;
    private TradeDirection direction;
    private String setupType;
    private int size;
    private Instant admittedAt;

    /** Session date the admission belongs to (exchange time zone). */
    private LocalDate sessionDate;

    private AdmissionStatus status;
    private Instant closedAt;
}
