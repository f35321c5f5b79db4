package com.structurescout.domain.model;

import com.structurescout.domain.enums.EventImpact;
import java.time.Instant;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * A scheduled economic release (FOMC, CPI, NFP...).
 */
@Getter
@Builder
@ToString
public class ScheduledEvent {

    private final String title;
    private final Instant eventTime;
    private final EventImpact impact;
}
