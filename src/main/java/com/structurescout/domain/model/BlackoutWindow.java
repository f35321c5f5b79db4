package com.structurescout.domain.model;

import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * A closed interval [start, end] during which trading is suppressed.
 * After merging, one window may cover several overlapping events.
 */
@Getter
@Builder(toBuilder = true)
@ToString
public class BlackoutWindow {

    private final Instant start;
    private final Instant end;
    private final List<String> eventTitles;

    public boolean contains(Instant timestamp) {
        return !timestamp.isBefore(start) && !timestamp.isAfter(end);
    }
}
