package com.structurescout.news;

import com.structurescout.domain.enums.EventImpact;
import com.structurescout.domain.model.BlackoutWindow;
import com.structurescout.domain.model.ScheduledEvent;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Computes news blackout windows around high-impact events.
 *
 * <p>Each HIGH event at time t blocks the closed interval {@code [t - preBuffer, t + postBuffer]}.
 * Overlapping or touching intervals are merged into one window, so two FOMC-day releases ten
 * minutes apart produce a single continuous blackout. Stateless; safe to share.
 */
public final class BlackoutCalculator {

    private BlackoutCalculator() {}

    /** Merged blackout windows for the given events, sorted by start. */
    public static List<BlackoutWindow> windows(List<ScheduledEvent> events, Duration preBuffer, Duration postBuffer) {
        List<BlackoutWindow> raw = new ArrayList<>();
        for (ScheduledEvent event : events) {
            if (event.getImpact() != EventImpact.HIGH || event.getEventTime() == null) {
                continue;
            }
            raw.add(BlackoutWindow.builder()
                    .start(event.getEventTime().minus(preBuffer))
                    .end(event.getEventTime().plus(postBuffer))
                    .eventTitles(List.of(event.getTitle()))
                    .build());
        }
        raw.sort(Comparator.comparing(BlackoutWindow::getStart));

        List<BlackoutWindow> merged = new ArrayList<>();
        for (BlackoutWindow window : raw) {
            if (merged.isEmpty()) {
                merged.add(window);
                continue;
            }
            BlackoutWindow last = merged.get(merged.size() - 1);
            if (!window.getStart().isAfter(last.getEnd())) {
                List<String> titles = new ArrayList<>(last.getEventTitles());
                titles.addAll(window.getEventTitles());
                Instant end = window.getEnd().isAfter(last.getEnd()) ? window.getEnd() : last.getEnd();
                merged.set(merged.size() - 1, last.toBuilder().end(end).eventTitles(titles).build());
            } else {
                merged.add(window);
            }
        }
        return merged;
    }

    /** The merged window containing {@code timestamp}, if any. Bounds are inclusive. */
    public static Optional<BlackoutWindow> windowContaining(
            Instant timestamp, List<ScheduledEvent> events, Duration preBuffer, Duration postBuffer) {
        return windows(events, preBuffer, postBuffer).stream()
                .filter(window -> window.contains(timestamp))
                .findFirst();
    }
}
