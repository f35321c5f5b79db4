package com.structurescout.news;

import com.structurescout.calendar.TradingCalendarService;
import com.structurescout.domain.enums.EventImpact;
import com.structurescout.domain.enums.ReasonCode;
import com.structurescout.domain.model.BlackoutWindow;
import com.structurescout.domain.model.ScheduledEvent;
import com.structurescout.risk.RiskValidationResult;
import com.structurescout.risk.RiskViolation;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Registry of scheduled economic events and the blackout check built on it.
 *
 * <p>Events come from configuration at startup and can be added at runtime (the economic
 * calendar feed is an external collaborator). Impact is taken from the event when given,
 * otherwise inferred from the title by {@link EventImpactClassifier}. The first blackout check
 * of each session day drops events whose window has already ended.
 */
@Service
public class NewsCalendarService {

    private static final Logger log = LoggerFactory.getLogger(NewsCalendarService.class);

    private final NewsCalendarConfig newsCalendarConfig;
    private final EventImpactClassifier eventImpactClassifier;
    private final TradingCalendarService tradingCalendarService;
    private final List<ScheduledEvent> events = new CopyOnWriteArrayList<>();

    /** Session day of the last prune; events are pruned at most once per session day. */
    private volatile LocalDate lastPrunedDay;

    public NewsCalendarService(
            NewsCalendarConfig newsCalendarConfig,
            EventImpactClassifier eventImpactClassifier,
            TradingCalendarService tradingCalendarService) {
        this.newsCalendarConfig = newsCalendarConfig;
        this.eventImpactClassifier = eventImpactClassifier;
        this.tradingCalendarService = tradingCalendarService;
        for (NewsCalendarConfig.EventEntry entry : newsCalendarConfig.getEvents()) {
            Instant eventTime = entry.getTime().atZone(tradingCalendarService.getZoneId()).toInstant();
            register(entry.getTitle(), eventTime, entry.getImpact());
        }
    }

    /**
     * Adds an event to the registry and returns it with its resolved impact.
     */
    public ScheduledEvent register(String title, Instant eventTime, EventImpact impact) {
        ScheduledEvent event = ScheduledEvent.builder()
                .title(title)
                .eventTime(eventTime)
                .impact(eventImpactClassifier.classify(title, impact))
                .build();
        events.add(event);
        log.info("Registered {} impact event '{}' at {}", event.getImpact(), title, eventTime);
        return event;
    }

    public List<ScheduledEvent> getEvents() {
        return events.stream()
                .sorted(Comparator.comparing(ScheduledEvent::getEventTime))
                .toList();
    }

    /** Events with {@code from <= eventTime <= to}, sorted by time. */
    public List<ScheduledEvent> getEvents(Instant from, Instant to) {
        return events.stream()
                .filter(e -> !e.getEventTime().isBefore(from) && !e.getEventTime().isAfter(to))
                .sorted(Comparator.comparing(ScheduledEvent::getEventTime))
                .toList();
    }

    public List<BlackoutWindow> getBlackoutWindows() {
        return BlackoutCalculator.windows(events, preBuffer(), postBuffer());
    }

    public Optional<BlackoutWindow> activeBlackout(Instant timestamp) {
        return BlackoutCalculator.windowContaining(timestamp, events, preBuffer(), postBuffer());
    }

    /**
     * NEWS_BLACKOUT if {@code timestamp} lies inside a merged blackout window, approved otherwise.
     */
    public RiskValidationResult checkBlackout(Instant timestamp) {
        LocalDate day = tradingCalendarService.sessionDate(timestamp);
        if (lastPrunedDay == null || day.isAfter(lastPrunedDay)) {
            lastPrunedDay = day;
            pruneBefore(timestamp);
        }
        return activeBlackout(timestamp)
                .map(window -> RiskValidationResult.rejected(List.of(RiskViolation.of(
                        ReasonCode.NEWS_BLACKOUT,
                        String.format(
                                "News blackout %s to %s for %s",
                                window.getStart(), window.getEnd(), window.getEventTitles())))))
                .orElse(RiskValidationResult.approved());
    }

    /**
     * Drops events whose blackout window ended before {@code cutoff}.
     *
     * @return the number of events removed
     */
    public int pruneBefore(Instant cutoff) {
        Duration post = postBuffer();
        List<ScheduledEvent> expired = events.stream()
                .filter(e -> e.getEventTime().plus(post).isBefore(cutoff))
                .toList();
        if (expired.isEmpty()) {
            return 0;
        }
        events.removeAll(expired);
        log.info("Pruned {} past events ending before {}", expired.size(), cutoff);
        return expired.size();
    }

    private Duration preBuffer() {
        return Duration.ofMinutes(newsCalendarConfig.getPreBufferMinutes());
    }

    private Duration postBuffer() {
        return Duration.ofMinutes(newsCalendarConfig.getPostBufferMinutes());
    }
}
