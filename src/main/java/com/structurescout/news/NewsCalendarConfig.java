package com.structurescout.news;

import com.structurescout.domain.enums.EventImpact;
import com.structurescout.exception.ConfigurationException;
import jakarta.annotation.PostConstruct;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.stereotype.Component;

/**
 * Blackout buffers, impact keywords and pre-scheduled economic events,
 * bound from {@code structurescout.news.*}.
 *
 * <p>Event times are local times in the exchange time zone (as published in US economic
 * calendars). Events without an explicit impact are classified by keyword.
 */
@Data
@Component
@ConfigurationProperties(prefix = "structurescout.news")
public class NewsCalendarConfig {

    private int preBufferMinutes = 15;
    private int postBufferMinutes = 30;

    private List<String> highImpactKeywords = new ArrayList<>(List.of(
            "FOMC",
            "Federal Reserve",
            "Non-Farm Payrolls",
            "NFP",
            "CPI",
            "Inflation",
            "GDP",
            "Fed Chair",
            "Interest Rate",
            "Unemployment",
            "Retail Sales",
            "ISM Manufacturing",
            "ISM Services"));

    private List<EventEntry> events = new ArrayList<>();

    @PostConstruct
    public void validate() {
        if (preBufferMinutes < 0) {
            throw new ConfigurationException(
                    "structurescout.news.pre-buffer-minutes", preBufferMinutes, "must not be negative");
        }
        if (postBufferMinutes < 0) {
            throw new ConfigurationException(
                    "structurescout.news.post-buffer-minutes", postBufferMinutes, "must not be negative");
        }
        for (EventEntry event : events) {
            if (event.getTitle() == null || event.getTitle().isBlank() || event.getTime() == null) {
                throw new ConfigurationException(
                        "structurescout.news.events", event.getTitle(), "title and time are required");
            }
        }
    }

    @Data
    public static class EventEntry {

        private String title;

        @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME)
        private LocalDateTime time;

        /** Null means classify by keyword. */
        private EventImpact impact;
    }
}
