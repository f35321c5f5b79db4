package com.structurescout.news;

import com.structurescout.domain.enums.EventImpact;
import java.util.Locale;
import org.springframework.stereotype.Component;

/**
 * Classifies economic events by title when the feed gives no impact rating.
 * A title containing any configured high-impact keyword (case-insensitive) is HIGH;
 * everything else is MEDIUM.
 */
@Component
public class EventImpactClassifier {

    private final NewsCalendarConfig newsCalendarConfig;

    public EventImpactClassifier(NewsCalendarConfig newsCalendarConfig) {
        this.newsCalendarConfig = newsCalendarConfig;
    }

    public EventImpact classify(String title, EventImpact explicitImpact) {
        if (explicitImpact != null) {
            return explicitImpact;
        }
        if (title == null) {
            return EventImpact.LOW;
        }
        String normalized = title.toLowerCase(Locale.ROOT);
        boolean high = newsCalendarConfig.getHighImpactKeywords().stream()
                .anyMatch(keyword -> normalized.contains(keyword.toLowerCase(Locale.ROOT)));
        return high ? EventImpact.HIGH : EventImpact.MEDIUM;
    }
}
