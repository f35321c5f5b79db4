package com.structurescout.calendar;

import com.structurescout.news.NewsCalendarService;
import com.structurescout.risk.RiskValidationResult;
import java.time.Instant;
import org.springframework.stereotype.Component;

/**
 * Combines the session check and the news blackout check for one instant.
 * Both checks always run, so a Saturday FOMC release reports both reasons.
 */
@Component
public class TradabilityGate {

    private final TradingCalendarService tradingCalendarService;
    private final NewsCalendarService newsCalendarService;

    public TradabilityGate(TradingCalendarService tradingCalendarService, NewsCalendarService newsCalendarService) {
        this.tradingCalendarService = tradingCalendarService;
        this.newsCalendarService = newsCalendarService;
    }

    public RiskValidationResult isTradable(Instant timestamp) {
        return tradingCalendarService.checkSession(timestamp).and(newsCalendarService.checkBlackout(timestamp));
    }
}
