package com.structurescout.calendar;

import com.structurescout.domain.enums.HolidayType;
import com.structurescout.exception.ConfigurationException;
import jakarta.annotation.PostConstruct;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for the exchange trading calendar, bound from the
 * {@code trading-calendar} prefix.
 *
 * <p>The session window is expressed in the exchange time zone. {@code entryCutoff}, when set,
 * closes the window for new entries before the regular close (the bot only looks for setups in
 * the opening hours). The holiday list is updated annually from the exchange's published
 * schedule.
 */
@Component
@ConfigurationProperties(prefix = "trading-calendar")
public class HolidayCalendarConfig {

    private String exchange = "NASDAQ";
    private String timezone = "America/New_York";

    @DateTimeFormat(iso = DateTimeFormat.ISO.TIME)
    private LocalTime sessionOpen = LocalTime.of(9, 30);

    @DateTimeFormat(iso = DateTimeFormat.ISO.TIME)
    private LocalTime sessionClose = LocalTime.of(16, 0);

    @DateTimeFormat(iso = DateTimeFormat.ISO.TIME)
    private LocalTime entryCutoff;

    private List<Holiday> holidays = new ArrayList<>();

    /**
     * Fails startup on a missing or unknown time zone, an empty session window, or an early close
     * entry without a close time.
     */
    @PostConstruct
    public void validate() {
        if (timezone == null || timezone.isBlank()) {
            throw new ConfigurationException("trading-calendar.timezone", timezone, "time zone is required");
        }
        try {
            ZoneId.of(timezone);
        } catch (DateTimeException e) {
            throw new ConfigurationException("trading-calendar.timezone", timezone, "unknown time zone");
        }
        if (sessionOpen == null || sessionClose == null || !sessionOpen.isBefore(sessionClose)) {
            throw new ConfigurationException(
                    "trading-calendar.session-open", sessionOpen, "must be before session-close " + sessionClose);
        }
        if (entryCutoff != null && (!entryCutoff.isAfter(sessionOpen) || entryCutoff.isAfter(sessionClose))) {
            throw new ConfigurationException(
                    "trading-calendar.entry-cutoff", entryCutoff, "must fall inside the session window");
        }
        for (Holiday holiday : holidays) {
            if (holiday.getDate() == null || holiday.getType() == null) {
                throw new ConfigurationException(
                        "trading-calendar.holidays", holiday.getName(), "date and type are required");
            }
            if (holiday.getType() == HolidayType.EARLY_CLOSE && holiday.getCloseTime() == null) {
                throw new ConfigurationException(
                        "trading-calendar.holidays", holiday.getDate(), "early close needs a close-time");
            }
        }
    }

    public ZoneId zoneId() {
        return ZoneId.of(timezone);
    }

    public String getExchange() {
        return exchange;
    }

    public void setExchange(String exchange) {
        this.exchange = exchange;
    }

    public String getTimezone() {
        return timezone;
    }

    public void setTimezone(String timezone) {
        this.timezone = timezone;
    }

    public LocalTime getSessionOpen() {
        return sessionOpen;
    }

    public void setSessionOpen(LocalTime sessionOpen) {
        this.sessionOpen = sessionOpen;
    }

    public LocalTime getSessionClose() {
        return sessionClose;
    }

    public void setSessionClose(LocalTime sessionClose) {
        this.sessionClose = sessionClose;
    }

    public LocalTime getEntryCutoff() {
        return entryCutoff;
    }

    public void setEntryCutoff(LocalTime entryCutoff) {
        this.entryCutoff = entryCutoff;
    }

    public List<Holiday> getHolidays() {
        return holidays;
    }

    public void setHolidays(List<Holiday> holidays) {
        this.holidays = holidays;
    }

    /**
     * A single holiday entry on the trading calendar.
     */
    public static class Holiday {

        @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
        private LocalDate date;

        private String name;
        private HolidayType type;

        /** Session close on an EARLY_CLOSE day. Ignored for full holidays. */
        @DateTimeFormat(iso = DateTimeFormat.ISO.TIME)
        private LocalTime closeTime;

        public Holiday() {}

        public Holiday(LocalDate date, String name, HolidayType type, LocalTime closeTime) {
            this.date = date;
            this.name = name;
            this.type = type;
            this.closeTime = closeTime;
        }

        public LocalDate getDate() {
            return date;
        }

        public void setDate(LocalDate date) {
            this.date = date;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public HolidayType getType() {
            return type;
        }

        public void setType(HolidayType type) {
            this.type = type;
        }

        public LocalTime getCloseTime() {
            return closeTime;
        }

        public void setCloseTime(LocalTime closeTime) {
            this.closeTime = closeTime;
        }
    }
}
