package com.structurescout.calendar;

import com.structurescout.domain.enums.HolidayType;
import com.structurescout.domain.enums.ReasonCode;
import com.structurescout.risk.RiskValidationResult;
import com.structurescout.risk.RiskViolation;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.TemporalAdjusters;
import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Service;

/**
 * Session oracle: answers whether a given instant falls on a trading day and inside the
 * trading session, and maps instants to session days and session weeks.
 *
 * <p>All calendar arithmetic happens in the exchange time zone from {@link HolidayCalendarConfig}.
 * A session day is the calendar date in that zone; a session week runs Monday to Sunday and is
 * keyed by its Monday. The session window is half-open: {@code [open, close)}.
 */
@Service
public class TradingCalendarService {

    private final HolidayCalendarConfig holidayCalendarConfig;
    private final ZoneId zoneId;

    public TradingCalendarService(HolidayCalendarConfig holidayCalendarConfig) {
        this.holidayCalendarConfig = holidayCalendarConfig;
        this.zoneId = holidayCalendarConfig.zoneId();
    }

    // ========================
    // SESSION CHECK
    // ========================

    /**
     * Checks whether new entries are allowed at the given instant.
     * At most one violation is returned: NON_TRADING_DAY, MARKET_HOLIDAY or OUTSIDE_SESSION.
     */
    public RiskValidationResult checkSession(Instant timestamp) {
        ZonedDateTime local = timestamp.atZone(zoneId);
        LocalDate date = local.toLocalDate();

        if (isWeekend(date)) {
            return reject(ReasonCode.NON_TRADING_DAY, date.getDayOfWeek() + " " + date + " is not a trading day");
        }

        Optional<HolidayCalendarConfig.Holiday> holiday = holidayOn(date);
        if (holiday.isPresent() && holiday.get().getType() == HolidayType.FULL_HOLIDAY) {
            return reject(ReasonCode.MARKET_HOLIDAY, "Market holiday: " + holiday.get().getName() + " (" + date + ")");
        }

        LocalTime time = local.toLocalTime();
        LocalTime open = holidayCalendarConfig.getSessionOpen();
        LocalTime close = entryCloseTime(date);
        if (time.isBefore(open) || !time.isBefore(close)) {
            return reject(
                    ReasonCode.OUTSIDE_SESSION,
                    String.format("%s %s is outside the session window [%s, %s)", date, time, open, close));
        }
        return RiskValidationResult.approved();
    }

    public boolean isSessionOpen(Instant timestamp) {
        return checkSession(timestamp).isApproved();
    }

    // ========================
    // DAY / WEEK KEYS
    // ========================

    public ZoneId getZoneId() {
        return zoneId;
    }

    /** The session day an instant belongs to. */
    public LocalDate sessionDate(Instant timestamp) {
        return timestamp.atZone(zoneId).toLocalDate();
    }

    /** The Monday of the session week an instant belongs to. */
    public LocalDate weekStart(Instant timestamp) {
        return weekStart(sessionDate(timestamp));
    }

    public LocalDate weekStart(LocalDate date) {
        return date.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
    }

    // ========================
    // CALENDAR QUERIES
    // ========================

    public boolean isWeekend(LocalDate date) {
        DayOfWeek dow = date.getDayOfWeek();
        return dow == DayOfWeek.SATURDAY || dow == DayOfWeek.SUNDAY;
    }

    /**
     * Checks if a date is a non-trading day (weekend or full holiday).
     */
    public boolean isHoliday(LocalDate date) {
        if (isWeekend(date)) {
            return true;
        }
        return holidayOn(date)
                .map(h -> h.getType() == HolidayType.FULL_HOLIDAY)
                .orElse(false);
    }

    public boolean isTradingDay(LocalDate date) {
        return !isHoliday(date);
    }

    /** Returns the next trading day after the given date. */
    public LocalDate getNextTradingDay(LocalDate from) {
        LocalDate next = from.plusDays(1);
        while (!isTradingDay(next)) {
            next = next.plusDays(1);
        }
        return next;
    }

    /** Regular close, or the early close time on an EARLY_CLOSE day. */
    public LocalTime closeTime(LocalDate date) {
        return holidayOn(date)
                .filter(h -> h.getType() == HolidayType.EARLY_CLOSE)
                .map(HolidayCalendarConfig.Holiday::getCloseTime)
                .orElse(holidayCalendarConfig.getSessionClose());
    }

    public List<HolidayCalendarConfig.Holiday> getHolidays() {
        return List.copyOf(holidayCalendarConfig.getHolidays());
    }

    /** Last instant at which entries are accepted: the close, pulled in by the entry cutoff. */
    private LocalTime entryCloseTime(LocalDate date) {
        LocalTime close = closeTime(date);
        LocalTime cutoff = holidayCalendarConfig.getEntryCutoff();
        return cutoff != null && cutoff.isBefore(close) ? cutoff : close;
    }

    private Optional<HolidayCalendarConfig.Holiday> holidayOn(LocalDate date) {
        return holidayCalendarConfig.getHolidays().stream()
                .filter(h -> date.equals(h.getDate()))
                .findFirst();
    }

    private RiskValidationResult reject(ReasonCode code, String message) {
        return RiskValidationResult.rejected(List.of(RiskViolation.of(code, message)));
    }
}
