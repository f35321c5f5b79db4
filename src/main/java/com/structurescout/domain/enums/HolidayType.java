package com.structurescout.domain.enums;

/**
 * Classifies the type of holiday on the exchange calendar.
 *
 * <p>FULL_HOLIDAY means no trading at all. EARLY_CLOSE is a trading day whose session ends at
 * the holiday's configured close time (e.g. the day after Thanksgiving).
 */
public enum HolidayType {

    /** Full day holiday, no trading. */
    FULL_HOLIDAY,

    /** Shortened session; the entry's close time replaces the regular close. */
    EARLY_CLOSE
}
