package com.structurescout.domain.enums;

/**
 * Market impact of a scheduled economic event. Only HIGH impact events open a blackout window.
 */
public enum EventImpact {
    HIGH,
    MEDIUM,
    LOW
}
