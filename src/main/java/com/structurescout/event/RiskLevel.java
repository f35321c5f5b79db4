package com.structurescout.event;

/**
 * Severity level for a {@link RiskEvent}.
 *
 * <p>INFO is for approaching thresholds, WARNING for breaches that block new admissions,
 * and CRITICAL for conditions that halt the engine.
 */
public enum RiskLevel {
    INFO,
    WARNING,
    CRITICAL
}
