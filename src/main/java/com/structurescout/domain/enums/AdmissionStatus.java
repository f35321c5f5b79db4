package com.structurescout.domain.enums;

/**
 * Lifecycle of an admitted candidate.
 * OPEN until its outcome is reported (CLOSED). Admissions still open when their session day
 * ends are marked EXPIRED and stop counting toward open-position limits.
 */
public enum AdmissionStatus {
    OPEN,
    CLOSED,
    EXPIRED
}
