package com.structurescout.domain.enums;

/**
 * Groups reason codes by how they should be treated by callers and logs.
 *
 * <p>VALIDATION rejections are expected and frequent. GATE rejections are business-significant
 * and always audited. MALFORMED points at a defect in an upstream collaborator. DIAGNOSTIC codes
 * never cause a rejection on their own.
 */
public enum ReasonCategory {
    VALIDATION,
    GATE,
    MALFORMED,
    DIAGNOSTIC
}
