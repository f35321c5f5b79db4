package com.structurescout.domain.enums;

public enum DecisionSeverity {
    DEBUG,
    INFO,
    WARNING,
    CRITICAL
}
