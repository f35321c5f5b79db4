package com.structurescout.domain.enums;

public enum DecisionOutcome {
    ADMITTED,
    REJECTED,
    RECORDED,
    FAILED,
    INFO
}
