package com.structurescout.domain.enums;

public enum DecisionSource {
    RISK_GATE,
    RISK_LEDGER,
    PHASE_CONTROLLER,
    TRADING_HALT,
    RECOVERY,
    SYSTEM
}
