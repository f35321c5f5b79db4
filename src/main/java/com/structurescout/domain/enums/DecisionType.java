package com.structurescout.domain.enums;

/**
 * What kind of decision a {@link com.structurescout.domain.model.DecisionRecord} captures.
 */
public enum DecisionType {
    CANDIDATE_ADMITTED,
    CANDIDATE_REJECTED,
    OUTCOME_RECORDED,
    OUTCOME_REJECTED,
    LIMIT_BREACH,
    PHASE_EVALUATED,
    PHASE_ADVANCED,
    PHASE_CHANGE_REFUSED,
    PHASE_DOWNGRADED,
    TRADING_HALTED,
    TRADING_RESUMED,
    STARTUP_RECOVERY
}
