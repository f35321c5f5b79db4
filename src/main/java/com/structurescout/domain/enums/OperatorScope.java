package com.structurescout.domain.enums;

/**
 * Scopes an operator token can carry. Each protected operation requires its own scope, so a
 * token issued for advancement cannot be replayed to force a downgrade.
 */
public enum OperatorScope {
    PHASE_ADVANCE("phase:advance"),
    PHASE_DOWNGRADE("phase:downgrade"),
    HALT_RESUME("halt:resume");

    private final String claim;

    OperatorScope(String claim) {
        this.claim = claim;
    }

    public String getClaim() {
        return claim;
    }
}
