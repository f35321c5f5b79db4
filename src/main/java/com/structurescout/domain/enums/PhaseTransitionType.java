package com.structurescout.domain.enums;

/**
 * Kind of phase change: a normal one-step ADVANCE, or an administrative DOWNGRADE.
 */
public enum PhaseTransitionType {
    ADVANCE,
    DOWNGRADE
}
