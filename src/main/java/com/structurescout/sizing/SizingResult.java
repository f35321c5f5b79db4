package com.structurescout.sizing;

import com.structurescout.risk.RiskViolation;
import lombok.Getter;

/**
 * Contracts to trade, or the violation that prevented sizing.
 */
@Getter
public class SizingResult {

    private final int size;
    private final RiskViolation violation;

    private SizingResult(int size, RiskViolation violation) {
        this.size = size;
        this.violation = violation;
    }

    public static SizingResult of(int size) {
        return new SizingResult(size, null);
    }

    public static SizingResult rejected(RiskViolation violation) {
        return new SizingResult(0, violation);
    }

    public boolean isRejected() {
        return violation != null;
    }
}
