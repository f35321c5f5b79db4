package com.structurescout.domain.model;

import com.structurescout.domain.enums.ReasonCode;
import lombok.Getter;

/**
 * Typed result of reporting a TradeOutcome to the ledger.
 *
 * <p>RECORDED carries the ledger sequence number assigned on persistence. DUPLICATE_OUTCOME and
 * MALFORMED_INPUT are clean rejections that leave the ledger untouched.
 */
@Getter
public class OutcomeRecordResult {

    public enum Status {
        RECORDED,
        DUPLICATE_OUTCOME,
        MALFORMED_INPUT
    }

    private final Status status;
    private final String correlationId;
    private final Long sequence;
    private final String message;

    private OutcomeRecordResult(Status status, String correlationId, Long sequence, String message) {
        this.status = status;
        this.correlationId = correlationId;
        this.sequence = sequence;
        this.message = message;
    }

    public static OutcomeRecordResult recorded(String correlationId, long sequence) {
        return new OutcomeRecordResult(Status.RECORDED, correlationId, sequence, "Outcome recorded");
    }

    public static OutcomeRecordResult duplicate(String correlationId) {
        return new OutcomeRecordResult(
                Status.DUPLICATE_OUTCOME, correlationId, null, "Outcome already reported for " + correlationId);
    }

    public static OutcomeRecordResult malformed(String correlationId, String message) {
        return new OutcomeRecordResult(Status.MALFORMED_INPUT, correlationId, null, message);
    }

    public boolean isRecorded() {
        return status == Status.RECORDED;
    }

    /** The reason code matching a rejection, or null when recorded. */
    public ReasonCode getReasonCode() {
        return status == Status.MALFORMED_INPUT ? ReasonCode.MALFORMED_INPUT : null;
    }
}
