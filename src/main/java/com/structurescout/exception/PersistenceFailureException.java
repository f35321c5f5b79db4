package com.structurescout.exception;

/**
 * The durable store rejected a write. The in-memory state was left untouched, so the caller may
 * retry; nothing was admitted or recorded.
 */
public class PersistenceFailureException extends BaseException {

    public PersistenceFailureException(String message, Throwable cause) {
        super(ErrorCode.PERSISTENCE_FAILURE, message, cause);
    }
}
