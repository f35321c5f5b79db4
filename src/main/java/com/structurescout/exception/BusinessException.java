package com.structurescout.exception;

import java.util.Map;

/**
 * A request the engine understood but refuses (wrong halt confirmation, phase not eligible...).
 * Raised only by the REST shell; the services themselves return typed results.
 */
public class BusinessException extends BaseException {

    public BusinessException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public BusinessException(ErrorCode errorCode, String message, Map<String, Object> details) {
        super(errorCode, message, details);
    }
}
