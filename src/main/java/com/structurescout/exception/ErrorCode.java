package com.structurescout.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400),
    BAD_REQUEST("BAD_REQUEST", 400),
    UNAUTHORIZED("UNAUTHORIZED", 401),
    FORBIDDEN("FORBIDDEN", 403),
    NOT_FOUND("NOT_FOUND", 404),
    CONFLICT("CONFLICT", 409),
    NOT_ELIGIBLE("NOT_ELIGIBLE", 422),
    CONFIGURATION_ERROR("CONFIGURATION_ERROR", 500),
    INTERNAL_ERROR("INTERNAL_ERROR", 500),
    PERSISTENCE_FAILURE("PERSISTENCE_FAILURE", 503);

    private final String code;
    private final int httpStatus;
}
