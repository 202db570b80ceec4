package com.strategymonitor.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Failure kinds surfaced by the REST API. {@code retryable} marks failures the same request
 * may succeed on later, e.g. against a restarted engine.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400, false),
    BAD_REQUEST("BAD_REQUEST", 400, false),
    NOT_FOUND("NOT_FOUND", 404, false),
    UNRECOGNIZED_STRATEGY("UNRECOGNIZED_STRATEGY", 422, false),
    INTERNAL_ERROR("INTERNAL_ERROR", 500, false),
    ENGINE_STOPPED("ENGINE_STOPPED", 503, true);

    private final String code;
    private final int httpStatus;
    private final boolean retryable;
}
