package com.emergencyalerts.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Stable, caller-facing error taxonomy. The code string is part of the API contract and
 * must not change once published; the HTTP status is what the API boundary maps it to.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400),
    BAD_REQUEST("BAD_REQUEST", 400),
    UNAUTHORIZED("UNAUTHORIZED", 401),
    FORBIDDEN("FORBIDDEN", 403),
    NOT_FOUND("NOT_FOUND", 404),
    INVALID_STATE_TRANSITION("INVALID_STATE_TRANSITION", 409),
    CONCURRENT_MODIFICATION("CONCURRENT_MODIFICATION", 409),
    INVALID_POLYGON("INVALID_POLYGON", 422),
    RATE_LIMITED("RATE_LIMITED", 429),
    REQUEST_CANCELLED("REQUEST_CANCELLED", 499),
    INTERNAL_ERROR("INTERNAL_ERROR", 500),
    UPSTREAM_UNAVAILABLE("UPSTREAM_UNAVAILABLE", 503);

    private final String code;
    private final int httpStatus;
}
