package com.emergencyalerts.exception;

import java.util.Map;

/**
 * Malformed input. The caller's fault; never retried.
 */
public class ValidationException extends BaseException {

    public ValidationException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
    }

    public ValidationException(String field, String message) {
        super(ErrorCode.VALIDATION_ERROR, message, Map.of("field", field));
    }

    protected ValidationException(ErrorCode errorCode, String message, Map<String, Object> details) {
        super(errorCode, message, details);
    }
}
