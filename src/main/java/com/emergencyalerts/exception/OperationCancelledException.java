package com.emergencyalerts.exception;

/**
 * The caller abandoned the operation before its write was committed. Nothing was persisted.
 */
public class OperationCancelledException extends BaseException {

    public OperationCancelledException(String operation) {
        super(ErrorCode.REQUEST_CANCELLED, String.format("Operation %s cancelled before commit", operation));
    }
}
