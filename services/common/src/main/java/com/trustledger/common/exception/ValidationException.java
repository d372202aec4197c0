package com.trustledger.common.exception;

/**
 * Thrown when an argument is empty, null or out of range.
 */
public class ValidationException extends BusinessException {

    public ValidationException(ErrorCode errorCode) {
        super(errorCode, null);
    }

    public ValidationException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }
}
