package com.trustledger.common.exception;

/**
 * Thrown when the caller lacks the role, ownership or identity an operation requires.
 */
public class UnauthorizedException extends BusinessException {

    public UnauthorizedException(ErrorCode errorCode) {
        super(errorCode, null);
    }

    public UnauthorizedException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }
}
