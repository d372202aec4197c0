package com.trustledger.common.exception;

import org.springframework.http.HttpStatus;

/**
 * Coarse classification of a rejected ledger operation.
 *
 * Callers use the category to tell whether retrying can ever help:
 * {@link #INVALID_INPUT} and {@link #INSUFFICIENT_FEE} can succeed once the request is adjusted,
 * every other category describes a precondition the caller cannot fix by resubmitting.
 */
public enum FailureCategory {

    UNAUTHORIZED(HttpStatus.FORBIDDEN, false),
    NOT_FOUND(HttpStatus.NOT_FOUND, false),
    INVALID_INPUT(HttpStatus.BAD_REQUEST, true),
    INVALID_STATE(HttpStatus.CONFLICT, false),
    INSUFFICIENT_FEE(HttpStatus.PAYMENT_REQUIRED, true),
    REENTRANT(HttpStatus.CONFLICT, false),
    TRANSFER_REJECTED(HttpStatus.UNPROCESSABLE_ENTITY, false);

    private final HttpStatus status;
    private final boolean correctable;

    FailureCategory(HttpStatus status, boolean correctable) {
        this.status = status;
        this.correctable = correctable;
    }

    public HttpStatus getStatus() {
        return status;
    }

    /**
     * @return true when the same operation may succeed after the caller adjusts its arguments
     */
    public boolean isCorrectable() {
        return correctable;
    }
}
