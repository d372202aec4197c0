package com.trustledger.ledger.exception;

import com.trustledger.common.exception.BusinessException;
import com.trustledger.common.exception.ErrorCode;

/**
 * Thrown when a guarded operation is entered while a guarded operation is already in progress.
 */
public class ReentrantCallException extends BusinessException {

    public ReentrantCallException(String operation, String operationInProgress) {
        super(ErrorCode.EXEC_REENTRANT_CALL,
                String.format("Re-entrant call to %s while %s is in progress", operation, operationInProgress));
        withMetadata("operation", operation);
        withMetadata("operationInProgress", operationInProgress);
    }
}
