package com.trustledger.ledger.exception;

import com.trustledger.common.exception.BusinessException;
import com.trustledger.common.exception.ErrorCode;

/**
 * Thrown when the execution environment refuses a native value transfer, either because the
 * sender cannot cover it or because the recipient rejects it.
 */
public class TransferRejectedException extends BusinessException {

    public TransferRejectedException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public static TransferRejectedException byRecipient(String recipient, String reason) {
        TransferRejectedException exception = new TransferRejectedException(ErrorCode.EXEC_TRANSFER_REJECTED,
                String.format("Recipient %s rejected the transfer: %s", recipient, reason));
        exception.withMetadata("recipient", recipient);
        return exception;
    }
}
