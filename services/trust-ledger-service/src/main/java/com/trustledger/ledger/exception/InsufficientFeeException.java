package com.trustledger.ledger.exception;

import com.trustledger.common.exception.BusinessException;
import com.trustledger.common.exception.ErrorCode;
import lombok.Getter;

import java.math.BigInteger;

/**
 * Thrown when the value attached to a document creation is below the storage fee.
 */
@Getter
public class InsufficientFeeException extends BusinessException {

    private final BigInteger requiredFee;
    private final BigInteger attachedValue;

    public InsufficientFeeException(BigInteger requiredFee, BigInteger attachedValue) {
        super(ErrorCode.FEE_INSUFFICIENT,
                String.format("Attached value %s is below the storage fee %s", attachedValue, requiredFee));
        this.requiredFee = requiredFee;
        this.attachedValue = attachedValue;
        withMetadata("requiredFee", requiredFee.toString());
        withMetadata("attachedValue", attachedValue.toString());
    }
}
