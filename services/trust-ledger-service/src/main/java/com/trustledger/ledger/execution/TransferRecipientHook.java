package com.trustledger.ledger.execution;

import java.math.BigInteger;

/**
 * Code the environment runs when an account receives value. A hook may reject the transfer by
 * throwing {@link com.trustledger.ledger.exception.TransferRejectedException}, or call back into
 * the ledger.
 */
@FunctionalInterface
public interface TransferRecipientHook {

    void onValueReceived(String from, String to, BigInteger amount);
}
