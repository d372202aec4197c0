package com.trustledger.ledger.execution;

import java.math.BigInteger;

/**
 * Native value-transfer primitive of the execution environment.
 */
public interface ValueTransferGateway {

    BigInteger balanceOf(String account);

    /**
     * Moves {@code amount} from one account to another and notifies the recipient.
     *
     * @throws com.trustledger.ledger.exception.TransferRejectedException if the sender cannot
     *         cover the amount or the recipient refuses it
     */
    void transfer(String from, String to, BigInteger amount);
}
