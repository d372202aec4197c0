package com.trustledger.ledger.controller;

/**
 * Request headers through which the execution environment supplies call context.
 */
public final class LedgerHeaders {

    /** Identity of the account invoking the operation. */
    public static final String CALLER = "X-Ledger-Caller";

    /** Native value attached to the call. */
    public static final String VALUE = "X-Ledger-Value";

    private LedgerHeaders() {
    }
}
