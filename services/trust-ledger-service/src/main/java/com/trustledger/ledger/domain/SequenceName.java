package com.trustledger.ledger.domain;

/**
 * Id sequences owned by the ledger engines, with the first value each hands out.
 */
public enum SequenceName {
    REGISTRY_ITEM(0L),
    ATTESTATION_DOCUMENT(1L);

    private final long firstValue;

    SequenceName(long firstValue) {
        this.firstValue = firstValue;
    }

    public long getFirstValue() {
        return firstValue;
    }
}
