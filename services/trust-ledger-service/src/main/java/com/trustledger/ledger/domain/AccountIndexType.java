package com.trustledger.ledger.domain;

public enum AccountIndexType {
    SUBMITTED_ITEMS,
    CREATED_DOCUMENTS,
    SIGNER_DOCUMENTS
}
