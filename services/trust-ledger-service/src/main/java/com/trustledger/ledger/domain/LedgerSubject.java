package com.trustledger.ledger.domain;

/**
 * What an emitted ledger event is about.
 */
public enum LedgerSubject {
    ITEM,
    DOCUMENT,
    ACCOUNT
}
