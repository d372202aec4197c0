package com.trustledger.ledger.domain;

/**
 * Capabilities grantable per account. The set is fixed at initialization.
 */
public enum LedgerRole {
    /** Grants and revokes roles. */
    ADMIN,
    /** Verifies and moderates registry items. */
    CURATOR
}
