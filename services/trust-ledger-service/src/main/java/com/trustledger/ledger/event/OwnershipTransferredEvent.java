package com.trustledger.ledger.event;

import com.trustledger.ledger.domain.LedgerSubject;
import lombok.Getter;

import java.time.Instant;

/**
 * Ownership moved to a new account. Role grants are not affected.
 */
@Getter
public class OwnershipTransferredEvent extends LedgerEvent {

    private final String previousOwner;
    private final String newOwner;

    public OwnershipTransferredEvent(String previousOwner, String newOwner, Instant timestamp) {
        super(timestamp);
        this.previousOwner = previousOwner;
        this.newOwner = newOwner;
    }

    @Override
    public String getTopic() {
        return ACCESS_TOPIC;
    }

    @Override
    public LedgerSubject getSubjectType() {
        return LedgerSubject.ACCOUNT;
    }

    @Override
    public String getSubjectId() {
        return newOwner;
    }
}
