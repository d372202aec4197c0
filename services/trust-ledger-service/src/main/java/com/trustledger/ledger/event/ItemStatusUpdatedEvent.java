package com.trustledger.ledger.event;

import com.trustledger.ledger.domain.LedgerSubject;
import lombok.Getter;

import java.time.Instant;

/**
 * An item's verification or activity flags were written, by curator moderation or submitter deactivation.
 */
@Getter
public class ItemStatusUpdatedEvent extends LedgerEvent {

    private final long itemId;
    private final boolean verified;
    private final boolean active;

    public ItemStatusUpdatedEvent(long itemId, boolean verified, boolean active, Instant timestamp) {
        super(timestamp);
        this.itemId = itemId;
        this.verified = verified;
        this.active = active;
    }

    @Override
    public String getTopic() {
        return REGISTRY_TOPIC;
    }

    @Override
    public LedgerSubject getSubjectType() {
        return LedgerSubject.ITEM;
    }

    @Override
    public String getSubjectId() {
        return String.valueOf(itemId);
    }
}
