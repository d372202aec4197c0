package com.trustledger.ledger.event;

import com.trustledger.ledger.domain.LedgerSubject;
import lombok.Getter;

import java.time.Instant;

/**
 * A new registry item was stored.
 */
@Getter
public class ItemRegisteredEvent extends LedgerEvent {

    private final long itemId;
    private final String submitter;
    private final String uri;
    private final String category;

    public ItemRegisteredEvent(long itemId, String submitter, String uri, String category, Instant timestamp) {
        super(timestamp);
        this.itemId = itemId;
        this.submitter = submitter;
        this.uri = uri;
        this.category = category;
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
