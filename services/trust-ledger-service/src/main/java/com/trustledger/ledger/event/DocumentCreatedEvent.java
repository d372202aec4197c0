package com.trustledger.ledger.event;

import com.trustledger.ledger.domain.LedgerSubject;
import lombok.Getter;

import java.time.Instant;

/**
 * A document was created and its fee deposited.
 */
@Getter
public class DocumentCreatedEvent extends LedgerEvent {

    private final long documentId;
    private final String creator;
    private final String documentHash;

    public DocumentCreatedEvent(long documentId, String creator, String documentHash, Instant timestamp) {
        super(timestamp);
        this.documentId = documentId;
        this.creator = creator;
        this.documentHash = documentHash;
    }

    @Override
    public String getTopic() {
        return ATTESTATION_TOPIC;
    }

    @Override
    public LedgerSubject getSubjectType() {
        return LedgerSubject.DOCUMENT;
    }

    @Override
    public String getSubjectId() {
        return String.valueOf(documentId);
    }
}
