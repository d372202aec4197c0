package com.trustledger.ledger.event;

import com.trustledger.ledger.domain.LedgerSubject;
import lombok.Getter;

import java.time.Instant;

/**
 * The creator revoked a document before completion.
 */
@Getter
public class DocumentRevokedEvent extends LedgerEvent {

    private final long documentId;

    public DocumentRevokedEvent(long documentId, Instant timestamp) {
        super(timestamp);
        this.documentId = documentId;
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
