package com.trustledger.ledger.event;

import com.trustledger.ledger.domain.LedgerSubject;
import lombok.Getter;

import java.time.Instant;

/**
 * Every required signer has attested; emitted once per document.
 */
@Getter
public class DocumentCompletedEvent extends LedgerEvent {

    private final long documentId;

    public DocumentCompletedEvent(long documentId, Instant timestamp) {
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
