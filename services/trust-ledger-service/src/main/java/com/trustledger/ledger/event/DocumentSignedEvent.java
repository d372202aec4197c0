package com.trustledger.ledger.event;

import com.trustledger.ledger.domain.LedgerSubject;
import lombok.Getter;

import java.time.Instant;

/**
 * A required signer attested a document.
 */
@Getter
public class DocumentSignedEvent extends LedgerEvent {

    private final long documentId;
    private final String signer;

    public DocumentSignedEvent(long documentId, String signer, Instant timestamp) {
        super(timestamp);
        this.documentId = documentId;
        this.signer = signer;
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
