package com.trustledger.ledger.event;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.trustledger.common.event.AbstractDomainEvent;
import com.trustledger.ledger.domain.LedgerSubject;

import java.time.Instant;

/**
 * A record emitted by a ledger state transition.
 */
public abstract class LedgerEvent extends AbstractDomainEvent {

    public static final String ACCESS_TOPIC = "trust-ledger.access";
    public static final String REGISTRY_TOPIC = "trust-ledger.registry";
    public static final String ATTESTATION_TOPIC = "trust-ledger.attestation";

    protected LedgerEvent(Instant timestamp) {
        super(timestamp);
    }

    @JsonIgnore
    public abstract LedgerSubject getSubjectType();

    @JsonIgnore
    public abstract String getSubjectId();
}
