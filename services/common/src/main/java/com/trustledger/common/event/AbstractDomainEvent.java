package com.trustledger.common.event;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.UUID;

/**
 * Base implementation of a domain event.
 * The timestamp is supplied by the emitter so an event carries the time of the transition
 * that produced it, not the time it was instantiated.
 */
public abstract class AbstractDomainEvent implements DomainEvent {
    private final String eventId;
    private final Instant timestamp;

    protected AbstractDomainEvent(Instant timestamp) {
        this.eventId = UUID.randomUUID().toString();
        this.timestamp = timestamp;
    }

    @Override
    public String getEventId() {
        return eventId;
    }

    @Override
    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public String getEventType() {
        return this.getClass().getSimpleName();
    }

    @Override
    @JsonIgnore
    public abstract String getTopic();
}
