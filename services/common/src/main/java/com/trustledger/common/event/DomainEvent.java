package com.trustledger.common.event;

import java.time.Instant;

public interface DomainEvent {
    String getEventId();
    String getEventType();
    Instant getTimestamp();
    String getTopic();
}
