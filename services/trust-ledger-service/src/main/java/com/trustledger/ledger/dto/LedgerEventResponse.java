package com.trustledger.ledger.dto;

import com.trustledger.ledger.domain.LedgerEventRecord;
import com.trustledger.ledger.domain.LedgerSubject;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LedgerEventResponse {

    private long sequence;
    private String eventId;
    private String eventType;
    private LedgerSubject subjectType;
    private String subjectId;
    private String actor;

    /** Event fields as emitted, serialized as JSON. */
    private String payload;

    private Instant occurredAt;

    public static LedgerEventResponse from(LedgerEventRecord record) {
        return LedgerEventResponse.builder()
                .sequence(record.getSequence())
                .eventId(record.getEventId())
                .eventType(record.getEventType())
                .subjectType(record.getSubjectType())
                .subjectId(record.getSubjectId())
                .actor(record.getActor())
                .payload(record.getPayload())
                .occurredAt(record.getOccurredAt())
                .build();
    }
}
