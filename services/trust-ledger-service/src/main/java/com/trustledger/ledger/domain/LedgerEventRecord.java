package com.trustledger.ledger.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Persisted form of an emitted ledger event. Written inside the operation's transaction,
 * so a rolled back operation leaves no record.
 */
@Entity
@Table(name = "ledger_events", indexes = {
        @Index(name = "idx_ledger_events_subject", columnList = "subject_type, subject_id"),
        @Index(name = "idx_ledger_events_type", columnList = "event_type")
})
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LedgerEventRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long sequence;

    @Column(name = "event_id", nullable = false, updatable = false, unique = true, length = 36)
    private String eventId;

    @Column(name = "event_type", nullable = false, updatable = false, length = 64)
    private String eventType;

    @Column(name = "subject_type", nullable = false, updatable = false, length = 20)
    @Enumerated(EnumType.STRING)
    private LedgerSubject subjectType;

    @Column(name = "subject_id", nullable = false, updatable = false, length = 128)
    private String subjectId;

    @Column(name = "actor", nullable = false, updatable = false, length = 128)
    private String actor;

    @Column(name = "payload", nullable = false, updatable = false, length = 16384)
    private String payload;

    @Column(name = "occurred_at", nullable = false, updatable = false)
    private Instant occurredAt;
}
