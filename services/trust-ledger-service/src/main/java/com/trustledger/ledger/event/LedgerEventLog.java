package com.trustledger.ledger.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.trustledger.ledger.domain.LedgerEventRecord;
import com.trustledger.ledger.domain.LedgerSubject;
import com.trustledger.ledger.dto.LedgerEventResponse;
import com.trustledger.ledger.repository.LedgerEventRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Append-only log of ledger events.
 *
 * <p>Records are written in the caller's transaction, so an operation that fails after emitting
 * leaves nothing behind. Each event is also published in process for listeners.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerEventLog {

    private final LedgerEventRecordRepository recordRepository;
    private final ObjectMapper objectMapper;
    private final ApplicationEventPublisher applicationEventPublisher;

    public void emit(LedgerEvent event, String actor) {
        LedgerEventRecord record = LedgerEventRecord.builder()
                .eventId(event.getEventId())
                .eventType(event.getEventType())
                .subjectType(event.getSubjectType())
                .subjectId(event.getSubjectId())
                .actor(actor)
                .payload(toJson(event))
                .occurredAt(event.getTimestamp())
                .build();
        recordRepository.save(record);
        applicationEventPublisher.publishEvent(event);

        log.info("Ledger event emitted: type={} subject={}:{} actor={} topic={}",
                event.getEventType(), event.getSubjectType(), event.getSubjectId(), actor, event.getTopic());
    }

    @Transactional(readOnly = true)
    public List<LedgerEventResponse> eventsFor(LedgerSubject subjectType, String subjectId) {
        return recordRepository.findBySubjectTypeAndSubjectIdOrderBySequenceAsc(subjectType, subjectId).stream()
                .map(LedgerEventResponse::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<LedgerEventResponse> eventsOfType(String eventType) {
        return recordRepository.findByEventTypeOrderBySequenceAsc(eventType).stream()
                .map(LedgerEventResponse::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<LedgerEventResponse> allEvents() {
        return recordRepository.findAllByOrderBySequenceAsc().stream()
                .map(LedgerEventResponse::from)
                .toList();
    }

    private String toJson(LedgerEvent event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize ledger event " + event.getEventType(), e);
        }
    }
}
