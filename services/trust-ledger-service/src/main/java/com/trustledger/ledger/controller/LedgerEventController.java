package com.trustledger.ledger.controller;

import com.trustledger.common.api.ApiResponse;
import com.trustledger.ledger.domain.LedgerSubject;
import com.trustledger.ledger.dto.LedgerEventResponse;
import com.trustledger.ledger.event.LedgerEventLog;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/ledger/events")
@RequiredArgsConstructor
@Tag(name = "Event Log", description = "Emitted ledger events in emission order")
public class LedgerEventController {

    private final LedgerEventLog eventLog;

    @GetMapping
    @Operation(summary = "List events, optionally only those of one type")
    public ResponseEntity<ApiResponse<List<LedgerEventResponse>>> events(
            @RequestParam(required = false) String type) {
        List<LedgerEventResponse> events = type != null ? eventLog.eventsOfType(type) : eventLog.allEvents();
        return ResponseEntity.ok(ApiResponse.success(events));
    }

    @GetMapping("/{subjectType}/{subjectId}")
    @Operation(summary = "List events recorded against one item, document or account")
    public ResponseEntity<ApiResponse<List<LedgerEventResponse>>> eventsFor(
            @PathVariable LedgerSubject subjectType,
            @PathVariable String subjectId) {
        return ResponseEntity.ok(ApiResponse.success(eventLog.eventsFor(subjectType, subjectId)));
    }
}
