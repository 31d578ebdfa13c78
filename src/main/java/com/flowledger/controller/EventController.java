package com.flowledger.controller;

import com.flowledger.dto.RecordCreatedEvent;
import com.flowledger.service.WorkflowDispatcher;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * REST endpoints for submitting triggers directly (alternative to Kafka and
 * the built-in ticker). Useful for testing and for record stores that
 * prefer HTTP over Kafka.
 *
 * POST /events/record-created
 * {
 *   "tenant_id": "acme",
 *   "entity_logical_name": "invoice",
 *   "record_id": "c0a8-...",
 *   "data": {"status": "open"}
 * }
 *
 * POST /events/schedule-tick   (X-Tenant-Id header, no body)
 */
@RestController
@RequestMapping("/events")
@RequiredArgsConstructor
public class EventController {

    private final WorkflowDispatcher dispatcher;
    private final Clock clock;

    @PostMapping("/record-created")
    public ResponseEntity<Map<String, Object>> recordCreated(@Valid @RequestBody RecordCreatedEvent event) {
        List<UUID> runs = dispatcher.dispatchRecordCreated(event);
        return ResponseEntity.accepted()
                .body(Map.of("status", "accepted", "recordId", event.getRecordId(), "runIds", runs));
    }

    @PostMapping("/schedule-tick")
    public ResponseEntity<Map<String, Object>> scheduleTick(
            @RequestHeader(value = TenantHeader.NAME, required = false) String tenantId) {
        Instant now = clock.instant();
        List<UUID> runs = dispatcher.dispatchScheduleTick(TenantHeader.require(tenantId), now, null);
        return ResponseEntity.accepted()
                .body(Map.of("status", "accepted", "timestamp", now.toString(), "runIds", runs));
    }
}
