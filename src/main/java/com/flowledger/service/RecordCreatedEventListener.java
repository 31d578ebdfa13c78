package com.flowledger.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flowledger.dto.RecordCreatedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.UUID;

/**
 * Kafka consumer for record-created notifications.
 *
 * FLOW:
 *   Record store commits a record → topic "flowledger.record-created"
 *                                          ↓
 *                                 RecordCreatedEventListener
 *                                          ↓
 *                                 JSON → RecordCreatedEvent
 *                                          ↓
 *                                 WorkflowDispatcher.dispatchRecordCreated()
 *
 * Unreadable or incomplete messages are logged and skipped; retrying them
 * cannot help. Dispatch failures are rethrown so the container redelivers
 * the message, and dedup keeps the redelivery from starting a run twice.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RecordCreatedEventListener {

    private final WorkflowDispatcher dispatcher;
    private final ObjectMapper objectMapper;

    @KafkaListener(topics = "${flowledger.topics.record-created:flowledger.record-created}",
            groupId = "flowledger-engine")
    public void onRecordCreated(String message) {
        RecordCreatedEvent event;
        try {
            event = objectMapper.readValue(message, RecordCreatedEvent.class);
        } catch (JsonProcessingException e) {
            log.error("Unparseable record-created event skipped: {}", e.getOriginalMessage());
            return;
        }

        if (isBlank(event.getTenantId()) || isBlank(event.getEntityLogicalName()) || isBlank(event.getRecordId())) {
            log.error("Incomplete record-created event skipped: tenant={}, entity={}, recordId={}",
                    event.getTenantId(), event.getEntityLogicalName(), event.getRecordId());
            return;
        }

        List<UUID> runs = dispatcher.dispatchRecordCreated(event);
        log.debug("Record-created event handled: tenant={}, entity={}, recordId={}, runs={}",
                event.getTenantId(), event.getEntityLogicalName(), event.getRecordId(), runs.size());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
