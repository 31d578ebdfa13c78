package com.flowledger.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flowledger.dto.RecordCreatedEvent;
import com.flowledger.exception.LedgerException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RecordCreatedEventListenerTest {

    @Mock private WorkflowDispatcher dispatcher;

    private RecordCreatedEventListener listener;

    @BeforeEach
    void setUp() {
        listener = new RecordCreatedEventListener(dispatcher, new ObjectMapper());
    }

    @Test
    @DisplayName("A complete event is dispatched")
    void dispatchesEvent() {
        when(dispatcher.dispatchRecordCreated(any())).thenReturn(List.of(UUID.randomUUID()));

        listener.onRecordCreated("{\"tenant_id\": \"acme\", \"entity_logical_name\": \"invoice\","
                + " \"record_id\": \"rec-1\", \"data\": {\"total\": 5}, \"extra\": true}");

        ArgumentCaptor<RecordCreatedEvent> event = ArgumentCaptor.forClass(RecordCreatedEvent.class);
        verify(dispatcher).dispatchRecordCreated(event.capture());
        assertEquals("acme", event.getValue().getTenantId());
        assertEquals("invoice", event.getValue().getEntityLogicalName());
        assertEquals("rec-1", event.getValue().getRecordId());
        assertEquals(5, event.getValue().getData().get("total").asInt());
    }

    @Test
    @DisplayName("Unparseable messages are skipped")
    void unparseable() {
        assertDoesNotThrow(() -> listener.onRecordCreated("not json"));
        verifyNoInteractions(dispatcher);
    }

    @Test
    @DisplayName("Events missing the record id are skipped")
    void incomplete() {
        listener.onRecordCreated("{\"tenant_id\": \"acme\", \"entity_logical_name\": \"invoice\"}");

        verifyNoInteractions(dispatcher);
    }

    @Test
    @DisplayName("Dispatch failures propagate so the message is redelivered")
    void dispatchFailurePropagates() {
        when(dispatcher.dispatchRecordCreated(any())).thenThrow(new LedgerException("db down"));

        assertThrows(LedgerException.class, () -> listener.onRecordCreated(
                "{\"tenant_id\": \"acme\", \"entity_logical_name\": \"invoice\", \"record_id\": \"rec-1\"}"));
    }
}
