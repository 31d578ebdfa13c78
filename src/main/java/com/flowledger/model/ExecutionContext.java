package com.flowledger.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Everything a step may read while one attempt executes.
 * Built per attempt; nothing in it is shared between runs.
 */
@Value
public class ExecutionContext {

    String tenantId;
    UUID runId;
    int attemptNumber;
    TriggerType triggerType;
    String triggerEntityLogicalName;
    JsonNode triggerPayload;
    Instant now;

    @Builder
    public ExecutionContext(String tenantId, UUID runId, int attemptNumber, TriggerType triggerType,
                            String triggerEntityLogicalName, JsonNode triggerPayload, Instant now) {
        this.tenantId = tenantId;
        this.runId = runId;
        this.attemptNumber = attemptNumber;
        this.triggerType = triggerType;
        this.triggerEntityLogicalName = triggerEntityLogicalName;
        this.triggerPayload = triggerPayload == null ? JsonNodeFactory.instance.objectNode() : triggerPayload;
        this.now = now;
    }
}
