package com.flowledger.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.flowledger.model.RunStatus;
import com.flowledger.model.TriggerType;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class RunResponse {
    private UUID id;
    private String workflowLogicalName;
    private TriggerType triggerType;
    private String triggerEntityLogicalName;
    private JsonNode triggerPayload;
    private RunStatus status;
    private int attempts;
    private int maxAttempts;
    private String deadLetterReason;
    private Instant startedAt;
    private Instant finishedAt;
    private Instant lastActivityAt;
}
