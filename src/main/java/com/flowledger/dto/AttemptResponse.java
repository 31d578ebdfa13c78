package com.flowledger.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.flowledger.model.AttemptStatus;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class AttemptResponse {
    private UUID runId;
    private int attemptNumber;
    private AttemptStatus status;
    private String errorMessage;
    private JsonNode stepTrace;
    private Instant executedAt;
}
