package com.flowledger.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;

/**
 * What happened at one step path during one attempt.
 *
 * detail holds step-specific output:
 *   condition             → {"passes": true, "branch": "then"}
 *   create_runtime_record → {"recordId": "...", "idempotencyKey": "..."}
 *   log_message           → {"message": "resolved text"}
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StepTrace {

    String stepPath;
    String stepType;
    AttemptStatus status;
    String errorMessage;
    long durationMs;
    JsonNode detail;
}
