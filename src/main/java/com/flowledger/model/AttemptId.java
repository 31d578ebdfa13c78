package com.flowledger.model;

import lombok.*;

import java.io.Serializable;
import java.util.UUID;

/**
 * Composite key of {@link WorkflowExecutionAttempt}: (run id, attempt number).
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @EqualsAndHashCode
public class AttemptId implements Serializable {

    private UUID runId;
    private int attemptNumber;
}
