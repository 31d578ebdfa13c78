package com.flowledger.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * One try at executing a run's step graph end to end.
 *
 * attemptNumber starts at 1 and grows by one per attempt with no gaps.
 * At most one attempt per run succeeds, and it is always the last one.
 */
@Entity
@IdClass(AttemptId.class)
@Table(name = "workflow_execution_attempts")
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class WorkflowExecutionAttempt {

    @Id
    @Column(name = "run_id", nullable = false)
    private UUID runId;

    @Id
    @Column(name = "attempt_number", nullable = false)
    private int attemptNumber;

    @Column(name = "tenant_id", nullable = false)
    private String tenantId;

    @Column(nullable = false)
    private AttemptStatus status;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    /** JSON array of the steps this attempt reached, in execution order. */
    @Column(name = "step_trace", columnDefinition = "TEXT")
    private String stepTrace;

    @Column(name = "executed_at", nullable = false)
    private Instant executedAt;
}
