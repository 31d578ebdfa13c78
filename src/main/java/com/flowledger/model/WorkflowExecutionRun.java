package com.flowledger.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * One row per triggered invocation of a workflow.
 *
 * Append-only after creation except for the terminal fields
 * (status, attempts, deadLetterReason, finishedAt), which only the run
 * ledger writes, together with the matching attempt row.
 *
 * finishedAt is set iff status != RUNNING.
 *
 * lastActivityAt moves forward whenever a driver picks the run up or an
 * attempt is recorded; staleness is measured from it, not from startedAt.
 */
@Entity
@Table(name = "workflow_execution_runs", indexes = {
    @Index(name = "idx_workflow_execution_runs_lookup",
           columnList = "tenant_id, workflow_logical_name, started_at"),
    @Index(name = "idx_workflow_execution_runs_activity",
           columnList = "tenant_id, status, last_activity_at")
})
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class WorkflowExecutionRun {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "tenant_id", nullable = false)
    private String tenantId;

    @Column(name = "workflow_logical_name", nullable = false)
    private String workflowLogicalName;

    @Column(name = "trigger_type", nullable = false)
    private TriggerType triggerType;

    @Column(name = "trigger_entity_logical_name")
    private String triggerEntityLogicalName;

    /** JSON object, as received from the trigger source. */
    @Column(name = "trigger_payload", columnDefinition = "TEXT", nullable = false)
    private String triggerPayload;

    /** Step graph as it was when the trigger matched. Used for re-drives. */
    @Column(name = "step_graph", columnDefinition = "TEXT", nullable = false)
    private String stepGraph;

    @Column(name = "max_attempts", nullable = false)
    private int maxAttempts;

    @Column(nullable = false)
    @Builder.Default
    private RunStatus status = RunStatus.RUNNING;

    @Column(nullable = false)
    @Builder.Default
    private int attempts = 0;

    @Column(name = "dead_letter_reason", columnDefinition = "TEXT")
    private String deadLetterReason;

    @Column(name = "started_at", nullable = false, updatable = false)
    private Instant startedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    @Column(name = "last_activity_at", nullable = false)
    private Instant lastActivityAt;

    public WorkflowSnapshot snapshot() {
        return WorkflowSnapshot.builder()
                .tenantId(tenantId)
                .logicalName(workflowLogicalName)
                .triggerType(triggerType)
                .triggerEntityLogicalName(triggerEntityLogicalName)
                .steps(StepGraphConverter.fromJson(stepGraph))
                .maxAttempts(maxAttempts)
                .build();
    }
}
