package com.flowledger.model;

import com.flowledger.model.step.Step;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * A tenant-scoped workflow: WHICH trigger starts it and WHAT step graph runs.
 *
 * Example:
 *   tenantId     = "acme"
 *   logicalName  = "invoice_follow_up"
 *   triggerType  = RUNTIME_RECORD_CREATED
 *   triggerEntityLogicalName = "invoice"
 *   steps        = [ log_message, condition{ then: [create_runtime_record] } ]
 *   maxAttempts  = 3
 *
 * The engine never executes this entity directly; it takes a
 * {@link WorkflowSnapshot} at trigger-match time.
 */
@Entity
@Table(name = "workflow_definitions", uniqueConstraints = {
    @UniqueConstraint(columnNames = {"tenant_id", "logical_name"})
}, indexes = {
    @Index(name = "idx_workflow_definitions_trigger_lookup",
           columnList = "tenant_id, is_enabled, trigger_type, trigger_entity_logical_name")
})
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class WorkflowDefinition {

    public static final int MIN_ATTEMPTS = 1;
    public static final int MAX_ATTEMPTS = 10;

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "tenant_id", nullable = false)
    private String tenantId;

    @Column(name = "logical_name", nullable = false)
    private String logicalName;

    @Column(name = "display_name", nullable = false)
    private String displayName;

    private String description;

    @Column(name = "trigger_type", nullable = false)
    private TriggerType triggerType;

    /** Required for RUNTIME_RECORD_CREATED, null otherwise. */
    @Column(name = "trigger_entity_logical_name")
    private String triggerEntityLogicalName;

    @Convert(converter = StepGraphConverter.class)
    @Column(name = "step_graph", columnDefinition = "TEXT", nullable = false)
    @Builder.Default
    private List<Step> steps = new ArrayList<>();

    @Column(name = "max_attempts", nullable = false)
    @Builder.Default
    private int maxAttempts = 3;

    @Column(name = "is_enabled", nullable = false)
    @Builder.Default
    private boolean enabled = true;

    @Column(name = "created_at", nullable = false, updatable = false)
    @Builder.Default
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    @Builder.Default
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    public WorkflowSnapshot snapshot() {
        return WorkflowSnapshot.builder()
                .tenantId(tenantId)
                .logicalName(logicalName)
                .triggerType(triggerType)
                .triggerEntityLogicalName(triggerEntityLogicalName)
                .steps(steps)
                .maxAttempts(maxAttempts)
                .build();
    }
}
