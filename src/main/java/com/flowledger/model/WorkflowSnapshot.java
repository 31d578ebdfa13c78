package com.flowledger.model;

import com.flowledger.model.step.Step;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Immutable copy of a definition taken when a trigger matched.
 * A run executes against this, so edits to the definition after the
 * match never reach an in-flight run.
 */
@Value
public class WorkflowSnapshot {

    String tenantId;
    String logicalName;
    TriggerType triggerType;
    String triggerEntityLogicalName;
    List<Step> steps;
    int maxAttempts;

    @Builder
    public WorkflowSnapshot(String tenantId, String logicalName, TriggerType triggerType,
                            String triggerEntityLogicalName, List<Step> steps, int maxAttempts) {
        this.tenantId = tenantId;
        this.logicalName = logicalName;
        this.triggerType = triggerType;
        this.triggerEntityLogicalName = triggerEntityLogicalName;
        this.steps = steps == null ? List.of() : List.copyOf(steps);
        this.maxAttempts = maxAttempts;
    }
}
