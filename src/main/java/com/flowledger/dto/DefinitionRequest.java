package com.flowledger.dto;

import com.flowledger.model.TriggerType;
import com.flowledger.model.WorkflowDefinition;
import com.flowledger.model.step.Step;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.*;

import java.util.List;

/**
 * Body of PUT /workflows/definitions/{logicalName}. The logical name comes
 * from the path. Steps use the step-graph wire format (snake_case, "type" tag).
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class DefinitionRequest {

    @NotBlank(message = "displayName is required")
    private String displayName;

    private String description;

    @NotNull(message = "triggerType is required")
    private TriggerType triggerType;

    private String triggerEntityLogicalName;

    private List<Step> steps;

    @Min(value = WorkflowDefinition.MIN_ATTEMPTS, message = "maxAttempts must be between 1 and 10")
    @Max(value = WorkflowDefinition.MAX_ATTEMPTS, message = "maxAttempts must be between 1 and 10")
    @Builder.Default
    private int maxAttempts = 3;

    @Builder.Default
    private boolean enabled = true;
}
