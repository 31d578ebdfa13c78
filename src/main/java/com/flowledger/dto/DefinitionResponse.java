package com.flowledger.dto;

import com.flowledger.model.TriggerType;
import com.flowledger.model.step.Step;
import lombok.*;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class DefinitionResponse {
    private UUID id;
    private String logicalName;
    private String displayName;
    private String description;
    private TriggerType triggerType;
    private String triggerEntityLogicalName;
    private List<Step> steps;
    private int maxAttempts;
    private boolean enabled;
    private Instant createdAt;
    private Instant updatedAt;
}
