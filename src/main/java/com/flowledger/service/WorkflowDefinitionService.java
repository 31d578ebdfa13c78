package com.flowledger.service;

import com.flowledger.dto.DefinitionRequest;
import com.flowledger.dto.DefinitionResponse;
import com.flowledger.exception.WorkflowNotFoundException;
import com.flowledger.model.WorkflowDefinition;
import com.flowledger.repository.WorkflowDefinitionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Tenant-scoped definition store. A definition is addressed by its logical
 * name; save replaces the whole definition. Runs already started keep the
 * snapshot they were started with.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WorkflowDefinitionService {

    private final WorkflowDefinitionRepository definitionRepository;
    private final DefinitionValidator definitionValidator;

    @Transactional
    public DefinitionResponse save(String tenantId, String logicalName, DefinitionRequest request) {
        WorkflowDefinition definition = definitionRepository.findByTenantIdAndLogicalName(tenantId, logicalName)
                .orElseGet(() -> WorkflowDefinition.builder()
                        .tenantId(tenantId)
                        .logicalName(logicalName)
                        .build());
        boolean created = definition.getId() == null;

        definition.setDisplayName(request.getDisplayName());
        definition.setDescription(request.getDescription());
        definition.setTriggerType(request.getTriggerType());
        definition.setTriggerEntityLogicalName(blankToNull(request.getTriggerEntityLogicalName()));
        definition.setSteps(request.getSteps() == null ? new ArrayList<>() : new ArrayList<>(request.getSteps()));
        definition.setMaxAttempts(request.getMaxAttempts());
        definition.setEnabled(request.isEnabled());

        definitionValidator.validate(definition);

        WorkflowDefinition saved = definitionRepository.save(definition);
        log.info("Workflow definition {}: tenant={}, name={}, trigger={}, enabled={}",
                created ? "created" : "replaced", tenantId, logicalName, saved.getTriggerType(), saved.isEnabled());
        return toResponse(saved);
    }

    @Transactional(readOnly = true)
    public List<DefinitionResponse> list(String tenantId) {
        return definitionRepository.findByTenantIdOrderByLogicalNameAsc(tenantId).stream()
                .map(this::toResponse)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public DefinitionResponse get(String tenantId, String logicalName) {
        return toResponse(find(tenantId, logicalName));
    }

    @Transactional
    public DefinitionResponse toggle(String tenantId, String logicalName) {
        WorkflowDefinition definition = find(tenantId, logicalName);
        definition.setEnabled(!definition.isEnabled());
        WorkflowDefinition saved = definitionRepository.save(definition);
        log.info("Workflow definition {}: tenant={}, name={}",
                saved.isEnabled() ? "enabled" : "disabled", tenantId, logicalName);
        return toResponse(saved);
    }

    @Transactional
    public void delete(String tenantId, String logicalName) {
        WorkflowDefinition definition = find(tenantId, logicalName);
        definitionRepository.delete(definition);
        log.info("Workflow definition deleted: tenant={}, name={}", tenantId, logicalName);
    }

    private WorkflowDefinition find(String tenantId, String logicalName) {
        return definitionRepository.findByTenantIdAndLogicalName(tenantId, logicalName)
                .orElseThrow(() -> new WorkflowNotFoundException("Workflow not found: " + logicalName));
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    // --- Mapping helpers ---

    private DefinitionResponse toResponse(WorkflowDefinition d) {
        return DefinitionResponse.builder()
                .id(d.getId())
                .logicalName(d.getLogicalName())
                .displayName(d.getDisplayName())
                .description(d.getDescription())
                .triggerType(d.getTriggerType())
                .triggerEntityLogicalName(d.getTriggerEntityLogicalName())
                .steps(d.getSteps())
                .maxAttempts(d.getMaxAttempts())
                .enabled(d.isEnabled())
                .createdAt(d.getCreatedAt())
                .updatedAt(d.getUpdatedAt())
                .build();
    }
}
