package com.flowledger.service;

import com.flowledger.exception.DefinitionValidationException;
import com.flowledger.model.TriggerType;
import com.flowledger.model.WorkflowDefinition;
import com.flowledger.model.step.ConditionStep;
import com.flowledger.model.step.CreateRuntimeRecordStep;
import com.flowledger.model.step.LogMessageStep;
import com.flowledger.model.step.Step;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Save-time checks for workflow definitions, so malformed definitions never
 * reach the engine. Collects every violation before failing.
 *
 * Violations name the offending step by its path ("0", "0.then.1", ...),
 * the same addressing the engine uses in error messages.
 */
@Component
public class DefinitionValidator {

    static final int MAX_DEPTH = 32;

    public void validate(WorkflowDefinition definition) {
        List<String> violations = new ArrayList<>();

        if (isBlank(definition.getLogicalName())) {
            violations.add("logical name is required");
        }
        if (isBlank(definition.getDisplayName())) {
            violations.add("display name is required");
        }
        if (definition.getMaxAttempts() < WorkflowDefinition.MIN_ATTEMPTS
                || definition.getMaxAttempts() > WorkflowDefinition.MAX_ATTEMPTS) {
            violations.add("max attempts must be between " + WorkflowDefinition.MIN_ATTEMPTS
                    + " and " + WorkflowDefinition.MAX_ATTEMPTS + ", got " + definition.getMaxAttempts());
        }

        TriggerType triggerType = definition.getTriggerType();
        if (triggerType == null) {
            violations.add("trigger type is required");
        } else if (triggerType.isEntityScoped() && isBlank(definition.getTriggerEntityLogicalName())) {
            violations.add("trigger entity is required for " + triggerType.value());
        } else if (!triggerType.isEntityScoped() && definition.getTriggerEntityLogicalName() != null) {
            violations.add("trigger entity is only allowed for "
                    + TriggerType.RUNTIME_RECORD_CREATED.value());
        }

        List<Step> steps = definition.getSteps() == null ? List.of() : definition.getSteps();
        validateSequence(steps, "", 1, violations);

        if (!violations.isEmpty()) {
            throw new DefinitionValidationException(violations);
        }
    }

    private void validateSequence(List<Step> steps, String prefix, int depth, List<String> violations) {
        for (int i = 0; i < steps.size(); i++) {
            String path = ExecutionEngine.childPath(prefix, i);
            Step step = steps.get(i);
            if (step == null) {
                violations.add("step " + path + ": step is empty");
                continue;
            }
            switch (step.getType()) {
                case LOG_MESSAGE -> {
                    if (isBlank(((LogMessageStep) step).getMessage())) {
                        violations.add("step " + path + ": log_message requires a message");
                    }
                }
                case CREATE_RUNTIME_RECORD -> {
                    CreateRuntimeRecordStep create = (CreateRuntimeRecordStep) step;
                    if (isBlank(create.getEntityLogicalName())) {
                        violations.add("step " + path + ": create_runtime_record requires an entity");
                    }
                    if (create.getData() == null || !create.getData().isObject()) {
                        violations.add("step " + path + ": create_runtime_record data must be a JSON object");
                    }
                }
                case CONDITION -> validateCondition((ConditionStep) step, path, depth, violations);
            }
        }
    }

    private void validateCondition(ConditionStep condition, String path, int depth, List<String> violations) {
        if (isBlank(condition.getFieldPath())) {
            violations.add("step " + path + ": condition requires a field path");
        }
        if (condition.getOperator() == null) {
            violations.add("step " + path + ": condition requires an operator");
        } else if (condition.getOperator().requiresComparisonValue() && !condition.hasComparisonValue()) {
            violations.add("step " + path + ": operator " + condition.getOperator().value()
                    + " requires a value");
        } else if (!condition.getOperator().requiresComparisonValue() && condition.hasComparisonValue()) {
            violations.add("step " + path + ": operator " + condition.getOperator().value()
                    + " does not take a value");
        }
        if (condition.getThenLabel() != null && condition.getThenLabel().isBlank()) {
            violations.add("step " + path + ": then label must not be blank");
        }
        if (condition.getElseLabel() != null && condition.getElseLabel().isBlank()) {
            violations.add("step " + path + ": else label must not be blank");
        }
        if (condition.getThenSteps().isEmpty() && condition.getElseSteps().isEmpty()) {
            violations.add("step " + path + ": condition needs at least one step in then or else");
        }
        if (depth >= MAX_DEPTH) {
            violations.add("step " + path + ": conditions nested deeper than " + MAX_DEPTH);
            return;
        }
        validateSequence(condition.getThenSteps(), path + ".then", depth + 1, violations);
        validateSequence(condition.getElseSteps(), path + ".else", depth + 1, violations);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
