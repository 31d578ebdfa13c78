package com.flowledger.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flowledger.exception.RecordCreationException;
import com.flowledger.model.ExecutionContext;
import com.flowledger.model.step.CreateRuntimeRecordStep;
import com.flowledger.model.step.LogMessageStep;
import com.flowledger.model.step.Step;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Executes one side-effecting step against the external collaborators.
 *
 * Supports 2 step types (conditions are evaluated by the engine):
 *   log_message           → resolve the message, append it to the log sink
 *   create_runtime_record → resolve entity + data, call the record store
 *
 * Returns the step's trace detail on success and throws on failure.
 * Never writes to the run ledger.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ActionExecutor {

    private final WorkflowLogSink logSink;
    private final RecordCreationClient recordCreationClient;
    private final TemplateResolver templateResolver;

    public JsonNode execute(Step step, String stepPath, ExecutionContext context) {
        return switch (step.getType()) {
            case LOG_MESSAGE -> logMessage((LogMessageStep) step, stepPath, context);
            case CREATE_RUNTIME_RECORD -> createRecord((CreateRuntimeRecordStep) step, stepPath, context);
            case CONDITION -> throw new IllegalArgumentException(
                    "condition steps are not actions (step " + stepPath + ")");
        };
    }

    /**
     * The idempotency key sent with create_runtime_record. Stable across
     * attempts of one run, so downstream can drop the replay of a record
     * created by an attempt that failed later.
     */
    public static String idempotencyKey(ExecutionContext context, String stepPath) {
        return context.getRunId() + ":" + stepPath;
    }

    private JsonNode logMessage(LogMessageStep step, String stepPath, ExecutionContext context) {
        String message = templateResolver.resolveText(step.getMessage(), context);
        try {
            logSink.append(context, stepPath, message);
        } catch (RuntimeException e) {
            // Log sink is fire-and-forget; it cannot fail the run
            log.warn("Workflow log sink rejected message: run={}, step={}, error={}",
                    context.getRunId(), stepPath, e.getMessage());
        }
        ObjectNode detail = JsonNodeFactory.instance.objectNode();
        detail.put("message", message);
        return detail;
    }

    private JsonNode createRecord(CreateRuntimeRecordStep step, String stepPath, ExecutionContext context) {
        String entity = templateResolver.resolveText(step.getEntityLogicalName(), context);
        if (entity == null || entity.isBlank()) {
            throw new RecordCreationException(RecordCreationException.Kind.VALIDATION_REJECTED, entity,
                    "entity logical name resolved to an empty value");
        }
        JsonNode data = templateResolver.resolve(step.getData(), context);
        if (data == null || !data.isObject()) {
            throw new RecordCreationException(RecordCreationException.Kind.VALIDATION_REJECTED, entity,
                    "record data must be a JSON object");
        }

        String key = idempotencyKey(context, stepPath);
        String recordId = recordCreationClient.create(context.getTenantId(), entity, data, key);
        log.info("Runtime record created: run={}, step={}, entity={}, recordId={}",
                context.getRunId(), stepPath, entity, recordId);

        ObjectNode detail = JsonNodeFactory.instance.objectNode();
        detail.put("entityLogicalName", entity);
        detail.put("recordId", recordId);
        detail.put("idempotencyKey", key);
        return detail;
    }
}
