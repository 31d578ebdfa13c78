package com.flowledger.model.step;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * One node of a workflow step graph.
 *
 * Serialized with a "type" discriminator:
 *   {"type": "log_message", "message": "start"}
 *   {"type": "create_runtime_record", "entity_logical_name": "task", "data": {"title": "x"}}
 *   {"type": "condition", "field_path": "status", "operator": "eq", "value": "open",
 *    "then_steps": [...], "else_steps": [...]}
 *
 * Implementations are immutable; a condition owns its branch lists, so a graph
 * built top-down is a tree and cannot reference an ancestor.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = LogMessageStep.class, name = "log_message"),
        @JsonSubTypes.Type(value = CreateRuntimeRecordStep.class, name = "create_runtime_record"),
        @JsonSubTypes.Type(value = ConditionStep.class, name = "condition")
})
public interface Step {

    @JsonIgnore
    StepType getType();
}
