package com.flowledger.model.step;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Creates a record in the runtime record store.
 * String values inside {@code data} may be {{token}} templates resolved
 * against the trigger context when the step executes.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class CreateRuntimeRecordStep implements Step {

    @JsonProperty("entity_logical_name")
    private final String entityLogicalName;

    @JsonProperty("data")
    private final JsonNode data;

    @JsonCreator
    public CreateRuntimeRecordStep(
            @JsonProperty("entity_logical_name") String entityLogicalName,
            @JsonProperty("data") JsonNode data) {
        this.entityLogicalName = entityLogicalName;
        // deepCopy keeps the snapshot isolated from whoever built the node
        this.data = data == null ? JsonNodeFactory.instance.objectNode() : data.deepCopy();
    }

    @Override
    public StepType getType() {
        return StepType.CREATE_RUNTIME_RECORD;
    }
}
