package com.flowledger.model.step;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * Branching step. Evaluates {@code fieldPath operator comparisonValue} and
 * runs exactly one of the two branches. An empty branch is valid.
 *
 * Labels are display hints for the studio canvas and do not affect execution.
 */
@Getter
@EqualsAndHashCode
@ToString
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ConditionStep implements Step {

    @JsonProperty("field_path")
    private final String fieldPath;

    @JsonProperty("operator")
    private final ConditionOperator operator;

    /** Null when absent (required for EXISTS). */
    @JsonProperty("value")
    private final JsonNode comparisonValue;

    @JsonProperty("then_label")
    private final String thenLabel;

    @JsonProperty("else_label")
    private final String elseLabel;

    @JsonProperty("then_steps")
    private final List<Step> thenSteps;

    @JsonProperty("else_steps")
    private final List<Step> elseSteps;

    @Builder
    @JsonCreator
    public ConditionStep(
            @JsonProperty("field_path") String fieldPath,
            @JsonProperty("operator") ConditionOperator operator,
            @JsonProperty("value") JsonNode comparisonValue,
            @JsonProperty("then_label") String thenLabel,
            @JsonProperty("else_label") String elseLabel,
            @JsonProperty("then_steps") List<Step> thenSteps,
            @JsonProperty("else_steps") List<Step> elseSteps) {
        this.fieldPath = fieldPath;
        this.operator = operator;
        this.comparisonValue = comparisonValue == null ? null : comparisonValue.deepCopy();
        this.thenLabel = thenLabel;
        this.elseLabel = elseLabel;
        this.thenSteps = thenSteps == null ? List.of() : List.copyOf(thenSteps);
        this.elseSteps = elseSteps == null ? List.of() : List.copyOf(elseSteps);
    }

    public boolean hasComparisonValue() {
        return comparisonValue != null;
    }

    @Override
    public StepType getType() {
        return StepType.CONDITION;
    }
}
