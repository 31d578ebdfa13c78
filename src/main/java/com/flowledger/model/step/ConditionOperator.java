package com.flowledger.model.step;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Operators a condition step can apply to the selected payload value.
 * "equals" and "not_equals" are accepted as older spellings of eq/neq.
 */
public enum ConditionOperator {
    EQ("eq"),
    NEQ("neq"),
    GT("gt"),
    GTE("gte"),
    LT("lt"),
    LTE("lte"),
    CONTAINS("contains"),
    EXISTS("exists");

    private final String value;

    ConditionOperator(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /** EXISTS is the only operator that takes no comparison value. */
    public boolean requiresComparisonValue() {
        return this != EXISTS;
    }

    @JsonCreator
    public static ConditionOperator fromValue(String raw) {
        if ("equals".equalsIgnoreCase(raw)) return EQ;
        if ("not_equals".equalsIgnoreCase(raw)) return NEQ;
        return Arrays.stream(values())
                .filter(op -> op.value.equalsIgnoreCase(raw))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown condition operator: " + raw));
    }
}
