package com.flowledger.model.step;

import com.fasterxml.jackson.annotation.JsonValue;

public enum StepType {
    LOG_MESSAGE("log_message"),
    CREATE_RUNTIME_RECORD("create_runtime_record"),
    CONDITION("condition");

    private final String value;

    StepType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
