package com.flowledger.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * The event class that starts a workflow run.
 * MANUAL                 → explicit invocation through the execute endpoint
 * SCHEDULE_TICK          → periodic clock signal
 * RUNTIME_RECORD_CREATED → record store notification, scoped to one entity
 */
public enum TriggerType {
    MANUAL("manual"),
    SCHEDULE_TICK("schedule_tick"),
    RUNTIME_RECORD_CREATED("runtime_record_created");

    private final String value;

    TriggerType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public boolean isEntityScoped() {
        return this == RUNTIME_RECORD_CREATED;
    }

    @JsonCreator
    public static TriggerType fromValue(String raw) {
        return Arrays.stream(values())
                .filter(t -> t.value.equalsIgnoreCase(raw) || t.name().equalsIgnoreCase(raw))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown trigger type: " + raw));
    }
}
