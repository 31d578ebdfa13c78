package com.flowledger.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Lifecycle of one workflow run. RUNNING is the only non-terminal state.
 */
public enum RunStatus {
    RUNNING("running"),
    SUCCEEDED("succeeded"),
    DEAD_LETTERED("dead_lettered");

    private final String value;

    RunStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public boolean isTerminal() {
        return this != RUNNING;
    }

    public static RunStatus fromValue(String raw) {
        return Arrays.stream(values())
                .filter(s -> s.value.equals(raw))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown run status: " + raw));
    }
}
