package com.flowledger.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum AttemptStatus {
    SUCCEEDED("succeeded"),
    FAILED("failed");

    private final String value;

    AttemptStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public static AttemptStatus fromValue(String raw) {
        return Arrays.stream(values())
                .filter(s -> s.value.equals(raw))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown attempt status: " + raw));
    }
}
