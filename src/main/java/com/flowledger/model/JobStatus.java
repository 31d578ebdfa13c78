package com.flowledger.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * State of a queued run job.
 * PENDING   → waiting for a worker
 * LEASED    → claimed by one worker until leaseExpiresAt; claimable again after that
 * COMPLETED → the run was driven to a terminal state
 * FAILED    → the worker could not finish the run; lastError says why
 */
public enum JobStatus {
    PENDING("pending"),
    LEASED("leased"),
    COMPLETED("completed"),
    FAILED("failed");

    private final String value;

    JobStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public static JobStatus fromValue(String raw) {
        return Arrays.stream(values())
                .filter(s -> s.value.equals(raw))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown job status: " + raw));
    }
}
