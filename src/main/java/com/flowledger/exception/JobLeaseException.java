package com.flowledger.exception;

/**
 * A worker tried to complete or fail a queued job it no longer holds
 * (wrong worker, stale lease token, or the job is not leased).
 */
public class JobLeaseException extends RuntimeException {

    public JobLeaseException(String message) {
        super(message);
    }
}
