package com.flowledger.exception;

/**
 * A workflow definition or run does not exist for the tenant, or the
 * definition exists but is disabled and cannot be executed.
 */
public class WorkflowNotFoundException extends RuntimeException {

    public WorkflowNotFoundException(String message) {
        super(message);
    }
}
