package com.flowledger.exception;

/**
 * An operator asked to re-drive or abandon a run that is terminal or
 * not yet past the stale threshold.
 */
public class RunNotReconcilableException extends RuntimeException {

    public RunNotReconcilableException(String message) {
        super(message);
    }
}
