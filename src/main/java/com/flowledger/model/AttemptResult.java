package com.flowledger.model;

import lombok.Value;

import java.util.List;

/**
 * Outcome of walking a step graph once. Never carries an exception:
 * step failures are already folded into {@link #errorMessage}.
 */
@Value
public class AttemptResult {

    AttemptStatus status;
    String errorMessage;
    String failedStepPath;
    List<StepTrace> trace;

    public static AttemptResult succeeded(List<StepTrace> trace) {
        return new AttemptResult(AttemptStatus.SUCCEEDED, null, null, List.copyOf(trace));
    }

    public static AttemptResult failed(String stepPath, String errorMessage, List<StepTrace> trace) {
        return new AttemptResult(AttemptStatus.FAILED, errorMessage, stepPath, List.copyOf(trace));
    }

    public boolean isSucceeded() {
        return status == AttemptStatus.SUCCEEDED;
    }
}
