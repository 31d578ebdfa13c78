package com.flowledger.service;

import com.flowledger.model.ExecutionContext;

/**
 * Observability sink for log_message steps. Fire-and-forget: implementations
 * must not throw for a well-formed message.
 */
public interface WorkflowLogSink {

    void append(ExecutionContext context, String stepPath, String message);
}
