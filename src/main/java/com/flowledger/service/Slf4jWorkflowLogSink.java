package com.flowledger.service;

import com.flowledger.model.ExecutionContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Writes workflow log messages to the application log under a dedicated
 * category so they can be routed separately from engine logs.
 */
@Component
@Slf4j(topic = "flowledger.workflow")
public class Slf4jWorkflowLogSink implements WorkflowLogSink {

    @Override
    public void append(ExecutionContext context, String stepPath, String message) {
        log.info("[tenant={} run={} attempt={} step={}] {}",
                context.getTenantId(), context.getRunId(), context.getAttemptNumber(), stepPath, message);
    }
}
