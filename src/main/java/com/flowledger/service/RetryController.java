package com.flowledger.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flowledger.config.FlowLedgerProperties;
import com.flowledger.exception.LedgerException;
import com.flowledger.model.AttemptRecord;
import com.flowledger.model.AttemptResult;
import com.flowledger.model.ExecutionContext;
import com.flowledger.model.RunStatus;
import com.flowledger.model.WorkflowExecutionRun;
import com.flowledger.model.WorkflowSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * Drives a run through its attempts until it succeeds or is dead-lettered.
 *
 * FLOW (per attempt n, starting at run.attempts + 1):
 *
 *   ExecutionEngine.execute(snapshot steps)
 *          ┌──── succeeded ────┴──── failed ────┐
 *          ↓                                     ↓
 *   ledger: attempt n succeeded,          n < maxAttempts?
 *           run SUCCEEDED            ┌── YES ───┴─── NO ──┐
 *                                    ↓                     ↓
 *                   ledger: attempt n failed,   ledger: attempt n failed,
 *                           run still RUNNING           run DEAD_LETTERED
 *                   wait (backoff), n + 1               (reason = attempt n error)
 *                                                       → dead-letter notice
 *
 * Every attempt is in the ledger before the next one starts. Step failures
 * never leave this class; ledger failures do (LedgerException), because the
 * run can no longer be accounted for.
 *
 * BACKOFF (flowledger.retry.*): base-delay-ms * multiplier^(n-1), capped at
 * max-delay-ms. With the default base of 0, retries are immediate.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RetryController {

    private final ExecutionEngine executionEngine;
    private final RunLedger runLedger;
    private final DeadLetterPublisher deadLetterPublisher;
    private final FlowLedgerProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Runs the remaining attempts of a RUNNING run against the step graph
     * stored on the run.
     *
     * @return the run in its terminal state
     */
    public WorkflowExecutionRun drive(WorkflowExecutionRun run) {
        if (run.getStatus() != RunStatus.RUNNING) {
            throw new LedgerException("Run " + run.getId() + " is already " + run.getStatus().value());
        }
        WorkflowSnapshot snapshot = loadSnapshot(run);
        JsonNode payload = loadPayload(run);
        int maxAttempts = run.getMaxAttempts();
        if (run.getAttempts() >= maxAttempts) {
            throw new LedgerException("Run " + run.getId() + " has no attempts left ("
                    + run.getAttempts() + "/" + maxAttempts + ")");
        }

        WorkflowExecutionRun current = run;
        for (int attempt = run.getAttempts() + 1; attempt <= maxAttempts; attempt++) {
            ExecutionContext context = ExecutionContext.builder()
                    .tenantId(run.getTenantId())
                    .runId(run.getId())
                    .attemptNumber(attempt)
                    .triggerType(run.getTriggerType())
                    .triggerEntityLogicalName(run.getTriggerEntityLogicalName())
                    .triggerPayload(payload)
                    .now(clock.instant())
                    .build();

            AttemptResult result = executionEngine.execute(snapshot.getSteps(), context);
            Instant executedAt = clock.instant();

            if (result.isSucceeded()) {
                current = runLedger.recordAttempt(run.getId(), attemptRecord(attempt, result, executedAt,
                        RunStatus.SUCCEEDED, null));
                log.info("Run succeeded: id={}, workflow={}, attempt={}/{}",
                        run.getId(), run.getWorkflowLogicalName(), attempt, maxAttempts);
                return current;
            }

            if (attempt == maxAttempts) {
                current = runLedger.recordAttempt(run.getId(), attemptRecord(attempt, result, executedAt,
                        RunStatus.DEAD_LETTERED, result.getErrorMessage()));
                log.error("Run dead-lettered: id={}, workflow={}, attempts={}, reason={}",
                        run.getId(), run.getWorkflowLogicalName(), attempt, result.getErrorMessage());
                deadLetterPublisher.publish(current);
                return current;
            }

            current = runLedger.recordAttempt(run.getId(), attemptRecord(attempt, result, executedAt,
                    RunStatus.RUNNING, null));
            long delayMs = calculateBackoff(attempt);
            log.warn("Attempt failed, retrying: run={}, attempt={}/{}, backoff={}ms, error={}",
                    run.getId(), attempt, maxAttempts, delayMs, result.getErrorMessage());
            pause(delayMs);
        }
        return current;
    }

    long calculateBackoff(int failedAttempt) {
        FlowLedgerProperties.Retry retry = properties.getRetry();
        if (retry.getBaseDelayMs() <= 0) {
            return 0;
        }
        double delay = retry.getBaseDelayMs() * Math.pow(retry.getMultiplier(), failedAttempt - 1);
        return (long) Math.min(delay, retry.getMaxDelayMs());
    }

    private void pause(long delayMs) {
        if (delayMs <= 0) {
            return;
        }
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException e) {
            // Keep going without the remaining delay; the pool sees the flag on shutdown
            Thread.currentThread().interrupt();
            log.warn("Retry backoff interrupted after {}ms budget", delayMs);
        }
    }

    private AttemptRecord attemptRecord(int attempt, AttemptResult result, Instant executedAt,
                                        RunStatus runStatus, String deadLetterReason) {
        return AttemptRecord.builder()
                .attemptNumber(attempt)
                .status(result.getStatus())
                .errorMessage(result.getErrorMessage())
                .stepTrace(result.getTrace())
                .executedAt(executedAt)
                .runStatus(runStatus)
                .deadLetterReason(deadLetterReason)
                .build();
    }

    private WorkflowSnapshot loadSnapshot(WorkflowExecutionRun run) {
        try {
            return run.snapshot();
        } catch (IllegalStateException e) {
            throw new LedgerException("Stored step graph of run " + run.getId() + " is unreadable", e);
        }
    }

    private JsonNode loadPayload(WorkflowExecutionRun run) {
        if (run.getTriggerPayload() == null) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(run.getTriggerPayload());
        } catch (JsonProcessingException e) {
            throw new LedgerException("Stored trigger payload of run " + run.getId() + " is unreadable", e);
        }
    }
}
