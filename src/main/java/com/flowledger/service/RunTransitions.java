package com.flowledger.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flowledger.exception.LedgerException;
import com.flowledger.exception.RunNotReconcilableException;
import com.flowledger.model.AttemptRecord;
import com.flowledger.model.AttemptStatus;
import com.flowledger.model.RunStatus;
import com.flowledger.model.StepGraphConverter;
import com.flowledger.model.WorkflowExecutionAttempt;
import com.flowledger.model.WorkflowExecutionRun;
import com.flowledger.model.WorkflowSnapshot;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Row-building and transition checks shared by the ledger adapters, so the
 * JPA store and the in-memory store enforce identical rules.
 */
final class RunTransitions {

    private RunTransitions() {
    }

    static WorkflowExecutionRun newRun(WorkflowSnapshot snapshot, JsonNode triggerPayload,
                                       Instant startedAt, ObjectMapper objectMapper) {
        return WorkflowExecutionRun.builder()
                .tenantId(snapshot.getTenantId())
                .workflowLogicalName(snapshot.getLogicalName())
                .triggerType(snapshot.getTriggerType())
                .triggerEntityLogicalName(snapshot.getTriggerEntityLogicalName())
                .triggerPayload(toJson(objectMapper, triggerPayload == null
                        ? objectMapper.createObjectNode() : triggerPayload))
                .stepGraph(StepGraphConverter.toJson(snapshot.getSteps()))
                .maxAttempts(snapshot.getMaxAttempts())
                .status(RunStatus.RUNNING)
                .attempts(0)
                .startedAt(startedAt)
                .lastActivityAt(startedAt)
                .build();
    }

    /**
     * Checks that {@code record} is the next legal step for {@code run} and
     * applies it to the run. The run is left untouched when the check fails.
     */
    static void apply(WorkflowExecutionRun run, AttemptRecord record) {
        if (run.getStatus().isTerminal()) {
            throw new LedgerException("Run " + run.getId() + " is already " + run.getStatus().value());
        }
        int expected = run.getAttempts() + 1;
        if (record.getAttemptNumber() != expected) {
            throw new LedgerException("Run " + run.getId() + " expected attempt " + expected
                    + " but got " + record.getAttemptNumber());
        }
        if (record.getAttemptNumber() > run.getMaxAttempts()) {
            throw new LedgerException("Run " + run.getId() + " allows at most "
                    + run.getMaxAttempts() + " attempts");
        }
        if (record.getStatus() == null || record.getRunStatus() == null || record.getExecutedAt() == null) {
            throw new LedgerException("Attempt " + record.getAttemptNumber() + " of run " + run.getId()
                    + " is missing status or timestamp");
        }
        switch (record.getRunStatus()) {
            case SUCCEEDED -> {
                if (record.getStatus() != AttemptStatus.SUCCEEDED) {
                    throw new LedgerException("A failed attempt cannot complete run " + run.getId());
                }
            }
            case DEAD_LETTERED -> {
                if (record.getStatus() != AttemptStatus.FAILED) {
                    throw new LedgerException("A succeeded attempt cannot dead-letter run " + run.getId());
                }
                if (record.getAttemptNumber() != run.getMaxAttempts()) {
                    throw new LedgerException("Run " + run.getId() + " can only be dead-lettered at attempt "
                            + run.getMaxAttempts());
                }
            }
            case RUNNING -> {
                if (record.getStatus() != AttemptStatus.FAILED) {
                    throw new LedgerException("A succeeded attempt must complete run " + run.getId());
                }
                if (record.getAttemptNumber() == run.getMaxAttempts()) {
                    throw new LedgerException("Last attempt of run " + run.getId() + " must be terminal");
                }
            }
        }

        run.setAttempts(record.getAttemptNumber());
        run.setStatus(record.getRunStatus());
        run.setLastActivityAt(record.getExecutedAt());
        if (record.getRunStatus().isTerminal()) {
            run.setFinishedAt(record.getExecutedAt());
        }
        if (record.getRunStatus() == RunStatus.DEAD_LETTERED) {
            run.setDeadLetterReason(record.getDeadLetterReason() != null
                    ? record.getDeadLetterReason() : record.getErrorMessage());
        }
    }

    /**
     * A run can be taken over by an operator only while it is RUNNING, has
     * attempts left, and nothing touched it since {@code inactiveSince}.
     */
    static void requireStale(WorkflowExecutionRun run, Instant inactiveSince) {
        if (run.getStatus() != RunStatus.RUNNING) {
            throw new RunNotReconcilableException("Run " + run.getId() + " is already " + run.getStatus().value());
        }
        if (!run.getLastActivityAt().isBefore(inactiveSince)) {
            throw new RunNotReconcilableException("Run " + run.getId() + " is still within the stale threshold");
        }
        if (run.getAttempts() >= run.getMaxAttempts()) {
            throw new RunNotReconcilableException("Run " + run.getId() + " has no attempts left");
        }
    }

    /** Failed attempts from attempts + 1 up to maxAttempts; the last one dead-letters the run. */
    static List<AttemptRecord> abandonRecords(WorkflowExecutionRun run, String reason, Instant at) {
        List<AttemptRecord> records = new ArrayList<>();
        for (int attempt = run.getAttempts() + 1; attempt <= run.getMaxAttempts(); attempt++) {
            boolean last = attempt == run.getMaxAttempts();
            records.add(AttemptRecord.builder()
                    .attemptNumber(attempt)
                    .status(AttemptStatus.FAILED)
                    .errorMessage(reason)
                    .executedAt(at)
                    .runStatus(last ? RunStatus.DEAD_LETTERED : RunStatus.RUNNING)
                    .deadLetterReason(last ? reason : null)
                    .build());
        }
        return records;
    }

    static WorkflowExecutionAttempt newAttempt(WorkflowExecutionRun run, AttemptRecord record,
                                               ObjectMapper objectMapper) {
        return WorkflowExecutionAttempt.builder()
                .runId(run.getId())
                .attemptNumber(record.getAttemptNumber())
                .tenantId(run.getTenantId())
                .status(record.getStatus())
                .errorMessage(record.getErrorMessage())
                .stepTrace(toJson(objectMapper, record.getStepTrace()))
                .executedAt(record.getExecutedAt())
                .build();
    }

    static String toJson(ObjectMapper objectMapper, Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new LedgerException("Ledger value could not be serialized: " + e.getOriginalMessage(), e);
        }
    }
}
