package com.flowledger.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flowledger.exception.LedgerException;
import com.flowledger.exception.WorkflowNotFoundException;
import com.flowledger.model.AttemptRecord;
import com.flowledger.model.RunStatus;
import com.flowledger.model.WorkflowExecutionAttempt;
import com.flowledger.model.WorkflowExecutionRun;
import com.flowledger.model.WorkflowSnapshot;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Process-local run ledger with the same transition rules as the JPA one.
 * Not registered as a bean; used to drive the retry controller and the
 * dispatcher deterministically without a database.
 *
 * Every method is synchronized, which serializes writes per run (and across runs).
 * Returned entities are copies.
 */
public class InMemoryRunLedger implements RunLedger {

    private final ObjectMapper objectMapper;
    private final Map<UUID, WorkflowExecutionRun> runs = new HashMap<>();
    private final Map<UUID, List<WorkflowExecutionAttempt>> attempts = new HashMap<>();

    public InMemoryRunLedger(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public synchronized WorkflowExecutionRun startRun(WorkflowSnapshot snapshot, JsonNode triggerPayload,
                                                      Instant startedAt) {
        WorkflowExecutionRun run = RunTransitions.newRun(snapshot, triggerPayload, startedAt, objectMapper);
        run.setId(UUID.randomUUID());
        runs.put(run.getId(), run);
        attempts.put(run.getId(), new ArrayList<>());
        return copy(run);
    }

    @Override
    public synchronized WorkflowExecutionRun recordAttempt(UUID runId, AttemptRecord attempt) {
        WorkflowExecutionRun stored = runs.get(runId);
        if (stored == null) {
            throw new LedgerException("Run not found: " + runId);
        }
        // Validate against a copy so a rejected write leaves no trace.
        WorkflowExecutionRun updated = copy(stored);
        RunTransitions.apply(updated, attempt);
        attempts.get(runId).add(RunTransitions.newAttempt(updated, attempt, objectMapper));
        runs.put(runId, updated);
        return copy(updated);
    }

    @Override
    public synchronized Optional<WorkflowExecutionRun> findRun(String tenantId, UUID runId) {
        return Optional.ofNullable(runs.get(runId))
                .filter(run -> run.getTenantId().equals(tenantId))
                .map(this::copy);
    }

    @Override
    public synchronized List<WorkflowExecutionRun> listRuns(String tenantId, String workflowLogicalName,
                                                            int limit, int offset) {
        return runs.values().stream()
                .filter(run -> run.getTenantId().equals(tenantId))
                .filter(run -> workflowLogicalName == null || workflowLogicalName.isBlank()
                        || run.getWorkflowLogicalName().equals(workflowLogicalName))
                .sorted(Comparator.comparing(WorkflowExecutionRun::getStartedAt).reversed())
                .skip(offset)
                .limit(limit)
                .map(this::copy)
                .collect(Collectors.toList());
    }

    @Override
    public synchronized List<WorkflowExecutionAttempt> listAttempts(UUID runId) {
        return attempts.getOrDefault(runId, List.of()).stream()
                .sorted(Comparator.comparingInt(WorkflowExecutionAttempt::getAttemptNumber))
                .map(this::copy)
                .collect(Collectors.toList());
    }

    @Override
    public synchronized List<WorkflowExecutionRun> findStaleRuns(String tenantId, Instant inactiveSince) {
        return runs.values().stream()
                .filter(run -> run.getTenantId().equals(tenantId))
                .filter(run -> run.getStatus() == RunStatus.RUNNING)
                .filter(run -> run.getLastActivityAt().isBefore(inactiveSince))
                .sorted(Comparator.comparing(WorkflowExecutionRun::getLastActivityAt))
                .map(this::copy)
                .collect(Collectors.toList());
    }

    @Override
    public synchronized WorkflowExecutionRun claimStaleRun(String tenantId, UUID runId,
                                                           Instant inactiveSince, Instant now) {
        WorkflowExecutionRun stored = requireRun(tenantId, runId);
        RunTransitions.requireStale(stored, inactiveSince);
        stored.setLastActivityAt(now);
        return copy(stored);
    }

    @Override
    public synchronized WorkflowExecutionRun abandonStaleRun(String tenantId, UUID runId, Instant inactiveSince,
                                                             String reason, Instant now) {
        WorkflowExecutionRun stored = requireRun(tenantId, runId);
        RunTransitions.requireStale(stored, inactiveSince);
        WorkflowExecutionRun updated = copy(stored);
        List<WorkflowExecutionAttempt> written = new ArrayList<>();
        for (AttemptRecord record : RunTransitions.abandonRecords(updated, reason, now)) {
            RunTransitions.apply(updated, record);
            written.add(RunTransitions.newAttempt(updated, record, objectMapper));
        }
        attempts.get(runId).addAll(written);
        runs.put(runId, updated);
        return copy(updated);
    }

    private WorkflowExecutionRun requireRun(String tenantId, UUID runId) {
        WorkflowExecutionRun stored = runs.get(runId);
        if (stored == null || !stored.getTenantId().equals(tenantId)) {
            throw new WorkflowNotFoundException("Run not found: " + runId);
        }
        return stored;
    }

    private WorkflowExecutionRun copy(WorkflowExecutionRun run) {
        return WorkflowExecutionRun.builder()
                .id(run.getId())
                .tenantId(run.getTenantId())
                .workflowLogicalName(run.getWorkflowLogicalName())
                .triggerType(run.getTriggerType())
                .triggerEntityLogicalName(run.getTriggerEntityLogicalName())
                .triggerPayload(run.getTriggerPayload())
                .stepGraph(run.getStepGraph())
                .maxAttempts(run.getMaxAttempts())
                .status(run.getStatus())
                .attempts(run.getAttempts())
                .deadLetterReason(run.getDeadLetterReason())
                .startedAt(run.getStartedAt())
                .finishedAt(run.getFinishedAt())
                .lastActivityAt(run.getLastActivityAt())
                .build();
    }

    private WorkflowExecutionAttempt copy(WorkflowExecutionAttempt attempt) {
        return WorkflowExecutionAttempt.builder()
                .runId(attempt.getRunId())
                .attemptNumber(attempt.getAttemptNumber())
                .tenantId(attempt.getTenantId())
                .status(attempt.getStatus())
                .errorMessage(attempt.getErrorMessage())
                .stepTrace(attempt.getStepTrace())
                .executedAt(attempt.getExecutedAt())
                .build();
    }
}
