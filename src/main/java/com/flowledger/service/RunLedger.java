package com.flowledger.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.flowledger.exception.LedgerException;
import com.flowledger.exception.RunNotReconcilableException;
import com.flowledger.exception.WorkflowNotFoundException;
import com.flowledger.model.AttemptRecord;
import com.flowledger.model.WorkflowExecutionAttempt;
import com.flowledger.model.WorkflowExecutionRun;
import com.flowledger.model.WorkflowSnapshot;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable record of runs and their ordered attempts.
 *
 * Writes for one run are serialized. {@link #recordAttempt} appends the
 * attempt row and updates the run's attempts/status/finishedAt atomically,
 * and rejects any write that would break the ledger rules:
 *   - attempt numbers run 1..attempts with no gaps or repeats
 *   - a terminal run accepts no further attempts
 *   - attempts never exceed maxAttempts; dead-lettering happens exactly at maxAttempts
 *   - only a succeeded attempt can end a run as succeeded
 *
 * Every write failure surfaces as {@link LedgerException}.
 */
public interface RunLedger {

    /**
     * Creates a RUNNING run with zero attempts, storing the definition snapshot
     * so the run can later be re-driven without the live definition.
     */
    WorkflowExecutionRun startRun(WorkflowSnapshot snapshot, JsonNode triggerPayload, Instant startedAt);

    WorkflowExecutionRun recordAttempt(UUID runId, AttemptRecord attempt);

    Optional<WorkflowExecutionRun> findRun(String tenantId, UUID runId);

    /** Newest first by startedAt. workflowLogicalName may be null for all workflows. */
    List<WorkflowExecutionRun> listRuns(String tenantId, String workflowLogicalName, int limit, int offset);

    /** Ordered by attempt number. */
    List<WorkflowExecutionAttempt> listAttempts(UUID runId);

    /** RUNNING runs with no activity since the given instant, least recently active first. */
    List<WorkflowExecutionRun> findStaleRuns(String tenantId, Instant inactiveSince);

    /**
     * Hands a stale run to a new driver: checks, under the run's write lock,
     * that it is RUNNING, has attempts left and has been inactive since
     * {@code inactiveSince}, then moves lastActivityAt to {@code now}. A second
     * claim of the same run is therefore rejected until it goes stale again.
     *
     * @throws RunNotReconcilableException if the run is not stale
     * @throws WorkflowNotFoundException if the tenant has no such run
     */
    WorkflowExecutionRun claimStaleRun(String tenantId, UUID runId, Instant inactiveSince, Instant now);

    /**
     * Dead-letters a stale run in one write: failed attempts are appended up to
     * maxAttempts with {@code reason}, the last one ending the run. Nothing is
     * written when any part is rejected.
     *
     * @throws RunNotReconcilableException if the run is not stale
     * @throws WorkflowNotFoundException if the tenant has no such run
     */
    WorkflowExecutionRun abandonStaleRun(String tenantId, UUID runId, Instant inactiveSince,
                                         String reason, Instant now);
}
