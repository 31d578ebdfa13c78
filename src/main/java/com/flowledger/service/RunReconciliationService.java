package com.flowledger.service;

import com.flowledger.dto.RunResponse;
import com.flowledger.exception.RunNotReconcilableException;
import com.flowledger.model.WorkflowExecutionRun;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.UUID;

/**
 * Operator actions for runs that never reached a terminal state (for example
 * the process died mid-run). Only RUNNING runs that no driver holds and that
 * saw no activity for flowledger.ledger.stale-threshold qualify.
 *
 *   redrive → continue at attempt (attempts + 1) with the step graph stored on the run
 *   abandon → append failed attempts up to maxAttempts, then DEAD_LETTERED
 *
 * The staleness check is repeated by the ledger under the run's write lock.
 * A redrive claim moves lastActivityAt forward, so a second redrive of the
 * same run is refused until the new driver has gone quiet too. Abandon writes
 * every filler attempt in one ledger write.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RunReconciliationService {

    static final String ABANDON_PREFIX = "abandoned by operator: ";

    private final RunQueryService runQueryService;
    private final RunLedger runLedger;
    private final WorkflowDispatcher dispatcher;
    private final Clock clock;

    public RunResponse redrive(String tenantId, UUID runId) {
        requireIdle(tenantId, runId);
        WorkflowExecutionRun run = runLedger.claimStaleRun(tenantId, runId, runQueryService.staleCutoff(),
                clock.instant());
        log.warn("Re-driving stale run: id={}, workflow={}, nextAttempt={}/{}",
                run.getId(), run.getWorkflowLogicalName(), run.getAttempts() + 1, run.getMaxAttempts());
        dispatcher.submit(run);
        return runQueryService.getRun(tenantId, runId);
    }

    public RunResponse abandon(String tenantId, UUID runId, String reason) {
        requireIdle(tenantId, runId);
        String message = ABANDON_PREFIX + (reason == null || reason.isBlank() ? "stale run" : reason);
        WorkflowExecutionRun abandoned = runLedger.abandonStaleRun(tenantId, runId, runQueryService.staleCutoff(),
                message, clock.instant());
        log.error("Stale run abandoned: id={}, workflow={}, attempts={}, reason={}",
                abandoned.getId(), abandoned.getWorkflowLogicalName(), abandoned.getAttempts(), message);
        return runQueryService.toResponse(abandoned);
    }

    private void requireIdle(String tenantId, UUID runId) {
        runQueryService.findRun(tenantId, runId);
        if (dispatcher.isDriving(runId)) {
            throw new RunNotReconcilableException("Run " + runId + " is already being driven");
        }
    }
}
