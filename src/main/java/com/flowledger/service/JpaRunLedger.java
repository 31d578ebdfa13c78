package com.flowledger.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flowledger.config.FlowLedgerProperties;
import com.flowledger.exception.LedgerException;
import com.flowledger.exception.WorkflowNotFoundException;
import com.flowledger.model.AttemptRecord;
import com.flowledger.model.RunStatus;
import com.flowledger.model.WorkflowExecutionAttempt;
import com.flowledger.model.WorkflowExecutionRun;
import com.flowledger.model.WorkflowSnapshot;
import com.flowledger.repository.OffsetLimitRequest;
import com.flowledger.repository.WorkflowAttemptRepository;
import com.flowledger.repository.WorkflowRunRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Relational run ledger.
 *
 * WRITE PATH (recordAttempt), one transaction bounded by
 * flowledger.ledger.transaction-timeout-seconds:
 *   1. SELECT ... FOR UPDATE on the run row  → serializes writers of one run
 *   2. check the transition (RunTransitions)
 *   3. INSERT the attempt row
 *   4. UPDATE attempts / status / finished_at / dead_letter_reason / last_activity_at
 *
 * claimStaleRun and abandonStaleRun take the same lock and re-check staleness
 * under it; abandon writes all its filler attempts in that one transaction.
 *
 * Either both rows change or neither does. Storage failures are rethrown as
 * LedgerException; the caller decides what to do with the run.
 */
@Component
@Slf4j
public class JpaRunLedger implements RunLedger {

    private final WorkflowRunRepository runRepository;
    private final WorkflowAttemptRepository attemptRepository;
    private final ObjectMapper objectMapper;
    private final TransactionTemplate writeTransaction;

    public JpaRunLedger(WorkflowRunRepository runRepository,
                        WorkflowAttemptRepository attemptRepository,
                        ObjectMapper objectMapper,
                        PlatformTransactionManager transactionManager,
                        FlowLedgerProperties properties) {
        this.runRepository = runRepository;
        this.attemptRepository = attemptRepository;
        this.objectMapper = objectMapper;
        this.writeTransaction = new TransactionTemplate(transactionManager);
        this.writeTransaction.setTimeout(properties.getLedger().getTransactionTimeoutSeconds());
    }

    @Override
    public WorkflowExecutionRun startRun(WorkflowSnapshot snapshot, JsonNode triggerPayload, Instant startedAt) {
        WorkflowExecutionRun run = RunTransitions.newRun(snapshot, triggerPayload, startedAt, objectMapper);
        WorkflowExecutionRun saved = write("start run for workflow '" + snapshot.getLogicalName() + "'",
                () -> runRepository.save(run));
        log.info("Run started: id={}, tenant={}, workflow={}, trigger={}",
                saved.getId(), saved.getTenantId(), saved.getWorkflowLogicalName(), saved.getTriggerType());
        return saved;
    }

    @Override
    public WorkflowExecutionRun recordAttempt(UUID runId, AttemptRecord attempt) {
        return write("record attempt " + attempt.getAttemptNumber() + " of run " + runId, () -> {
            WorkflowExecutionRun run = runRepository.findByIdForUpdate(runId)
                    .orElseThrow(() -> new LedgerException("Run not found: " + runId));
            RunTransitions.apply(run, attempt);
            attemptRepository.save(RunTransitions.newAttempt(run, attempt, objectMapper));
            return runRepository.save(run);
        });
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<WorkflowExecutionRun> findRun(String tenantId, UUID runId) {
        return runRepository.findByIdAndTenantId(runId, tenantId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<WorkflowExecutionRun> listRuns(String tenantId, String workflowLogicalName, int limit, int offset) {
        OffsetLimitRequest page = OffsetLimitRequest.of(offset, limit);
        if (workflowLogicalName == null || workflowLogicalName.isBlank()) {
            return runRepository.findByTenantIdOrderByStartedAtDesc(tenantId, page);
        }
        return runRepository.findByTenantIdAndWorkflowLogicalNameOrderByStartedAtDesc(
                tenantId, workflowLogicalName, page);
    }

    @Override
    @Transactional(readOnly = true)
    public List<WorkflowExecutionAttempt> listAttempts(UUID runId) {
        return attemptRepository.findByRunIdOrderByAttemptNumberAsc(runId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<WorkflowExecutionRun> findStaleRuns(String tenantId, Instant inactiveSince) {
        return runRepository.findByTenantIdAndStatusAndLastActivityAtBeforeOrderByLastActivityAtAsc(
                tenantId, RunStatus.RUNNING, inactiveSince);
    }

    @Override
    public WorkflowExecutionRun claimStaleRun(String tenantId, UUID runId, Instant inactiveSince, Instant now) {
        return write("claim stale run " + runId, () -> {
            WorkflowExecutionRun run = lockRun(tenantId, runId);
            RunTransitions.requireStale(run, inactiveSince);
            run.setLastActivityAt(now);
            return runRepository.save(run);
        });
    }

    @Override
    public WorkflowExecutionRun abandonStaleRun(String tenantId, UUID runId, Instant inactiveSince,
                                                String reason, Instant now) {
        return write("abandon run " + runId, () -> {
            WorkflowExecutionRun run = lockRun(tenantId, runId);
            RunTransitions.requireStale(run, inactiveSince);
            for (AttemptRecord record : RunTransitions.abandonRecords(run, reason, now)) {
                RunTransitions.apply(run, record);
                attemptRepository.save(RunTransitions.newAttempt(run, record, objectMapper));
            }
            return runRepository.save(run);
        });
    }

    private WorkflowExecutionRun lockRun(String tenantId, UUID runId) {
        return runRepository.findByIdForUpdate(runId)
                .filter(run -> run.getTenantId().equals(tenantId))
                .orElseThrow(() -> new WorkflowNotFoundException("Run not found: " + runId));
    }

    private <T> T write(String description, Supplier<T> work) {
        try {
            return writeTransaction.execute(status -> work.get());
        } catch (LedgerException e) {
            log.error("Ledger rejected write ({}): {}", description, e.getMessage());
            throw e;
        } catch (DataAccessException | TransactionException e) {
            log.error("Ledger write failed ({}): {}", description, e.getMessage(), e);
            throw new LedgerException("Failed to " + description, e);
        }
    }
}
