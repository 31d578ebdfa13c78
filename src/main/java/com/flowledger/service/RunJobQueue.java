package com.flowledger.service;

import com.flowledger.config.FlowLedgerProperties;
import com.flowledger.dto.QueueStatsResponse;
import com.flowledger.exception.JobLeaseException;
import com.flowledger.exception.LedgerException;
import com.flowledger.exception.RunNotReconcilableException;
import com.flowledger.model.ClaimedRunJob;
import com.flowledger.model.JobStatus;
import com.flowledger.model.WorkflowExecutionRun;
import com.flowledger.model.WorkflowRunJob;
import com.flowledger.repository.OffsetLimitRequest;
import com.flowledger.repository.WorkflowRunJobRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Persisted run queue for execution mode QUEUED. Runs survive a restart:
 * a job left LEASED by a dead worker becomes claimable once its lease runs out.
 *
 * JOB LIFECYCLE:
 *   enqueue → PENDING
 *   claim   → LEASED (worker id, fresh lease token, leaseExpiresAt = now + lease)
 *   complete / fail (same worker + token) → COMPLETED / FAILED
 *   LEASED past leaseExpiresAt → claimable again
 *   re-enqueue of a COMPLETED / FAILED job (operator redrive) → PENDING
 *
 * Every write is one transaction bounded by flowledger.ledger.transaction-timeout-seconds.
 */
@Service
@Slf4j
public class RunJobQueue {

    private final WorkflowRunJobRepository jobRepository;
    private final TransactionTemplate writeTransaction;
    private final Clock clock;

    public RunJobQueue(WorkflowRunJobRepository jobRepository,
                       PlatformTransactionManager transactionManager,
                       FlowLedgerProperties properties,
                       Clock clock) {
        this.jobRepository = jobRepository;
        this.clock = clock;
        this.writeTransaction = new TransactionTemplate(transactionManager);
        this.writeTransaction.setTimeout(properties.getLedger().getTransactionTimeoutSeconds());
    }

    /**
     * Queues a RUNNING run for the workers.
     *
     * @throws RunNotReconcilableException if the run already has a pending or currently leased job
     */
    public void enqueue(WorkflowExecutionRun run) {
        write("enqueue run " + run.getId(), () -> {
            Instant now = clock.instant();
            WorkflowRunJob job = jobRepository.findByRunIdForUpdate(run.getId())
                    .orElseGet(() -> WorkflowRunJob.builder()
                            .tenantId(run.getTenantId())
                            .runId(run.getId())
                            .createdAt(now)
                            .build());
            if (job.getId() != null && job.isActive(now)) {
                throw new RunNotReconcilableException("Run " + run.getId() + " is already queued ("
                        + job.getStatus().value() + ")");
            }
            job.release(JobStatus.PENDING, null, now);
            return jobRepository.save(job);
        });
        log.info("Run queued: id={}, workflow={}", run.getId(), run.getWorkflowLogicalName());
    }

    /** True while the run's job is pending or held under a current lease. */
    @Transactional(readOnly = true)
    public boolean isActive(UUID runId) {
        Instant now = clock.instant();
        return jobRepository.findByRunId(runId).map(job -> job.isActive(now)).orElse(false);
    }

    /**
     * Leases up to {@code limit} claimable jobs, oldest first, to {@code workerId}.
     */
    public List<ClaimedRunJob> claim(String workerId, int limit, Duration lease) {
        if (workerId == null || workerId.isBlank()) {
            throw new IllegalArgumentException("workerId must not be empty");
        }
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be greater than zero");
        }
        if (lease == null || lease.isZero() || lease.isNegative()) {
            throw new IllegalArgumentException("lease must be positive");
        }
        return write("claim jobs for worker '" + workerId + "'", () -> {
            Instant now = clock.instant();
            List<WorkflowRunJob> jobs = jobRepository.findClaimable(
                    JobStatus.PENDING, JobStatus.LEASED, now, OffsetLimitRequest.of(0, limit));
            for (WorkflowRunJob job : jobs) {
                if (job.getStatus() == JobStatus.LEASED) {
                    log.warn("Reclaiming job with expired lease: job={}, run={}, previousWorker={}",
                            job.getId(), job.getRunId(), job.getLeasedBy());
                }
                job.setStatus(JobStatus.LEASED);
                job.setLeasedBy(workerId);
                job.setLeaseToken(UUID.randomUUID().toString());
                job.setLeaseExpiresAt(now.plus(lease));
                job.setLastError(null);
                job.setUpdatedAt(now);
            }
            jobRepository.saveAll(jobs);
            return jobs.stream()
                    .map(job -> new ClaimedRunJob(job.getId(), job.getTenantId(), job.getRunId(), job.getLeaseToken()))
                    .collect(Collectors.toList());
        });
    }

    public void complete(UUID jobId, String workerId, String leaseToken) {
        finish(jobId, workerId, leaseToken, JobStatus.COMPLETED, null);
    }

    public void fail(UUID jobId, String workerId, String leaseToken, String error) {
        finish(jobId, workerId, leaseToken, JobStatus.FAILED, error);
    }

    @Transactional(readOnly = true)
    public QueueStatsResponse stats(String tenantId) {
        return QueueStatsResponse.builder()
                .pending(jobRepository.countByTenantIdAndStatus(tenantId, JobStatus.PENDING))
                .leased(jobRepository.countByTenantIdAndStatus(tenantId, JobStatus.LEASED))
                .expiredLeases(jobRepository.countExpiredLeases(tenantId, JobStatus.LEASED, clock.instant()))
                .completed(jobRepository.countByTenantIdAndStatus(tenantId, JobStatus.COMPLETED))
                .failed(jobRepository.countByTenantIdAndStatus(tenantId, JobStatus.FAILED))
                .build();
    }

    private void finish(UUID jobId, String workerId, String leaseToken, JobStatus status, String error) {
        write("mark job " + jobId + " " + status.value(), () -> {
            WorkflowRunJob job = jobRepository.findByIdForUpdate(jobId)
                    .filter(j -> j.getStatus() == JobStatus.LEASED)
                    .filter(j -> workerId.equals(j.getLeasedBy()) && leaseToken.equals(j.getLeaseToken()))
                    .orElseThrow(() -> new JobLeaseException("Job " + jobId
                            + " is not currently leased by worker '" + workerId + "' with matching lease token"));
            job.release(status, error, clock.instant());
            return jobRepository.save(job);
        });
    }

    private <T> T write(String description, Supplier<T> work) {
        try {
            return writeTransaction.execute(status -> work.get());
        } catch (DataAccessException | TransactionException e) {
            log.error("Queue write failed ({}): {}", description, e.getMessage(), e);
            throw new LedgerException("Failed to " + description, e);
        }
    }
}
