package com.flowledger.service;

import com.flowledger.config.FlowLedgerProperties;
import com.flowledger.exception.LedgerException;
import com.flowledger.model.ClaimedRunJob;
import com.flowledger.model.WorkflowExecutionRun;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.UUID;

/**
 * Worker side of execution mode QUEUED.
 *
 * FLOW (every flowledger.queue.poll-interval-ms):
 *   RunJobQueue.claim(workerId, batch-size, lease)
 *        ↓  (per claimed job, sequentially)
 *   load run → already terminal? → complete job
 *        ↓
 *   RetryController.drive(run) → complete job
 *        ↓  on any failure
 *   fail job with the error; the run stays RUNNING until reconciled
 *
 * Idle in every other execution mode.
 */
@Component
@Slf4j
public class QueuedRunWorker {

    private final RunJobQueue runJobQueue;
    private final RunLedger runLedger;
    private final RetryController retryController;
    private final FlowLedgerProperties properties;
    private final String workerId;

    public QueuedRunWorker(RunJobQueue runJobQueue,
                           RunLedger runLedger,
                           RetryController retryController,
                           FlowLedgerProperties properties) {
        this.runJobQueue = runJobQueue;
        this.runLedger = runLedger;
        this.retryController = retryController;
        this.properties = properties;
        String configured = properties.getQueue().getWorkerId();
        this.workerId = configured == null || configured.isBlank()
                ? "worker-" + UUID.randomUUID() : configured;
    }

    @Scheduled(fixedDelayString = "${flowledger.queue.poll-interval-ms:1000}")
    public void poll() {
        if (properties.getExecution().getMode() != FlowLedgerProperties.ExecutionMode.QUEUED) {
            return;
        }
        try {
            drainOnce();
        } catch (RuntimeException e) {
            log.error("CRITICAL: Queue poll failed: worker={}, error={}", workerId, e.getMessage(), e);
        }
    }

    /** @return number of jobs claimed */
    int drainOnce() {
        FlowLedgerProperties.Queue queue = properties.getQueue();
        List<ClaimedRunJob> jobs = runJobQueue.claim(workerId, queue.getBatchSize(), queue.getLease());
        if (!jobs.isEmpty()) {
            log.info("Claimed queued runs: worker={}, count={}", workerId, jobs.size());
        }
        jobs.forEach(this::process);
        return jobs.size();
    }

    String getWorkerId() {
        return workerId;
    }

    private void process(ClaimedRunJob job) {
        try {
            WorkflowExecutionRun run = runLedger.findRun(job.getTenantId(), job.getRunId())
                    .orElseThrow(() -> new LedgerException("Run not found: " + job.getRunId()));
            if (run.getStatus().isTerminal()) {
                log.info("Queued run already {}: run={}", run.getStatus().value(), run.getId());
            } else {
                retryController.drive(run);
            }
            runJobQueue.complete(job.getJobId(), workerId, job.getLeaseToken());
        } catch (RuntimeException e) {
            log.error("CRITICAL: Queued run could not be completed: run={}, job={}, error={}",
                    job.getRunId(), job.getJobId(), e.getMessage(), e);
            markFailed(job, e);
        }
    }

    private void markFailed(ClaimedRunJob job, RuntimeException cause) {
        try {
            runJobQueue.fail(job.getJobId(), workerId, job.getLeaseToken(), cause.getMessage());
        } catch (RuntimeException markError) {
            log.error("CRITICAL: Queued job could not be marked failed either: job={}, error={}",
                    job.getJobId(), markError.getMessage(), markError);
        }
    }
}
