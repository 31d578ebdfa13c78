package com.flowledger.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * Durable hand-off of one run to the worker fleet (execution mode QUEUED).
 *
 * At most one job per run. A worker holds the job only while its lease is
 * current; complete/fail must present the same worker id and lease token,
 * so a worker whose lease expired and was re-claimed cannot finish the job.
 */
@Entity
@Table(name = "workflow_execution_jobs", uniqueConstraints = {
    @UniqueConstraint(columnNames = {"run_id"})
}, indexes = {
    @Index(name = "idx_workflow_execution_jobs_claim", columnList = "status, lease_expires_at, created_at")
})
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class WorkflowRunJob {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "tenant_id", nullable = false)
    private String tenantId;

    @Column(name = "run_id", nullable = false)
    private UUID runId;

    @Column(nullable = false)
    @Builder.Default
    private JobStatus status = JobStatus.PENDING;

    @Column(name = "leased_by")
    private String leasedBy;

    @Column(name = "lease_token")
    private String leaseToken;

    @Column(name = "lease_expires_at")
    private Instant leaseExpiresAt;

    @Column(name = "last_error", columnDefinition = "TEXT")
    private String lastError;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    /** PENDING, or LEASED by a worker whose lease has not run out. */
    public boolean isActive(Instant now) {
        return status == JobStatus.PENDING
                || (status == JobStatus.LEASED && leaseExpiresAt != null && leaseExpiresAt.isAfter(now));
    }

    public void release(JobStatus newStatus, String error, Instant now) {
        this.status = newStatus;
        this.leasedBy = null;
        this.leaseToken = null;
        this.leaseExpiresAt = null;
        this.lastError = error;
        this.updatedAt = now;
    }
}
