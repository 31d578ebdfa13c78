package com.flowledger.repository;

import com.flowledger.model.JobStatus;
import com.flowledger.model.WorkflowRunJob;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface WorkflowRunJobRepository extends JpaRepository<WorkflowRunJob, UUID> {

    Optional<WorkflowRunJob> findByRunId(UUID runId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT j FROM WorkflowRunJob j WHERE j.runId = :runId")
    Optional<WorkflowRunJob> findByRunIdForUpdate(@Param("runId") UUID runId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT j FROM WorkflowRunJob j WHERE j.id = :id")
    Optional<WorkflowRunJob> findByIdForUpdate(@Param("id") UUID id);

    // lock.timeout -2 renders FOR UPDATE SKIP LOCKED: concurrent workers never claim the same job
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "-2"))
    @Query("SELECT j FROM WorkflowRunJob j "
            + "WHERE j.status = :pending OR (j.status = :leased AND j.leaseExpiresAt < :now) "
            + "ORDER BY j.createdAt ASC")
    List<WorkflowRunJob> findClaimable(@Param("pending") JobStatus pending,
                                       @Param("leased") JobStatus leased,
                                       @Param("now") Instant now,
                                       Pageable pageable);

    long countByTenantIdAndStatus(String tenantId, JobStatus status);

    @Query("SELECT COUNT(j) FROM WorkflowRunJob j "
            + "WHERE j.tenantId = :tenantId AND j.status = :leased AND j.leaseExpiresAt < :now")
    long countExpiredLeases(@Param("tenantId") String tenantId,
                            @Param("leased") JobStatus leased,
                            @Param("now") Instant now);
}
