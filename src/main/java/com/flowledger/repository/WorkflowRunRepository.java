package com.flowledger.repository;

import com.flowledger.model.RunStatus;
import com.flowledger.model.WorkflowExecutionRun;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface WorkflowRunRepository extends JpaRepository<WorkflowExecutionRun, UUID> {

    Optional<WorkflowExecutionRun> findByIdAndTenantId(UUID id, String tenantId);

    // Row lock that serializes every ledger write for one run
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM WorkflowExecutionRun r WHERE r.id = :id")
    Optional<WorkflowExecutionRun> findByIdForUpdate(@Param("id") UUID id);

    List<WorkflowExecutionRun> findByTenantIdOrderByStartedAtDesc(String tenantId, Pageable pageable);

    List<WorkflowExecutionRun> findByTenantIdAndWorkflowLogicalNameOrderByStartedAtDesc(
            String tenantId, String workflowLogicalName, Pageable pageable);

    List<WorkflowExecutionRun> findByTenantIdAndStatusAndLastActivityAtBeforeOrderByLastActivityAtAsc(
            String tenantId, RunStatus status, Instant inactiveSince);
}
