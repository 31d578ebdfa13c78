package com.flowledger.repository;

import com.flowledger.model.AttemptId;
import com.flowledger.model.WorkflowExecutionAttempt;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

/**
 * findByRunIdOrderByAttemptNumberAsc(runId)
 * → SELECT * FROM workflow_execution_attempts WHERE run_id = ? ORDER BY attempt_number ASC
 */
public interface WorkflowAttemptRepository extends JpaRepository<WorkflowExecutionAttempt, AttemptId> {

    List<WorkflowExecutionAttempt> findByRunIdOrderByAttemptNumberAsc(UUID runId);
}
