package com.flowledger.repository;

import com.flowledger.model.TriggerType;
import com.flowledger.model.WorkflowDefinition;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Database access for WorkflowDefinition entities.
 *
 * findByTenantIdAndTriggerTypeAndEnabledTrueOrderByLogicalNameAsc("acme", MANUAL)
 * → SELECT * FROM workflow_definitions
 *   WHERE tenant_id = ? AND trigger_type = ? AND enabled = true ORDER BY logical_name
 */
public interface WorkflowDefinitionRepository extends JpaRepository<WorkflowDefinition, UUID> {

    Optional<WorkflowDefinition> findByTenantIdAndLogicalName(String tenantId, String logicalName);

    List<WorkflowDefinition> findByTenantIdOrderByLogicalNameAsc(String tenantId);

    // Trigger matching: type-only triggers (manual, schedule_tick)
    List<WorkflowDefinition> findByTenantIdAndTriggerTypeAndEnabledTrueOrderByLogicalNameAsc(
            String tenantId, TriggerType triggerType);

    // Trigger matching: entity-scoped triggers (runtime_record_created)
    List<WorkflowDefinition> findByTenantIdAndTriggerTypeAndTriggerEntityLogicalNameAndEnabledTrueOrderByLogicalNameAsc(
            String tenantId, TriggerType triggerType, String triggerEntityLogicalName);

    // Used by the schedule ticker: which tenants have anything to tick
    @Query("SELECT DISTINCT d.tenantId FROM WorkflowDefinition d "
            + "WHERE d.triggerType = :triggerType AND d.enabled = true")
    List<String> findTenantsWithEnabledTrigger(@Param("triggerType") TriggerType triggerType);
}
