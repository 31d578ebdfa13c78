package com.flowledger.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flowledger.config.FlowLedgerProperties;
import com.flowledger.dto.RecordCreatedEvent;
import com.flowledger.dto.TriggerEvent;
import com.flowledger.exception.LedgerException;
import com.flowledger.exception.RunNotReconcilableException;
import com.flowledger.exception.WorkflowNotFoundException;
import com.flowledger.model.TriggerType;
import com.flowledger.model.WorkflowDefinition;
import com.flowledger.model.WorkflowExecutionRun;
import com.flowledger.model.WorkflowSnapshot;
import com.flowledger.repository.WorkflowDefinitionRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Turns triggers into runs.
 *
 * FLOW:
 *   trigger (execute endpoint / record-created event / schedule tick)
 *        ↓
 *   TriggerMatcher → enabled definitions, as snapshots
 *        ↓  (per match)
 *   dedup on (tenant, trigger type, event id, workflow)   ← skipped when no event id
 *        ↓
 *   RunLedger.startRun → run is RUNNING, snapshot stored on the row
 *        ↓
 *   async  → RetryController.drive on the worker pool
 *   inline → RetryController.drive on this thread
 *   queued → RunJobQueue.enqueue; a QueuedRunWorker drives it
 *
 * A run is driven by at most one driver at a time: in async/inline mode this
 * process tracks the runs it has queued or is driving, in queued mode the
 * job row does.
 *
 * Callers only learn which runs were started. How a run ends is visible
 * through the run history, never through this class.
 */
@Service
@Slf4j
public class WorkflowDispatcher {

    private final TriggerMatcher triggerMatcher;
    private final WorkflowDefinitionRepository definitionRepository;
    private final DeduplicationService deduplicationService;
    private final RunLedger runLedger;
    private final RetryController retryController;
    private final RunJobQueue runJobQueue;
    private final TaskExecutor workflowRunExecutor;
    private final FlowLedgerProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Set<UUID> activeRuns = ConcurrentHashMap.newKeySet();

    public WorkflowDispatcher(TriggerMatcher triggerMatcher,
                              WorkflowDefinitionRepository definitionRepository,
                              DeduplicationService deduplicationService,
                              RunLedger runLedger,
                              RetryController retryController,
                              RunJobQueue runJobQueue,
                              @Qualifier("workflowRunExecutor") TaskExecutor workflowRunExecutor,
                              FlowLedgerProperties properties,
                              ObjectMapper objectMapper,
                              Clock clock) {
        this.triggerMatcher = triggerMatcher;
        this.definitionRepository = definitionRepository;
        this.deduplicationService = deduplicationService;
        this.runLedger = runLedger;
        this.retryController = retryController;
        this.runJobQueue = runJobQueue;
        this.workflowRunExecutor = workflowRunExecutor;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Starts one run of a definition by name, whatever its trigger type.
     *
     * @throws WorkflowNotFoundException if the definition is missing or disabled
     */
    public UUID executeManual(String tenantId, String logicalName, JsonNode payload) {
        WorkflowDefinition definition = definitionRepository.findByTenantIdAndLogicalName(tenantId, logicalName)
                .filter(WorkflowDefinition::isEnabled)
                .orElseThrow(() -> new WorkflowNotFoundException(
                        "Workflow not found or disabled: " + logicalName));

        WorkflowExecutionRun run = runLedger.startRun(definition.snapshot(), payloadOrEmpty(payload), clock.instant());
        log.info("Manual execution accepted: tenant={}, workflow={}, run={}", tenantId, logicalName, run.getId());
        submit(run);
        return run.getId();
    }

    /**
     * Starts one run per matching definition.
     *
     * @return ids of the runs started; empty when nothing matched or every
     *         match was a duplicate delivery
     */
    public List<UUID> dispatch(TriggerEvent event) {
        List<WorkflowSnapshot> matches = triggerMatcher.match(event);
        if (matches.isEmpty()) {
            log.debug("No enabled workflow for trigger: tenant={}, type={}, entity={}",
                    event.getTenantId(), event.getTriggerType(), event.getEntityLogicalName());
            return List.of();
        }

        String triggerType = event.getTriggerType().value();
        JsonNode payload = payloadOrEmpty(event.getPayload());
        List<UUID> started = new ArrayList<>();
        for (WorkflowSnapshot snapshot : matches) {
            if (!deduplicationService.firstDelivery(
                    event.getTenantId(), triggerType, event.getEventId(), snapshot.getLogicalName())) {
                continue;
            }

            WorkflowExecutionRun run;
            try {
                run = runLedger.startRun(snapshot, payload, clock.instant());
            } catch (LedgerException e) {
                // The event will be redelivered; let it start this workflow then
                deduplicationService.release(
                        event.getTenantId(), triggerType, event.getEventId(), snapshot.getLogicalName());
                throw e;
            }
            started.add(run.getId());
            submit(run);
        }

        log.info("Trigger dispatched: tenant={}, type={}, entity={}, eventId={}, matched={}, started={}",
                event.getTenantId(), triggerType, event.getEntityLogicalName(), event.getEventId(),
                matches.size(), started.size());
        return started;
    }

    /**
     * Run payload: {"entity_logical_name": ..., "record_id": ..., "data": {...}}.
     * The record id is the dedup id, so a redelivered event starts nothing new.
     */
    public List<UUID> dispatchRecordCreated(RecordCreatedEvent event) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("entity_logical_name", event.getEntityLogicalName());
        payload.put("record_id", event.getRecordId());
        payload.set("data", event.getData() == null ? objectMapper.createObjectNode() : event.getData().deepCopy());

        return dispatch(TriggerEvent.builder()
                .tenantId(event.getTenantId())
                .triggerType(TriggerType.RUNTIME_RECORD_CREATED)
                .entityLogicalName(event.getEntityLogicalName())
                .eventId(event.getRecordId())
                .payload(payload)
                .build());
    }

    /**
     * Run payload: {"timestamp": "<ISO-8601>"}.
     *
     * @param tickId dedup id shared by every node emitting the same tick; may be null
     */
    public List<UUID> dispatchScheduleTick(String tenantId, Instant timestamp, String tickId) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("timestamp", timestamp.toString());

        return dispatch(TriggerEvent.builder()
                .tenantId(tenantId)
                .triggerType(TriggerType.SCHEDULE_TICK)
                .eventId(tickId)
                .payload(payload)
                .build());
    }

    /**
     * Hands an existing RUNNING run to its driver. Also used to re-drive stale runs.
     *
     * @throws RunNotReconcilableException if the run is already queued or being driven
     */
    public void submit(WorkflowExecutionRun run) {
        FlowLedgerProperties.ExecutionMode mode = properties.getExecution().getMode();
        if (mode == FlowLedgerProperties.ExecutionMode.QUEUED) {
            runJobQueue.enqueue(run);
            return;
        }

        if (!activeRuns.add(run.getId())) {
            throw new RunNotReconcilableException("Run " + run.getId() + " is already being driven");
        }
        if (mode == FlowLedgerProperties.ExecutionMode.INLINE) {
            try {
                retryController.drive(run);
            } finally {
                activeRuns.remove(run.getId());
            }
            return;
        }
        try {
            workflowRunExecutor.execute(() -> driveInBackground(run));
        } catch (RuntimeException e) {
            activeRuns.remove(run.getId());
            throw e;
        }
    }

    /** True while some driver holds the run: a pending or leased job, or a task of this process. */
    public boolean isDriving(UUID runId) {
        if (properties.getExecution().getMode() == FlowLedgerProperties.ExecutionMode.QUEUED) {
            return runJobQueue.isActive(runId);
        }
        return activeRuns.contains(runId);
    }

    private void driveInBackground(WorkflowExecutionRun run) {
        try {
            retryController.drive(run);
        } catch (RuntimeException e) {
            // Nobody is waiting on this thread; the run stays RUNNING and shows up as stale
            log.error("CRITICAL: Run could not be completed: run={}, workflow={}, error={}",
                    run.getId(), run.getWorkflowLogicalName(), e.getMessage(), e);
        } finally {
            activeRuns.remove(run.getId());
        }
    }

    private JsonNode payloadOrEmpty(JsonNode payload) {
        return payload == null || payload.isNull() ? objectMapper.createObjectNode() : payload;
    }
}
