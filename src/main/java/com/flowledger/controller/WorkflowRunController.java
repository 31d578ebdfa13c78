package com.flowledger.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.flowledger.dto.AttemptResponse;
import com.flowledger.dto.QueueStatsResponse;
import com.flowledger.dto.ReconcileRequest;
import com.flowledger.dto.RunResponse;
import com.flowledger.service.RunJobQueue;
import com.flowledger.service.RunQueryService;
import com.flowledger.service.RunReconciliationService;
import com.flowledger.service.WorkflowDispatcher;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Manual execution and run history.
 *
 * POST /workflows/invoice_follow_up/execute
 * X-Tenant-Id: acme
 * {"status": "open"}
 *
 * → 202 {"status": "accepted", "runId": "..."}
 *
 * The response only says the run was accepted; its outcome is read back
 * from GET /workflows/runs/{runId} and /attempts.
 */
@RestController
@RequestMapping("/workflows")
@RequiredArgsConstructor
public class WorkflowRunController {

    private final WorkflowDispatcher dispatcher;
    private final RunQueryService runQueryService;
    private final RunReconciliationService reconciliationService;
    private final RunJobQueue runJobQueue;

    @PostMapping("/{logicalName}/execute")
    public ResponseEntity<Map<String, String>> execute(
            @RequestHeader(value = TenantHeader.NAME, required = false) String tenantId,
            @PathVariable String logicalName,
            @RequestBody(required = false) JsonNode payload) {
        String tenant = TenantHeader.require(tenantId);
        if (payload != null && !payload.isNull() && !payload.isObject()) {
            throw new IllegalArgumentException("Trigger payload must be a JSON object");
        }
        UUID runId = dispatcher.executeManual(tenant, logicalName, payload);
        return ResponseEntity.accepted()
                .body(Map.of("status", "accepted", "runId", runId.toString()));
    }

    @GetMapping("/runs")
    public ResponseEntity<List<RunResponse>> listRuns(
            @RequestHeader(value = TenantHeader.NAME, required = false) String tenantId,
            @RequestParam(name = "workflow_logical_name", required = false) String workflowLogicalName,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) Integer offset) {
        return ResponseEntity.ok(runQueryService.listRuns(
                TenantHeader.require(tenantId), workflowLogicalName, limit, offset));
    }

    @GetMapping("/runs/stale")
    public ResponseEntity<List<RunResponse>> listStaleRuns(
            @RequestHeader(value = TenantHeader.NAME, required = false) String tenantId) {
        return ResponseEntity.ok(runQueryService.listStaleRuns(TenantHeader.require(tenantId)));
    }

    @GetMapping("/runs/{runId}")
    public ResponseEntity<RunResponse> getRun(
            @RequestHeader(value = TenantHeader.NAME, required = false) String tenantId,
            @PathVariable UUID runId) {
        return ResponseEntity.ok(runQueryService.getRun(TenantHeader.require(tenantId), runId));
    }

    @GetMapping("/runs/{runId}/attempts")
    public ResponseEntity<List<AttemptResponse>> listAttempts(
            @RequestHeader(value = TenantHeader.NAME, required = false) String tenantId,
            @PathVariable UUID runId) {
        return ResponseEntity.ok(runQueryService.listAttempts(TenantHeader.require(tenantId), runId));
    }

    @PostMapping("/runs/{runId}/redrive")
    public ResponseEntity<RunResponse> redrive(
            @RequestHeader(value = TenantHeader.NAME, required = false) String tenantId,
            @PathVariable UUID runId) {
        return ResponseEntity.accepted().body(reconciliationService.redrive(TenantHeader.require(tenantId), runId));
    }

    @PostMapping("/runs/{runId}/abandon")
    public ResponseEntity<RunResponse> abandon(
            @RequestHeader(value = TenantHeader.NAME, required = false) String tenantId,
            @PathVariable UUID runId,
            @RequestBody(required = false) ReconcileRequest request) {
        String reason = request == null ? null : request.getReason();
        return ResponseEntity.ok(reconciliationService.abandon(TenantHeader.require(tenantId), runId, reason));
    }

    /** Job counts of the persisted run queue; all zero unless execution mode is queued. */
    @GetMapping("/queue/stats")
    public ResponseEntity<QueueStatsResponse> queueStats(
            @RequestHeader(value = TenantHeader.NAME, required = false) String tenantId) {
        return ResponseEntity.ok(runJobQueue.stats(TenantHeader.require(tenantId)));
    }
}
