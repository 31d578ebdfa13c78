package com.flowledger.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import com.flowledger.config.FlowLedgerProperties;
import com.flowledger.dto.AttemptResponse;
import com.flowledger.dto.RunResponse;
import com.flowledger.exception.WorkflowNotFoundException;
import com.flowledger.model.WorkflowExecutionAttempt;
import com.flowledger.model.WorkflowExecutionRun;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Read side of the run ledger: run history, attempt ledger, stale runs.
 * Every lookup is tenant-scoped; a run of another tenant is "not found".
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RunQueryService {

    static final int DEFAULT_LIMIT = 50;
    static final int MAX_LIMIT = 200;

    private final RunLedger runLedger;
    private final FlowLedgerProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /** Newest first. limit defaults to 50 and is clamped to [1, 200]; offset to >= 0. */
    public List<RunResponse> listRuns(String tenantId, String workflowLogicalName, Integer limit, Integer offset) {
        int effectiveLimit = limit == null ? DEFAULT_LIMIT : Math.max(1, Math.min(limit, MAX_LIMIT));
        int effectiveOffset = offset == null ? 0 : Math.max(0, offset);
        return runLedger.listRuns(tenantId, workflowLogicalName, effectiveLimit, effectiveOffset).stream()
                .map(this::toResponse)
                .collect(Collectors.toList());
    }

    public RunResponse getRun(String tenantId, UUID runId) {
        return toResponse(findRun(tenantId, runId));
    }

    public List<AttemptResponse> listAttempts(String tenantId, UUID runId) {
        findRun(tenantId, runId);
        return runLedger.listAttempts(runId).stream()
                .map(this::toResponse)
                .collect(Collectors.toList());
    }

    /** RUNNING runs with no activity for flowledger.ledger.stale-threshold, least recently active first. */
    public List<RunResponse> listStaleRuns(String tenantId) {
        return runLedger.findStaleRuns(tenantId, staleCutoff()).stream()
                .map(this::toResponse)
                .collect(Collectors.toList());
    }

    WorkflowExecutionRun findRun(String tenantId, UUID runId) {
        return runLedger.findRun(tenantId, runId)
                .orElseThrow(() -> new WorkflowNotFoundException("Run not found: " + runId));
    }

    Instant staleCutoff() {
        return clock.instant().minus(properties.getLedger().getStaleThreshold());
    }

    // --- Mapping helpers ---

    RunResponse toResponse(WorkflowExecutionRun r) {
        return RunResponse.builder()
                .id(r.getId())
                .workflowLogicalName(r.getWorkflowLogicalName())
                .triggerType(r.getTriggerType())
                .triggerEntityLogicalName(r.getTriggerEntityLogicalName())
                .triggerPayload(readJson(r.getTriggerPayload()))
                .status(r.getStatus())
                .attempts(r.getAttempts())
                .maxAttempts(r.getMaxAttempts())
                .deadLetterReason(r.getDeadLetterReason())
                .startedAt(r.getStartedAt())
                .finishedAt(r.getFinishedAt())
                .lastActivityAt(r.getLastActivityAt())
                .build();
    }

    private AttemptResponse toResponse(WorkflowExecutionAttempt a) {
        return AttemptResponse.builder()
                .runId(a.getRunId())
                .attemptNumber(a.getAttemptNumber())
                .status(a.getStatus())
                .errorMessage(a.getErrorMessage())
                .stepTrace(readJson(a.getStepTrace()))
                .executedAt(a.getExecutedAt())
                .build();
    }

    private JsonNode readJson(String json) {
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            log.warn("Stored JSON is unreadable, returning it as text: {}", e.getOriginalMessage());
            return TextNode.valueOf(json);
        }
    }
}
