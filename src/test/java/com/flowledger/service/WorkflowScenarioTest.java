package com.flowledger.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flowledger.config.FlowLedgerProperties;
import com.flowledger.exception.RecordCreationException;
import com.flowledger.model.AttemptStatus;
import com.flowledger.model.RunStatus;
import com.flowledger.model.TriggerType;
import com.flowledger.model.WorkflowExecutionAttempt;
import com.flowledger.model.WorkflowExecutionRun;
import com.flowledger.model.WorkflowSnapshot;
import com.flowledger.model.step.CreateRuntimeRecordStep;
import com.flowledger.model.step.LogMessageStep;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * One run of [log_message("start"), create_runtime_record("task", {"title": "x"})]
 * with max_attempts 3, from the first attempt to its terminal state.
 *
 * Engine, action executor, templating, retry loop and ledger are all real;
 * only the record store, the log sink and the dead-letter topic are mocked.
 */
@ExtendWith(MockitoExtension.class)
class WorkflowScenarioTest {

    private static final Instant NOW = Instant.parse("2026-03-10T12:00:00Z");

    @Mock private RecordCreationClient recordCreationClient;
    @Mock private WorkflowLogSink logSink;
    @Mock private DeadLetterPublisher deadLetterPublisher;

    private final ObjectMapper mapper = new ObjectMapper();
    private InMemoryRunLedger ledger;
    private RetryController retryController;

    @BeforeEach
    void setUp() {
        TemplateResolver templateResolver = new TemplateResolver();
        ActionExecutor actionExecutor = new ActionExecutor(logSink, recordCreationClient, templateResolver);
        ExecutionEngine engine = new ExecutionEngine(actionExecutor, new ConditionEvaluator(), templateResolver);
        ledger = new InMemoryRunLedger(mapper);
        retryController = new RetryController(engine, ledger, deadLetterPublisher, new FlowLedgerProperties(),
                mapper, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private WorkflowExecutionRun startRun() throws Exception {
        WorkflowSnapshot snapshot = WorkflowSnapshot.builder()
                .tenantId("acme")
                .logicalName("create_task")
                .triggerType(TriggerType.MANUAL)
                .steps(List.of(
                        new LogMessageStep("start"),
                        new CreateRuntimeRecordStep("task", mapper.readTree("{\"title\": \"x\"}"))))
                .maxAttempts(3)
                .build();
        return ledger.startRun(snapshot, mapper.readTree("{}"), NOW);
    }

    private static RecordCreationException storeDown() {
        return new RecordCreationException(RecordCreationException.Kind.TRANSIENT, "task", "record store unavailable");
    }

    private List<AttemptStatus> attemptStatuses(WorkflowExecutionRun run) {
        return ledger.listAttempts(run.getId()).stream()
                .map(WorkflowExecutionAttempt::getStatus)
                .collect(Collectors.toList());
    }

    @Test
    @DisplayName("Scenario A: both steps succeed on the first attempt")
    void succeedsFirstTime() throws Exception {
        when(recordCreationClient.create(eq("acme"), eq("task"), any(), anyString())).thenReturn("task-1");
        WorkflowExecutionRun run = startRun();

        WorkflowExecutionRun finished = retryController.drive(run);

        assertEquals(RunStatus.SUCCEEDED, finished.getStatus());
        assertEquals(1, finished.getAttempts());
        assertNull(finished.getDeadLetterReason());
        assertEquals(List.of(AttemptStatus.SUCCEEDED), attemptStatuses(run));
        verify(logSink).append(any(), eq("0"), eq("start"));
        JsonNode expectedData = mapper.readTree("{\"title\": \"x\"}");
        verify(recordCreationClient).create("acme", "task", expectedData, run.getId() + ":1");
        verifyNoInteractions(deadLetterPublisher);
    }

    @Test
    @DisplayName("Scenario B: the record store fails twice, the third attempt succeeds")
    void succeedsOnThirdAttempt() throws Exception {
        when(recordCreationClient.create(eq("acme"), eq("task"), any(), anyString()))
                .thenThrow(storeDown())
                .thenThrow(storeDown())
                .thenReturn("task-1");
        WorkflowExecutionRun run = startRun();

        WorkflowExecutionRun finished = retryController.drive(run);

        assertEquals(RunStatus.SUCCEEDED, finished.getStatus());
        assertEquals(3, finished.getAttempts());
        assertEquals(List.of(AttemptStatus.FAILED, AttemptStatus.FAILED, AttemptStatus.SUCCEEDED),
                attemptStatuses(run));
        // every attempt starts over from step 0 and reuses the run's idempotency key
        verify(logSink, times(3)).append(any(), eq("0"), eq("start"));
        verify(recordCreationClient, times(3)).create(eq("acme"), eq("task"), any(), eq(run.getId() + ":1"));
        verifyNoInteractions(deadLetterPublisher);
    }

    @Test
    @DisplayName("Scenario C: every attempt fails and the run is dead-lettered with the last error")
    void deadLettersAfterThreeFailures() throws Exception {
        when(recordCreationClient.create(any(), any(), any(), any())).thenThrow(storeDown());
        WorkflowExecutionRun run = startRun();

        WorkflowExecutionRun finished = retryController.drive(run);

        assertEquals(RunStatus.DEAD_LETTERED, finished.getStatus());
        assertEquals(3, finished.getAttempts());
        assertNotNull(finished.getFinishedAt());
        List<WorkflowExecutionAttempt> attempts = ledger.listAttempts(run.getId());
        assertEquals(List.of(AttemptStatus.FAILED, AttemptStatus.FAILED, AttemptStatus.FAILED),
                attemptStatuses(run));
        String lastError = attempts.get(2).getErrorMessage();
        assertEquals("step 1 (create_runtime_record) failed: record store unavailable", lastError);
        assertEquals(lastError, finished.getDeadLetterReason());
        verify(deadLetterPublisher).publish(finished);
    }
}
