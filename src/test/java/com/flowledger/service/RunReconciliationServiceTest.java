package com.flowledger.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flowledger.config.FlowLedgerProperties;
import com.flowledger.dto.RunResponse;
import com.flowledger.exception.RunNotReconcilableException;
import com.flowledger.exception.WorkflowNotFoundException;
import com.flowledger.model.AttemptRecord;
import com.flowledger.model.AttemptStatus;
import com.flowledger.model.RunStatus;
import com.flowledger.model.TriggerType;
import com.flowledger.model.WorkflowExecutionAttempt;
import com.flowledger.model.WorkflowExecutionRun;
import com.flowledger.model.WorkflowSnapshot;
import com.flowledger.repository.WorkflowDefinitionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.TaskExecutor;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RunReconciliationServiceTest {

    private static final Instant NOW = Instant.parse("2026-06-01T12:00:00Z");
    private static final Instant LONG_AGO = NOW.minus(Duration.ofHours(1));

    @Mock private WorkflowDispatcher dispatcher;

    private final ObjectMapper mapper = new ObjectMapper();
    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private FlowLedgerProperties properties;
    private InMemoryRunLedger ledger;
    private RunQueryService queryService;
    private RunReconciliationService reconciliationService;

    @BeforeEach
    void setUp() {
        properties = new FlowLedgerProperties();
        ledger = new InMemoryRunLedger(mapper);
        queryService = new RunQueryService(ledger, properties, mapper, clock);
        reconciliationService = new RunReconciliationService(queryService, ledger, dispatcher, clock);
    }

    private WorkflowExecutionRun start(Instant startedAt, int maxAttempts) {
        WorkflowSnapshot snapshot = WorkflowSnapshot.builder()
                .tenantId("acme").logicalName("wf").triggerType(TriggerType.MANUAL).maxAttempts(maxAttempts).build();
        return ledger.startRun(snapshot, null, startedAt);
    }

    private void failAttempt(WorkflowExecutionRun run, int attempt) {
        ledger.recordAttempt(run.getId(), AttemptRecord.builder()
                .attemptNumber(attempt).status(AttemptStatus.FAILED).errorMessage("boom")
                .executedAt(LONG_AGO).runStatus(RunStatus.RUNNING).build());
    }

    @Test
    @DisplayName("redrive() hands a stale run back to the dispatcher")
    void redrive() {
        WorkflowExecutionRun run = start(LONG_AGO, 3);
        failAttempt(run, 1);

        RunResponse response = reconciliationService.redrive("acme", run.getId());

        verify(dispatcher).submit(argThat(r -> r.getId().equals(run.getId()) && r.getAttempts() == 1));
        assertEquals(run.getId(), response.getId());
    }

    @Test
    @DisplayName("abandon() fills the remaining attempts and dead-letters the run")
    void abandon() {
        WorkflowExecutionRun run = start(LONG_AGO, 3);
        failAttempt(run, 1);

        RunResponse response = reconciliationService.abandon("acme", run.getId(), "worker crashed");

        assertEquals(RunStatus.DEAD_LETTERED, response.getStatus());
        assertEquals(3, response.getAttempts());
        assertEquals("abandoned by operator: worker crashed", response.getDeadLetterReason());
        assertEquals(NOW, response.getFinishedAt());
        List<WorkflowExecutionAttempt> attempts = ledger.listAttempts(run.getId());
        assertEquals(3, attempts.size());
        assertTrue(attempts.stream().allMatch(a -> a.getStatus() == AttemptStatus.FAILED));
        verify(dispatcher, never()).submit(any());
    }

    @Test
    @DisplayName("abandon() without a reason uses a default")
    void abandonDefaultReason() {
        WorkflowExecutionRun run = start(LONG_AGO, 1);

        RunResponse response = reconciliationService.abandon("acme", run.getId(), " ");

        assertEquals("abandoned by operator: stale run", response.getDeadLetterReason());
        assertEquals(1, response.getAttempts());
    }

    @Test
    @DisplayName("fresh runs are not reconcilable")
    void freshRun() {
        WorkflowExecutionRun run = start(NOW.minusSeconds(30), 3);

        assertThrows(RunNotReconcilableException.class, () -> reconciliationService.redrive("acme", run.getId()));
        assertThrows(RunNotReconcilableException.class,
                () -> reconciliationService.abandon("acme", run.getId(), null));
        verify(dispatcher, never()).submit(any());
    }

    @Test
    @DisplayName("terminal runs are not reconcilable")
    void terminalRun() {
        WorkflowExecutionRun run = start(LONG_AGO, 1);
        ledger.recordAttempt(run.getId(), AttemptRecord.builder()
                .attemptNumber(1).status(AttemptStatus.SUCCEEDED).executedAt(LONG_AGO)
                .runStatus(RunStatus.SUCCEEDED).build());

        RunNotReconcilableException e = assertThrows(RunNotReconcilableException.class,
                () -> reconciliationService.redrive("acme", run.getId()));
        assertEquals("Run " + run.getId() + " is already succeeded", e.getMessage());
    }

    @Test
    @DisplayName("unknown runs are not found")
    void unknownRun() {
        assertThrows(WorkflowNotFoundException.class,
                () -> reconciliationService.redrive("acme", UUID.randomUUID()));
    }

    @Test
    @DisplayName("a redriven run is not stale again until its new driver goes quiet")
    void redriveRefreshesActivity() {
        WorkflowExecutionRun run = start(LONG_AGO, 3);

        reconciliationService.redrive("acme", run.getId());

        assertEquals(NOW, ledger.findRun("acme", run.getId()).orElseThrow().getLastActivityAt());
        assertTrue(queryService.listStaleRuns("acme").isEmpty());
        RunNotReconcilableException e = assertThrows(RunNotReconcilableException.class,
                () -> reconciliationService.redrive("acme", run.getId()));
        assertEquals("Run " + run.getId() + " is still within the stale threshold", e.getMessage());
        verify(dispatcher, times(1)).submit(any());
    }

    @Test
    @DisplayName("a run some driver still holds is refused without touching the ledger")
    void heldRunRefused() {
        WorkflowExecutionRun run = start(LONG_AGO, 3);
        when(dispatcher.isDriving(run.getId())).thenReturn(true);

        assertThrows(RunNotReconcilableException.class, () -> reconciliationService.redrive("acme", run.getId()));
        assertThrows(RunNotReconcilableException.class,
                () -> reconciliationService.abandon("acme", run.getId(), "gone"));

        assertEquals(LONG_AGO, ledger.findRun("acme", run.getId()).orElseThrow().getLastActivityAt());
        assertTrue(ledger.listAttempts(run.getId()).isEmpty());
        verify(dispatcher, never()).submit(any());
    }

    @Nested
    @DisplayName("With the async worker pool")
    class AsyncDriverTests {

        @Mock private TriggerMatcher triggerMatcher;
        @Mock private WorkflowDefinitionRepository definitionRepository;
        @Mock private DeduplicationService deduplicationService;
        @Mock private RetryController retryController;
        @Mock private RunJobQueue runJobQueue;
        @Mock private TaskExecutor taskExecutor;

        private WorkflowDispatcher asyncDispatcher;
        private RunReconciliationService asyncReconciliation;

        @BeforeEach
        void setUp() {
            properties.getExecution().setMode(FlowLedgerProperties.ExecutionMode.ASYNC);
            asyncDispatcher = new WorkflowDispatcher(triggerMatcher, definitionRepository,
                    deduplicationService, ledger, retryController, runJobQueue, taskExecutor, properties,
                    mapper, clock);
            asyncReconciliation = new RunReconciliationService(queryService, ledger, asyncDispatcher, clock);
        }

        @Test
        @DisplayName("a second redrive while the first driver is still queued is refused")
        void doubleRedrive() {
            WorkflowExecutionRun run = start(LONG_AGO, 3);

            asyncReconciliation.redrive("acme", run.getId());

            assertThrows(RunNotReconcilableException.class, () -> asyncReconciliation.redrive("acme", run.getId()));
            verify(taskExecutor, times(1)).execute(any());
        }

        @Test
        @DisplayName("a run whose original task is still in the pool cannot be redriven, however old")
        void queuedOriginalTask() {
            WorkflowExecutionRun run = start(LONG_AGO, 3);
            asyncDispatcher.submit(run);

            assertThrows(RunNotReconcilableException.class, () -> asyncReconciliation.redrive("acme", run.getId()));
            assertThrows(RunNotReconcilableException.class,
                    () -> asyncReconciliation.abandon("acme", run.getId(), null));
            verifyNoInteractions(retryController);
        }

        @Test
        @DisplayName("once the driver finishes, the run is held by nobody")
        void driverReleasesRun() {
            WorkflowExecutionRun run = start(LONG_AGO, 3);
            asyncReconciliation.redrive("acme", run.getId());
            ArgumentCaptor<Runnable> task = ArgumentCaptor.forClass(Runnable.class);
            verify(taskExecutor).execute(task.capture());

            task.getValue().run();

            verify(retryController).drive(argThat(r -> r.getId().equals(run.getId())));
            RunNotReconcilableException e = assertThrows(RunNotReconcilableException.class,
                    () -> asyncReconciliation.redrive("acme", run.getId()));
            assertEquals("Run " + run.getId() + " is still within the stale threshold", e.getMessage());
        }
    }
}
