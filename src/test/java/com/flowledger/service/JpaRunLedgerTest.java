package com.flowledger.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flowledger.config.FlowLedgerProperties;
import com.flowledger.exception.LedgerException;
import com.flowledger.exception.RunNotReconcilableException;
import com.flowledger.model.AttemptRecord;
import com.flowledger.model.AttemptStatus;
import com.flowledger.model.RunStatus;
import com.flowledger.model.TriggerType;
import com.flowledger.model.WorkflowExecutionAttempt;
import com.flowledger.model.WorkflowExecutionRun;
import com.flowledger.model.WorkflowSnapshot;
import com.flowledger.repository.OffsetLimitRequest;
import com.flowledger.repository.WorkflowAttemptRepository;
import com.flowledger.repository.WorkflowRunRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.SimpleTransactionStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class JpaRunLedgerTest {

    private static final Instant T0 = Instant.parse("2026-01-10T12:00:00Z");

    @Mock private WorkflowRunRepository runRepository;
    @Mock private WorkflowAttemptRepository attemptRepository;
    @Mock private PlatformTransactionManager transactionManager;

    private final ObjectMapper mapper = new ObjectMapper();
    private JpaRunLedger ledger;

    @BeforeEach
    void setUp() {
        FlowLedgerProperties properties = new FlowLedgerProperties();
        properties.getLedger().setTransactionTimeoutSeconds(7);
        ledger = new JpaRunLedger(runRepository, attemptRepository, mapper, transactionManager, properties);
    }

    private void openTransactions() {
        when(transactionManager.getTransaction(any())).thenReturn(new SimpleTransactionStatus());
    }

    private WorkflowExecutionRun runningRun(UUID id, int attempts, int maxAttempts) {
        return WorkflowExecutionRun.builder()
                .id(id)
                .tenantId("acme")
                .workflowLogicalName("wf")
                .triggerType(TriggerType.MANUAL)
                .triggerPayload("{}")
                .stepGraph("[]")
                .maxAttempts(maxAttempts)
                .attempts(attempts)
                .status(RunStatus.RUNNING)
                .startedAt(T0)
                .lastActivityAt(T0)
                .build();
    }

    @Test
    @DisplayName("startRun saves a RUNNING run inside a bounded transaction")
    void startRun() {
        openTransactions();
        when(runRepository.save(any(WorkflowExecutionRun.class))).thenAnswer(inv -> {
            WorkflowExecutionRun run = inv.getArgument(0);
            run.setId(UUID.randomUUID());
            return run;
        });
        WorkflowSnapshot snapshot = WorkflowSnapshot.builder()
                .tenantId("acme").logicalName("wf").triggerType(TriggerType.MANUAL).maxAttempts(2).build();

        WorkflowExecutionRun run = ledger.startRun(snapshot, null, T0);

        assertNotNull(run.getId());
        assertEquals(RunStatus.RUNNING, run.getStatus());
        assertEquals(0, run.getAttempts());
        ArgumentCaptor<TransactionDefinition> definition = ArgumentCaptor.forClass(TransactionDefinition.class);
        verify(transactionManager).getTransaction(definition.capture());
        assertEquals(7, definition.getValue().getTimeout());
        verify(transactionManager).commit(any());
    }

    @Test
    @DisplayName("recordAttempt locks the run, appends the attempt and updates the run")
    void recordAttempt() {
        openTransactions();
        UUID runId = UUID.randomUUID();
        when(runRepository.findByIdForUpdate(runId)).thenReturn(Optional.of(runningRun(runId, 0, 3)));
        when(runRepository.save(any(WorkflowExecutionRun.class))).thenAnswer(inv -> inv.getArgument(0));

        WorkflowExecutionRun updated = ledger.recordAttempt(runId, AttemptRecord.builder()
                .attemptNumber(1)
                .status(AttemptStatus.FAILED)
                .errorMessage("step 0 (log_message) failed: boom")
                .executedAt(T0)
                .runStatus(RunStatus.RUNNING)
                .build());

        assertEquals(1, updated.getAttempts());
        assertEquals(RunStatus.RUNNING, updated.getStatus());
        ArgumentCaptor<WorkflowExecutionAttempt> attempt = ArgumentCaptor.forClass(WorkflowExecutionAttempt.class);
        verify(attemptRepository).save(attempt.capture());
        assertEquals(runId, attempt.getValue().getRunId());
        assertEquals(1, attempt.getValue().getAttemptNumber());
        assertEquals("acme", attempt.getValue().getTenantId());
        assertEquals("[]", attempt.getValue().getStepTrace());
    }

    @Test
    @DisplayName("an illegal transition is rejected without writing and rolled back")
    void illegalTransition() {
        openTransactions();
        UUID runId = UUID.randomUUID();
        when(runRepository.findByIdForUpdate(runId)).thenReturn(Optional.of(runningRun(runId, 2, 3)));

        assertThrows(LedgerException.class, () -> ledger.recordAttempt(runId, AttemptRecord.builder()
                .attemptNumber(2)
                .status(AttemptStatus.SUCCEEDED)
                .executedAt(T0)
                .runStatus(RunStatus.SUCCEEDED)
                .build()));

        verifyNoInteractions(attemptRepository);
        verify(runRepository, never()).save(any());
        verify(transactionManager).rollback(any());
    }

    @Test
    @DisplayName("an unknown run is a ledger error")
    void unknownRun() {
        openTransactions();
        UUID runId = UUID.randomUUID();
        when(runRepository.findByIdForUpdate(runId)).thenReturn(Optional.empty());

        LedgerException e = assertThrows(LedgerException.class, () -> ledger.recordAttempt(runId,
                AttemptRecord.builder().attemptNumber(1).status(AttemptStatus.SUCCEEDED)
                        .executedAt(T0).runStatus(RunStatus.SUCCEEDED).build()));
        assertTrue(e.getMessage().contains(runId.toString()));
    }

    @Test
    @DisplayName("storage failures surface as LedgerException")
    void storageFailure() {
        openTransactions();
        when(runRepository.save(any(WorkflowExecutionRun.class)))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));
        WorkflowSnapshot snapshot = WorkflowSnapshot.builder()
                .tenantId("acme").logicalName("wf").triggerType(TriggerType.MANUAL).maxAttempts(1).build();

        LedgerException e = assertThrows(LedgerException.class, () -> ledger.startRun(snapshot, null, T0));

        assertEquals("Failed to start run for workflow 'wf'", e.getMessage());
        assertInstanceOf(DataAccessResourceFailureException.class, e.getCause());
    }

    @Test
    @DisplayName("listRuns pages by offset and filters by workflow when given")
    void listRuns() {
        when(runRepository.findByTenantIdOrderByStartedAtDesc("acme", OffsetLimitRequest.of(5, 10)))
                .thenReturn(List.of());
        when(runRepository.findByTenantIdAndWorkflowLogicalNameOrderByStartedAtDesc(
                "acme", "wf", OffsetLimitRequest.of(0, 20))).thenReturn(List.of(runningRun(UUID.randomUUID(), 0, 1)));

        assertTrue(ledger.listRuns("acme", null, 10, 5).isEmpty());
        assertEquals(1, ledger.listRuns("acme", "wf", 20, 0).size());
    }

    @Test
    @DisplayName("findStaleRuns asks for RUNNING runs by last activity")
    void staleRuns() {
        ledger.findStaleRuns("acme", T0);

        verify(runRepository).findByTenantIdAndStatusAndLastActivityAtBeforeOrderByLastActivityAtAsc(
                "acme", RunStatus.RUNNING, T0);
    }

    @Test
    @DisplayName("claimStaleRun re-checks staleness under the row lock and refreshes activity")
    void claimStaleRun() {
        openTransactions();
        UUID runId = UUID.randomUUID();
        when(runRepository.findByIdForUpdate(runId)).thenReturn(Optional.of(runningRun(runId, 1, 3)));
        when(runRepository.save(any(WorkflowExecutionRun.class))).thenAnswer(inv -> inv.getArgument(0));

        WorkflowExecutionRun claimed = ledger.claimStaleRun("acme", runId, T0.plusSeconds(60), T0.plusSeconds(900));

        assertEquals(T0.plusSeconds(900), claimed.getLastActivityAt());
        verify(transactionManager).commit(any());
    }

    @Test
    @DisplayName("claimStaleRun of an active run is refused and rolled back")
    void claimActiveRun() {
        openTransactions();
        UUID runId = UUID.randomUUID();
        when(runRepository.findByIdForUpdate(runId)).thenReturn(Optional.of(runningRun(runId, 1, 3)));

        assertThrows(RunNotReconcilableException.class,
                () -> ledger.claimStaleRun("acme", runId, T0.minusSeconds(60), T0));

        verify(runRepository, never()).save(any());
        verify(transactionManager).rollback(any());
    }

    @Test
    @DisplayName("abandonStaleRun writes every filler attempt and the dead-letter in one transaction")
    void abandonInOneTransaction() {
        openTransactions();
        UUID runId = UUID.randomUUID();
        when(runRepository.findByIdForUpdate(runId)).thenReturn(Optional.of(runningRun(runId, 1, 4)));
        when(runRepository.save(any(WorkflowExecutionRun.class))).thenAnswer(inv -> inv.getArgument(0));

        WorkflowExecutionRun abandoned = ledger.abandonStaleRun("acme", runId, T0.plusSeconds(60),
                "abandoned by operator: gone", T0.plusSeconds(900));

        assertEquals(RunStatus.DEAD_LETTERED, abandoned.getStatus());
        assertEquals(4, abandoned.getAttempts());
        ArgumentCaptor<WorkflowExecutionAttempt> attempts = ArgumentCaptor.forClass(WorkflowExecutionAttempt.class);
        verify(attemptRepository, times(3)).save(attempts.capture());
        assertEquals(List.of(2, 3, 4), attempts.getAllValues().stream()
                .map(WorkflowExecutionAttempt::getAttemptNumber).collect(Collectors.toList()));
        verify(transactionManager, times(1)).getTransaction(any());
        verify(transactionManager, times(1)).commit(any());
    }

    @Test
    @DisplayName("a storage failure halfway through abandon rolls every filler attempt back")
    void abandonFailsAtomically() {
        openTransactions();
        UUID runId = UUID.randomUUID();
        when(runRepository.findByIdForUpdate(runId)).thenReturn(Optional.of(runningRun(runId, 0, 3)));
        when(attemptRepository.save(any(WorkflowExecutionAttempt.class)))
                .thenAnswer(inv -> inv.getArgument(0))
                .thenThrow(new DataAccessResourceFailureException("connection reset"));

        LedgerException e = assertThrows(LedgerException.class, () -> ledger.abandonStaleRun("acme", runId,
                T0.plusSeconds(60), "abandoned by operator: gone", T0.plusSeconds(900)));

        assertEquals("Failed to abandon run " + runId, e.getMessage());
        verify(runRepository, never()).save(any());
        verify(transactionManager).rollback(any());
        verify(transactionManager, never()).commit(any());
    }
}
