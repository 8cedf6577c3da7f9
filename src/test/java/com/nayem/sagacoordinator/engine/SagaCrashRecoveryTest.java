package com.nayem.sagacoordinator.engine;

import com.nayem.sagacoordinator.client.ServiceClientRegistry;
import com.nayem.sagacoordinator.saga.ExecutionState;
import com.nayem.sagacoordinator.saga.SagaStateSerializer;
import com.nayem.sagacoordinator.saga.SagaStep;
import com.nayem.sagacoordinator.saga.SagaTransaction;
import com.nayem.sagacoordinator.saga.StepStatus;
import com.nayem.sagacoordinator.saga.TransactionStatus;
import com.nayem.sagacoordinator.saga.TransactionStatusView;
import com.nayem.sagacoordinator.store.InMemorySagaTransactionRepository;
import com.nayem.sagacoordinator.store.NoOpSagaRecoveryLock;
import com.nayem.sagacoordinator.store.SagaRecoveryLock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static com.nayem.sagacoordinator.engine.SagaTestSupport.SERVICE;
import static com.nayem.sagacoordinator.engine.SagaTestSupport.awaitCondition;
import static com.nayem.sagacoordinator.engine.SagaTestSupport.awaitStatus;
import static com.nayem.sagacoordinator.engine.SagaTestSupport.fastProperties;
import static com.nayem.sagacoordinator.engine.SagaTestSupport.step;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Simulates coordinator crashes by writing mid-flight records directly, or by
 * closing a coordinator while a step is in flight, and verifies that another
 * coordinator resumes them without re-invoking completed steps.
 */
class SagaCrashRecoveryTest {

    private final SagaStateSerializer serializer = new SagaStateSerializer();
    private final List<SagaCoordinator> coordinators = new ArrayList<>();
    private InMemorySagaTransactionRepository repository;
    private ScriptedServiceClient service;

    private final List<SagaStep> definition = List.of(
            step("a").build(),
            step("b", "a").build(),
            step("c", "b").build());

    @BeforeEach
    void setUp() {
        repository = new InMemorySagaTransactionRepository();
        service = new ScriptedServiceClient();
    }

    @AfterEach
    void tearDown() {
        coordinators.forEach(SagaCoordinator::close);
    }

    private SagaCoordinator newCoordinator(SagaRecoveryLock lock, ScriptedServiceClient client) {
        SagaCoordinator coordinator = new SagaCoordinator(repository, new ServiceClientRegistry(),
                fastProperties(), SagaMetrics.noOp(), lock, serializer);
        coordinator.registerServiceClient(SERVICE, client);
        coordinators.add(coordinator);
        return coordinator;
    }

    private void saveRecord(String id, ExecutionState state) {
        saveRecord(id, definition, state);
    }

    private void saveRecord(String id, List<SagaStep> definition, ExecutionState state) {
        Instant now = Instant.now();
        repository.save(new SagaTransaction(id, state.status(), serializer.writeDefinition(definition),
                serializer.writeLog(state.snapshot()), now.minusSeconds(5), now.minusSeconds(1),
                now.plusSeconds(300), 0));
    }

    @Test
    void runningSagaResumesWithoutRepeatingCompletedSteps() throws Exception {
        ExecutionState state = ExecutionState.initial("crashed-1", definition);
        state.setStatus(TransactionStatus.RUNNING);
        state.markRunning("a", Instant.now());
        state.markCompleted("a", Map.of("order_id", "o-1"), Instant.now());
        state.markRunning("b", Instant.now());
        saveRecord("crashed-1", state);

        SagaCoordinator coordinator = newCoordinator(new NoOpSagaRecoveryLock(), service);
        assertEquals(1, coordinator.recoverOrphanedTransactions());

        TransactionStatusView view = awaitStatus(coordinator, "crashed-1", TransactionStatus.COMPLETED);
        assertEquals(List.of("do_b", "do_c"), service.journal());
        assertEquals(List.of("a", "b", "c"), view.executionLog().completedSteps());
        assertEquals(1, view.recoveryCount());
        assertEquals(Map.of("order_id", "o-1"), view.executionLog().step("a").getResult());
    }

    @Test
    void compensatingSagaResumesTheSweep() throws Exception {
        ExecutionState state = ExecutionState.initial("crashed-2", definition);
        state.markRunning("a", Instant.now());
        state.markCompleted("a", Map.of(), Instant.now());
        state.markRunning("b", Instant.now());
        state.markCompleted("b", Map.of(), Instant.now());
        state.markRunning("c", Instant.now());
        state.markFailed("c", Instant.now());
        state.setStatus(TransactionStatus.COMPENSATING);
        state.markCompensating("b");
        saveRecord("crashed-2", state);

        SagaCoordinator coordinator = newCoordinator(new NoOpSagaRecoveryLock(), service);
        assertEquals(1, coordinator.recoverOrphanedTransactions());

        TransactionStatusView view = awaitStatus(coordinator, "crashed-2", TransactionStatus.COMPENSATED);
        assertEquals(List.of("undo_b", "undo_a"), service.journal());
        assertEquals(StepStatus.COMPENSATED, view.stepStatus("a"));
        assertEquals(StepStatus.COMPENSATED, view.stepStatus("b"));
        assertEquals(StepStatus.FAILED, view.stepStatus("c"));
    }

    @Test
    void failedSagaInterruptedBeforeCompensatingIsCompensated() throws Exception {
        ExecutionState state = ExecutionState.initial("crashed-4", definition);
        state.markRunning("a", Instant.now());
        state.markCompleted("a", Map.of("order_id", "o-4"), Instant.now());
        state.markRunning("b", Instant.now());
        state.markFailed("b", Instant.now());
        state.setStatus(TransactionStatus.FAILED);
        saveRecord("crashed-4", state);

        SagaCoordinator coordinator = newCoordinator(new NoOpSagaRecoveryLock(), service);
        assertEquals(1, coordinator.recoverOrphanedTransactions());

        TransactionStatusView view = awaitStatus(coordinator, "crashed-4", TransactionStatus.COMPENSATED);
        assertEquals(List.of("undo_a"), service.journal());
        assertEquals(Map.of("order_id", "o-4"), service.payloadsOf("undo_a").get(0).get("original_result"));
        assertEquals(StepStatus.COMPENSATED, view.stepStatus("a"));
        assertEquals(StepStatus.FAILED, view.stepStatus("b"));
        assertEquals(StepStatus.PENDING, view.stepStatus("c"));
    }

    @Test
    void recoveredStepKeepsTheAttemptsItAlreadyUsed() throws Exception {
        List<SagaStep> retried = List.of(
                step("a").build(),
                step("b", "a").retryCount(1).build());
        ExecutionState state = ExecutionState.initial("crashed-5", retried);
        state.setStatus(TransactionStatus.RUNNING);
        state.markRunning("a", Instant.now());
        state.markCompleted("a", Map.of(), Instant.now());
        state.markRunning("b", Instant.now());
        state.recordAttemptFailure("b", 1, "Step b failed: do_b rejected");
        saveRecord("crashed-5", retried, state);

        service.alwaysFailing("do_b");
        SagaCoordinator coordinator = newCoordinator(new NoOpSagaRecoveryLock(), service);
        assertEquals(1, coordinator.recoverOrphanedTransactions());

        TransactionStatusView view = awaitStatus(coordinator, "crashed-5", TransactionStatus.COMPENSATED);
        assertEquals(1, service.count("do_b"));
        assertEquals(2, view.executionLog().step("b").getRetryCountUsed());
        assertEquals(StepStatus.FAILED, view.stepStatus("b"));
        assertEquals(List.of("do_b", "undo_a"), service.journal());
    }

    @Test
    void alreadyCompensatedStepsAreSkipped() throws Exception {
        ExecutionState state = ExecutionState.initial("crashed-3", definition);
        state.markRunning("a", Instant.now());
        state.markCompleted("a", Map.of(), Instant.now());
        state.markRunning("b", Instant.now());
        state.markCompleted("b", Map.of(), Instant.now());
        state.markRunning("c", Instant.now());
        state.markFailed("c", Instant.now());
        state.setStatus(TransactionStatus.COMPENSATING);
        state.markCompensating("b");
        state.markCompensated("b", null);
        saveRecord("crashed-3", state);

        SagaCoordinator coordinator = newCoordinator(new NoOpSagaRecoveryLock(), service);
        coordinator.recoverOrphanedTransactions();

        awaitStatus(coordinator, "crashed-3", TransactionStatus.COMPENSATED);
        assertEquals(List.of("undo_a"), service.journal());
    }

    @Test
    void leasedTransactionIsNotAdopted() {
        ExecutionState state = ExecutionState.initial("leased-1", definition);
        state.setStatus(TransactionStatus.RUNNING);
        saveRecord("leased-1", state);

        SagaRecoveryLock lock = mock(SagaRecoveryLock.class);
        when(lock.acquireLock(anyString(), anyString(), any(Duration.class))).thenReturn(false);
        SagaCoordinator coordinator = newCoordinator(lock, service);

        assertEquals(0, coordinator.recoverOrphanedTransactions());
        assertTrue(coordinator.activeTransactionIds().isEmpty());
        assertEquals(0, repository.findById("leased-1").orElseThrow().recoveryCount());
        assertTrue(service.journal().isEmpty());
    }

    @Test
    void terminalTransactionsAreNeverRecovered() {
        ExecutionState state = ExecutionState.initial("done-1", definition);
        state.setStatus(TransactionStatus.COMPLETED);
        saveRecord("done-1", state);

        SagaCoordinator coordinator = newCoordinator(new NoOpSagaRecoveryLock(), service);

        assertEquals(0, coordinator.recoverOrphanedTransactions());
        assertTrue(service.journal().isEmpty());
    }

    @Test
    void sagaOfClosedCoordinatorIsFinishedByAnother() throws Exception {
        CountDownLatch never = new CountDownLatch(1);
        ScriptedServiceClient crashing = new ScriptedServiceClient()
                .on("do_b", payload -> never.await(30, TimeUnit.SECONDS));
        SagaCoordinator first = newCoordinator(new NoOpSagaRecoveryLock(), crashing);

        String id = first.startSaga("handover-1", definition);
        awaitCondition("step b running", () -> first.getTransactionStatus(id)
                .map(view -> view.stepStatus("b") == StepStatus.RUNNING).orElse(false));
        first.close();

        SagaCoordinator second = newCoordinator(new NoOpSagaRecoveryLock(), service);
        assertEquals(1, second.recoverOrphanedTransactions());

        TransactionStatusView view = awaitStatus(second, id, TransactionStatus.COMPLETED);
        assertEquals(1, crashing.count("do_a"));
        assertEquals(List.of("do_b", "do_c"), service.journal());
        assertEquals(1, view.recoveryCount());
    }
}
