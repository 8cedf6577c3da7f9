package com.nayem.sagacoordinator.engine;

import com.nayem.sagacoordinator.client.ServiceClientRegistry;
import com.nayem.sagacoordinator.saga.ExecutionState;
import com.nayem.sagacoordinator.saga.SagaStateSerializer;
import com.nayem.sagacoordinator.saga.SagaStep;
import com.nayem.sagacoordinator.saga.SagaTransaction;
import com.nayem.sagacoordinator.saga.StepStatus;
import com.nayem.sagacoordinator.saga.TransactionStatus;
import com.nayem.sagacoordinator.saga.TransactionStatusView;
import com.nayem.sagacoordinator.spring.SagaCoordinatorProperties;
import com.nayem.sagacoordinator.store.InMemorySagaTransactionRepository;
import com.nayem.sagacoordinator.store.NoOpSagaRecoveryLock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static com.nayem.sagacoordinator.engine.SagaTestSupport.SERVICE;
import static com.nayem.sagacoordinator.engine.SagaTestSupport.awaitCondition;
import static com.nayem.sagacoordinator.engine.SagaTestSupport.awaitStatus;
import static com.nayem.sagacoordinator.engine.SagaTestSupport.fastProperties;
import static com.nayem.sagacoordinator.engine.SagaTestSupport.step;
import static org.junit.jupiter.api.Assertions.*;

class TimeoutMonitorTest {

    private final SagaStateSerializer serializer = new SagaStateSerializer();
    private InMemorySagaTransactionRepository repository;
    private ScriptedServiceClient service;
    private SimpleMeterRegistry meterRegistry;
    private SagaCoordinator coordinator;

    @BeforeEach
    void setUp() {
        repository = new InMemorySagaTransactionRepository();
        service = new ScriptedServiceClient();
        meterRegistry = new SimpleMeterRegistry();
        coordinator = newCoordinator(fastProperties());
    }

    @AfterEach
    void tearDown() {
        coordinator.close();
    }

    private SagaCoordinator newCoordinator(SagaCoordinatorProperties properties) {
        SagaCoordinator created = new SagaCoordinator(repository, new ServiceClientRegistry(), properties,
                new SagaMetrics(meterRegistry), new NoOpSagaRecoveryLock(), serializer);
        created.registerServiceClient(SERVICE, service);
        return created;
    }

    @Test
    void ownedSagaPastDeadlineIsFailedAndCompensated() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        service.on("do_b", payload -> release.await(5, TimeUnit.SECONDS));

        String id = coordinator.startSaga(null, List.of(step("a").build(), step("b", "a").build()),
                Duration.ofMillis(300));
        awaitCondition("step b running", () -> coordinator.getTransactionStatus(id)
                .map(view -> view.stepStatus("b") == StepStatus.RUNNING).orElse(false));
        awaitCondition("deadline passed", () -> coordinator.getTransactionStatus(id)
                .map(view -> view.timeoutAt().isBefore(Instant.now())).orElse(false));

        assertEquals(1, coordinator.enforceTimeouts());
        release.countDown();

        TransactionStatusView view = awaitStatus(coordinator, id, TransactionStatus.COMPENSATED);
        assertEquals(StepStatus.COMPENSATED, view.stepStatus("a"));
        assertEquals(StepStatus.COMPENSATED, view.stepStatus("b"));
        assertEquals(1, service.count("do_b"));
        assertEquals(1.0, meterRegistry.get("saga.timeouts").counter().count());
    }

    @Test
    void orphanedSagaPastDeadlineIsAdoptedAndCompensated() throws Exception {
        List<SagaStep> definition = List.of(step("a").build(), step("b", "a").build());
        ExecutionState state = ExecutionState.initial("orphan-1", definition);
        state.setStatus(TransactionStatus.RUNNING);
        state.markRunning("a", Instant.now());
        state.markCompleted("a", Map.of("id", 1), Instant.now());
        state.markRunning("b", Instant.now());
        Instant now = Instant.now();
        repository.save(new SagaTransaction("orphan-1", TransactionStatus.RUNNING,
                serializer.writeDefinition(definition), serializer.writeLog(state.snapshot()),
                now.minusSeconds(600), now.minusSeconds(500), now.minusSeconds(300), 0));

        assertEquals(1, coordinator.enforceTimeouts());

        TransactionStatusView view = awaitStatus(coordinator, "orphan-1", TransactionStatus.COMPENSATED);
        assertEquals(StepStatus.COMPENSATED, view.stepStatus("a"));
        assertEquals(StepStatus.PENDING, view.stepStatus("b"));
        assertEquals(1, view.recoveryCount());
        assertEquals(List.of("undo_a"), service.journal());
    }

    @Test
    void pendingSagaPastDeadlineEndsCompensated() throws Exception {
        List<SagaStep> definition = List.of(step("a").build());
        ExecutionState state = ExecutionState.initial("orphan-2", definition);
        Instant now = Instant.now();
        repository.save(SagaTransaction.pending("orphan-2", serializer.writeDefinition(definition),
                serializer.writeLog(state.snapshot()), now.minusSeconds(10), now.minusSeconds(1)));

        assertEquals(1, coordinator.enforceTimeouts());

        awaitStatus(coordinator, "orphan-2", TransactionStatus.COMPENSATED);
        assertTrue(service.journal().isEmpty());
    }

    @Test
    void staleScanResultIsResumedInsteadOfTimedOut() throws Exception {
        List<SagaStep> definition = List.of(step("a").build(), step("b", "a").build());
        ExecutionState state = ExecutionState.initial("stale-1", definition);
        state.markRunning("a", Instant.now());
        state.markCompleted("a", Map.of(), Instant.now());
        state.markRunning("b", Instant.now());
        state.markFailed("b", Instant.now());
        state.setStatus(TransactionStatus.COMPENSATING);
        Instant now = Instant.now();
        SagaTransaction compensating = new SagaTransaction("stale-1", TransactionStatus.COMPENSATING,
                serializer.writeDefinition(definition), serializer.writeLog(state.snapshot()),
                now.minusSeconds(600), now.minusSeconds(1), now.minusSeconds(300), 0);

        // the deadline index still reports the record as running
        InMemorySagaTransactionRepository staleIndex = new InMemorySagaTransactionRepository() {
            @Override
            public List<SagaTransaction> findTimedOut(Instant at, Set<TransactionStatus> statuses, int limit) {
                return List.of(new SagaTransaction(compensating.transactionId(), TransactionStatus.RUNNING,
                        compensating.definition(), compensating.executionLog(), compensating.createdAt(),
                        compensating.createdAt(), compensating.timeoutAt(), 0));
            }
        };
        staleIndex.save(compensating);
        SagaCoordinator stale = new SagaCoordinator(staleIndex, new ServiceClientRegistry(), fastProperties(),
                new SagaMetrics(meterRegistry), new NoOpSagaRecoveryLock(), serializer);
        stale.registerServiceClient(SERVICE, service);
        try {
            assertEquals(0, stale.enforceTimeouts());

            TransactionStatusView view = awaitStatus(stale, "stale-1", TransactionStatus.COMPENSATED);
            assertEquals(List.of("undo_a"), service.journal());
            assertEquals(StepStatus.COMPENSATED, view.stepStatus("a"));
            awaitCondition("stale-1 released", () -> stale.activeTransactionIds().isEmpty());
            assertEquals(0.0, meterRegistry.get("saga.timeouts").counter().count());
        } finally {
            stale.close();
        }
    }

    @Test
    void sagaWithinDeadlineIsLeftAlone() {
        List<SagaStep> definition = List.of(step("a").build());
        ExecutionState state = ExecutionState.initial("fresh-1", definition);
        state.setStatus(TransactionStatus.RUNNING);
        Instant now = Instant.now();
        repository.save(new SagaTransaction("fresh-1", TransactionStatus.RUNNING,
                serializer.writeDefinition(definition), serializer.writeLog(state.snapshot()),
                now, now, now.plusSeconds(300), 0));

        assertEquals(0, coordinator.enforceTimeouts());
        assertEquals(TransactionStatus.RUNNING, repository.findById("fresh-1").orElseThrow().status());
    }

    @Test
    void completedSagaIsNeverTimedOut() throws Exception {
        String id = coordinator.startSaga(null, List.of(step("a").build()), Duration.ofMillis(200));
        awaitStatus(coordinator, id, TransactionStatus.COMPLETED);
        Thread.sleep(250);

        assertEquals(0, coordinator.enforceTimeouts());
        assertEquals(TransactionStatus.COMPLETED, coordinator.getTransactionStatus(id).orElseThrow().status());
    }
}
