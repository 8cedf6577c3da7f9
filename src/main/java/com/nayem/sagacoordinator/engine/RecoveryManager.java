package com.nayem.sagacoordinator.engine;

import com.nayem.sagacoordinator.saga.ExecutionState;
import com.nayem.sagacoordinator.saga.SagaStateSerializer;
import com.nayem.sagacoordinator.saga.SagaStep;
import com.nayem.sagacoordinator.saga.SagaTransaction;
import com.nayem.sagacoordinator.saga.TransactionStatus;
import com.nayem.sagacoordinator.store.SagaTransactionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;

/**
 * Resumes transactions that no live coordinator drives any more.
 * <p>
 * Each pass renews the leases of owned transactions, then adopts running,
 * failed or compensating records that are not owned here: lease first, then
 * state is rebuilt from the durable record, steps caught mid-call are reset and
 * the transaction re-enters the execution engine or the compensation sweep. A
 * failed record was interrupted between failing and compensating, so it goes
 * to the sweep.
 * Completed steps are never invoked again.
 * </p>
 */
class RecoveryManager extends BackgroundLoop {

    private static final Logger log = LoggerFactory.getLogger(RecoveryManager.class);

    private static final Set<TransactionStatus> RECOVERABLE =
            EnumSet.of(TransactionStatus.RUNNING, TransactionStatus.FAILED, TransactionStatus.COMPENSATING);

    private final SagaTransactionRepository repository;
    private final SagaStateSerializer serializer;
    private final RunningSagas running;
    private final SagaExecutionEngine executionEngine;
    private final CompensationEngine compensation;
    private final SagaMetrics metrics;
    private final ExecutorService workers;
    private final int batchSize;
    private final int maxParallelSteps;

    RecoveryManager(String name, Duration interval, int batchSize, int maxParallelSteps,
            SagaTransactionRepository repository, SagaStateSerializer serializer, RunningSagas running,
            SagaExecutionEngine executionEngine, CompensationEngine compensation, SagaMetrics metrics,
            ExecutorService workers) {
        super(name, interval);
        this.repository = repository;
        this.serializer = serializer;
        this.running = running;
        this.executionEngine = executionEngine;
        this.compensation = compensation;
        this.metrics = metrics;
        this.workers = workers;
        this.batchSize = batchSize;
        this.maxParallelSteps = maxParallelSteps;
    }

    @Override
    void runOnce() {
        recoverOnce();
    }

    /**
     * @return number of transactions adopted and resumed
     */
    int recoverOnce() {
        running.renewLeases();

        List<SagaTransaction> candidates = repository.findByStatus(RECOVERABLE, batchSize);
        int resumed = 0;
        for (SagaTransaction candidate : candidates) {
            if (running.isOwned(candidate.transactionId())) {
                continue;
            }
            try {
                Optional<ActiveSaga> adopted = adopt(candidate);
                if (adopted.isPresent()) {
                    resume(adopted.get());
                    resumed++;
                }
            } catch (RuntimeException e) {
                log.error("Failed to recover transaction {}", candidate.transactionId(), e);
            }
        }
        if (resumed > 0) {
            log.info("Recovered {} orphaned transaction(s)", resumed);
        }
        return resumed;
    }

    /**
     * Takes ownership of a transaction that is not driven by this instance.
     *
     * @return the adopted transaction, or empty if another owner holds its
     *         lease or it reached a terminal status in the meantime
     */
    Optional<ActiveSaga> adopt(SagaTransaction candidate) {
        String transactionId = candidate.transactionId();
        if (!running.acquireLease(transactionId)) {
            log.debug("Transaction {} is owned by another instance", transactionId);
            return Optional.empty();
        }

        // re-read under the lease, the previous owner may have moved it on
        Optional<SagaTransaction> current = repository.findById(transactionId);
        if (current.isEmpty() || current.get().status().isTerminal()) {
            running.releaseLease(transactionId);
            return Optional.empty();
        }
        SagaTransaction stored = current.get();

        List<SagaStep> definition = serializer.readDefinition(stored.definition());
        ExecutionState state = stored.executionLog() == null
                ? ExecutionState.initial(transactionId, definition)
                : ExecutionState.fromLog(serializer.readLog(stored.executionLog()), definition);
        state.setStatus(stored.status());
        int reset = state.resetInterruptedSteps();

        Instant now = Instant.now();
        SagaTransaction adopted = stored
                .withProgress(stored.status(), serializer.writeLog(state.snapshot()), now)
                .withRecovery(now);
        ActiveSaga active = new ActiveSaga(adopted, definition, state, maxParallelSteps, metrics);
        if (!running.register(active)) {
            return Optional.empty();
        }
        try {
            repository.save(adopted);
        } catch (RuntimeException e) {
            running.release(active);
            throw e;
        }

        metrics.recordRecoveredSaga();
        log.info("Adopted transaction {} in status {} (recovery #{}, {} interrupted step(s) reset)",
                transactionId, adopted.status(), adopted.recoveryCount(), reset);
        return Optional.of(active);
    }

    /**
     * Hands an adopted transaction to the engine matching its status.
     */
    void resume(ActiveSaga active) {
        TransactionStatus status = active.status();
        if (status == TransactionStatus.FAILED || status == TransactionStatus.COMPENSATING) {
            workers.execute(() -> compensation.sweep(active));
        } else {
            workers.execute(() -> executionEngine.run(active));
        }
    }
}
