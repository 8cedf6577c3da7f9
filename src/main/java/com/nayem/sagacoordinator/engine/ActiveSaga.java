package com.nayem.sagacoordinator.engine;

import com.nayem.sagacoordinator.saga.ExecutionState;
import com.nayem.sagacoordinator.saga.PersistenceException;
import com.nayem.sagacoordinator.saga.SagaStep;
import com.nayem.sagacoordinator.saga.SagaTransaction;
import com.nayem.sagacoordinator.saga.TransactionStatus;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * A transaction driven by this coordinator instance.
 * <p>
 * Every read or mutation of {@link #state()} and every checkpoint happens
 * while holding the transaction lock. Step tasks signal {@link #signalChange()}
 * after each step transition so that waiting schedulers and sweeps re-check.
 * </p>
 */
final class ActiveSaga {

    private final List<SagaStep> definition;
    private final Map<String, SagaStep> stepsById;
    private final ExecutionState state;
    private final Semaphore permits;
    private final SagaMetrics metrics;
    private final long startedAtMillis = System.currentTimeMillis();

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();

    private volatile SagaTransaction record;
    private volatile PersistenceException abortCause;
    private volatile boolean abandoned;

    ActiveSaga(SagaTransaction record, List<SagaStep> definition, ExecutionState state, int maxParallelSteps,
            SagaMetrics metrics) {
        this.record = record;
        this.definition = List.copyOf(definition);
        this.state = state;
        this.permits = new Semaphore(maxParallelSteps);
        this.metrics = metrics;
        Map<String, SagaStep> byId = new LinkedHashMap<>();
        for (SagaStep step : definition) {
            byId.put(step.stepId(), step);
        }
        this.stepsById = byId;
    }

    String transactionId() {
        return state.transactionId();
    }

    List<SagaStep> definition() {
        return definition;
    }

    SagaStep step(String stepId) {
        SagaStep step = stepsById.get(stepId);
        if (step == null) {
            throw new IllegalArgumentException("Unknown step " + stepId + " in transaction " + transactionId());
        }
        return step;
    }

    /**
     * Caller must hold the lock.
     */
    ExecutionState state() {
        return state;
    }

    TransactionStatus status() {
        return supplyLocked(state::status);
    }

    /**
     * Caller must hold the lock.
     */
    void changeStatus(TransactionStatus newStatus) {
        TransactionStatus oldStatus = state.status();
        if (oldStatus != newStatus) {
            state.setStatus(newStatus);
            metrics.recordStatusChange(oldStatus, newStatus);
        }
    }

    <T> T supplyLocked(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    void runLocked(Runnable action) {
        lock.lock();
        try {
            action.run();
        } finally {
            lock.unlock();
        }
    }

    void lock() {
        lock.lock();
    }

    void unlock() {
        lock.unlock();
    }

    /**
     * Caller must hold the lock.
     */
    void signalChange() {
        changed.signalAll();
    }

    /**
     * Caller must hold the lock. Returns on a signal or when the wait elapses.
     */
    void awaitChange(Duration maxWait) throws InterruptedException {
        changed.await(maxWait.toMillis(), TimeUnit.MILLISECONDS);
    }

    boolean tryAcquirePermit() {
        return permits.tryAcquire();
    }

    void releasePermit() {
        permits.release();
    }

    SagaTransaction record() {
        return record;
    }

    void setRecord(SagaTransaction record) {
        this.record = record;
    }

    /**
     * Records a store failure seen by a step task for the scheduler to raise.
     */
    void abort(PersistenceException cause) {
        runLocked(() -> {
            if (abortCause == null) {
                abortCause = cause;
            }
            changed.signalAll();
        });
    }

    PersistenceException abortCause() {
        return abortCause;
    }

    /**
     * Stops all further checkpoints from this instance. The durable record is
     * left as last written for another owner to pick up.
     */
    void abandon() {
        runLocked(() -> {
            abandoned = true;
            changed.signalAll();
        });
    }

    boolean isAbandoned() {
        return abandoned;
    }

    long elapsedMillis() {
        return System.currentTimeMillis() - startedAtMillis;
    }
}
