package com.nayem.sagacoordinator.engine;

import com.nayem.sagacoordinator.saga.CompensationException;
import com.nayem.sagacoordinator.saga.ExecutionState;
import com.nayem.sagacoordinator.saga.PersistenceException;
import com.nayem.sagacoordinator.saga.SagaStep;
import com.nayem.sagacoordinator.saga.StepExecution;
import com.nayem.sagacoordinator.saga.StepStatus;
import com.nayem.sagacoordinator.saga.TransactionStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Unwinds a transaction by invoking compensating actions for every completed
 * step in reverse completion order.
 * <p>
 * Compensation is entered on a failed step, a cancellation or a timeout.
 * {@link #initiate} is a compare-and-set on the transaction status, so exactly
 * one party wins and runs {@link #sweep}. A failing compensation is recorded on
 * its step and never stops the sweep.
 * </p>
 */
class CompensationEngine {

    private static final Logger log = LoggerFactory.getLogger(CompensationEngine.class);

    private final SagaCheckpointer checkpointer;
    private final ServiceInvoker invoker;
    private final RunningSagas running;
    private final SagaMetrics metrics;
    private final Duration pollInterval;

    CompensationEngine(SagaCheckpointer checkpointer, ServiceInvoker invoker, RunningSagas running,
            SagaMetrics metrics, Duration pollInterval) {
        this.checkpointer = checkpointer;
        this.invoker = invoker;
        this.running = running;
        this.metrics = metrics;
        this.pollInterval = pollInterval;
    }

    /**
     * Moves the transaction to {@code target} if its status is one of
     * {@code expected}, and persists the change.
     *
     * @return true if this caller initiated compensation and must run the sweep
     * @throws PersistenceException if the status could not be persisted; the
     *                              in-memory status is left unchanged and the
     *                              transaction is aborted for recovery
     */
    boolean initiate(ActiveSaga active, Set<TransactionStatus> expected, TransactionStatus target, String reason) {
        boolean initiated = active.supplyLocked(() -> {
            TransactionStatus current = active.state().status();
            if (active.isAbandoned() || !expected.contains(current)) {
                return false;
            }
            active.changeStatus(target);
            try {
                checkpointer.checkpoint(active);
            } catch (PersistenceException e) {
                active.changeStatus(current);
                throw e;
            }
            active.signalChange();
            return true;
        });
        if (initiated) {
            metrics.recordCompensationTriggered();
            log.warn("Transaction {} is compensating: {}", active.transactionId(), reason);
        }
        return initiated;
    }

    /**
     * Runs the compensation sweep to completion. Only the party that won
     * {@link #initiate} (or recovery adopting a compensating transaction) calls
     * this.
     */
    void sweep(ActiveSaga active) {
        MDC.put(SagaExecutionEngine.MDC_TRANSACTION_ID, active.transactionId());
        try {
            runSweep(active);
        } catch (PersistenceException e) {
            running.abandon(active, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Compensation of transaction {} interrupted", active.transactionId());
        } finally {
            MDC.remove(SagaExecutionEngine.MDC_TRANSACTION_ID);
        }
    }

    private void runSweep(ActiveSaga active) throws InterruptedException {
        List<String> order = awaitInFlightSteps(active);
        if (order == null) {
            return;
        }

        for (String stepId : order) {
            compensateStep(active, active.step(stepId));
        }

        active.runLocked(() -> {
            active.changeStatus(TransactionStatus.COMPENSATED);
            checkpointer.checkpoint(active);
        });
        metrics.recordCompensatedSaga();
        metrics.recordSagaDuration(active.elapsedMillis());
        log.info("Transaction {} compensated", active.transactionId());
        running.release(active);
    }

    /**
     * Persists Compensating, then waits until no forward step is running.
     *
     * @return completed step ids in reverse completion order, or null if the
     *         transaction is not in a compensating state
     */
    private List<String> awaitInFlightSteps(ActiveSaga active) throws InterruptedException {
        active.lock();
        try {
            ExecutionState state = active.state();
            if (state.status() == TransactionStatus.FAILED) {
                active.changeStatus(TransactionStatus.COMPENSATING);
                checkpointer.checkpoint(active);
            }
            if (state.status() != TransactionStatus.COMPENSATING) {
                log.warn("Transaction {} is {}, nothing to compensate", active.transactionId(), state.status());
                return null;
            }
            while (state.hasRunningSteps()) {
                if (active.isAbandoned()) {
                    return null;
                }
                active.awaitChange(pollInterval);
            }
            List<String> order = new ArrayList<>(new LinkedHashSet<>(state.completedSteps()));
            Collections.reverse(order);
            return order;
        } finally {
            active.unlock();
        }
    }

    private void compensateStep(ActiveSaga active, SagaStep step) throws InterruptedException {
        StepExecution forward = active.supplyLocked(() -> {
            if (active.state().statusOf(step.stepId()) != StepStatus.COMPLETED) {
                return null;
            }
            StepExecution execution = active.state().step(step.stepId()).copy();
            active.state().markCompensating(step.stepId());
            checkpointer.checkpoint(active);
            return execution;
        });
        if (forward == null) {
            return;
        }

        log.info("Compensating step {} of transaction {}", step.stepId(), active.transactionId());
        String compensationError = null;
        try {
            invoker.compensate(step, forward.getResult());
        } catch (CompensationException e) {
            compensationError = e.getMessage();
            metrics.recordCompensationFailure();
            log.error("Compensation of step {} in transaction {} failed, continuing with the remaining steps",
                    step.stepId(), active.transactionId(), e);
        }

        String error = compensationError;
        active.runLocked(() -> {
            active.state().markCompensated(step.stepId(), error);
            checkpointer.checkpoint(active);
        });
    }
}
