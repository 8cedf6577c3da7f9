package com.nayem.sagacoordinator.engine;

import com.nayem.sagacoordinator.saga.ExecutionState;
import com.nayem.sagacoordinator.saga.PersistenceException;
import com.nayem.sagacoordinator.saga.SagaStep;
import com.nayem.sagacoordinator.saga.StepExecutionException;
import com.nayem.sagacoordinator.saga.TransactionStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;

/**
 * Drives a transaction forward through its step graph.
 * <p>
 * The scheduling loop launches every ready step (pending, all dependencies
 * completed) as its own task, up to the per-saga permit count, then waits for a
 * step transition or the poll interval. It stops at the first failed step
 * without cancelling in-flight siblings and hands off to the
 * {@link CompensationEngine}.
 * </p>
 * <p>
 * Step tasks retry failed calls with exponential backoff and checkpoint every
 * transition. A retry is only attempted while the saga is still running.
 * </p>
 */
class SagaExecutionEngine {

    static final String MDC_TRANSACTION_ID = "transactionId";

    private static final Logger log = LoggerFactory.getLogger(SagaExecutionEngine.class);

    private static final Set<TransactionStatus> FORWARD = EnumSet.of(TransactionStatus.RUNNING);

    private enum Outcome {
        COMPLETED, FAILED, INTERRUPTED
    }

    private final SagaCheckpointer checkpointer;
    private final ServiceInvoker invoker;
    private final CompensationEngine compensation;
    private final RunningSagas running;
    private final SagaMetrics metrics;
    private final BackoffStrategy backoff;
    private final ExecutorService workers;
    private final Duration pollInterval;

    SagaExecutionEngine(SagaCheckpointer checkpointer, ServiceInvoker invoker, CompensationEngine compensation,
            RunningSagas running, SagaMetrics metrics, BackoffStrategy backoff, ExecutorService workers,
            Duration pollInterval) {
        this.checkpointer = checkpointer;
        this.invoker = invoker;
        this.compensation = compensation;
        this.running = running;
        this.metrics = metrics;
        this.backoff = backoff;
        this.workers = workers;
        this.pollInterval = pollInterval;
    }

    /**
     * Runs the transaction until it completes or hands off to compensation.
     * Blocks the calling worker thread.
     */
    void run(ActiveSaga active) {
        String transactionId = active.transactionId();
        MDC.put(MDC_TRANSACTION_ID, transactionId);
        try {
            if (!begin(active)) {
                log.debug("Transaction {} is no longer pending, not driving it", transactionId);
                return;
            }
            switch (schedule(active)) {
                case COMPLETED -> complete(active);
                case FAILED -> {
                    if (compensation.initiate(active, FORWARD, TransactionStatus.FAILED, "step failed")) {
                        compensation.sweep(active);
                    }
                }
                case INTERRUPTED -> log.debug("Transaction {} left the running state, scheduler exits",
                        transactionId);
            }
        } catch (PersistenceException e) {
            running.abandon(active, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Scheduler of transaction {} interrupted", transactionId);
        } catch (RuntimeException e) {
            if (active.isAbandoned()) {
                log.debug("Transaction {} abandoned while executing", transactionId, e);
                return;
            }
            log.error("Unexpected error while executing transaction {}, compensating", transactionId, e);
            compensateAfterError(active, e);
        } finally {
            MDC.remove(MDC_TRANSACTION_ID);
        }
    }

    private boolean begin(ActiveSaga active) {
        return active.supplyLocked(() -> {
            TransactionStatus status = active.state().status();
            if (status == TransactionStatus.RUNNING) {
                return true;
            }
            if (status != TransactionStatus.PENDING) {
                return false;
            }
            active.changeStatus(TransactionStatus.RUNNING);
            checkpointer.checkpoint(active);
            log.info("Transaction {} running", active.transactionId());
            return true;
        });
    }

    private Outcome schedule(ActiveSaga active) throws InterruptedException {
        ExecutionState state = active.state();
        active.lock();
        try {
            while (true) {
                if (active.abortCause() != null) {
                    throw active.abortCause();
                }
                if (active.isAbandoned() || state.status() != TransactionStatus.RUNNING) {
                    return Outcome.INTERRUPTED;
                }
                if (state.hasFailedSteps()) {
                    return Outcome.FAILED;
                }
                if (state.allCompleted()) {
                    return Outcome.COMPLETED;
                }

                List<SagaStep> ready = state.readySteps(active.definition());
                List<SagaStep> launched = new ArrayList<>();
                Instant now = Instant.now();
                for (SagaStep step : ready) {
                    if (!active.tryAcquirePermit()) {
                        break;
                    }
                    state.markRunning(step.stepId(), now);
                    launched.add(step);
                }
                if (!launched.isEmpty()) {
                    checkpointer.checkpoint(active);
                    for (SagaStep step : launched) {
                        log.info("Executing step {} of transaction {}", step.stepId(), active.transactionId());
                        workers.execute(() -> runStep(active, step));
                    }
                } else if (ready.isEmpty() && !state.hasRunningSteps()) {
                    log.error("Transaction {} has pending steps that can never become ready",
                            active.transactionId());
                    return Outcome.FAILED;
                }

                active.awaitChange(pollInterval);
            }
        } finally {
            active.unlock();
        }
    }

    private void complete(ActiveSaga active) {
        active.runLocked(() -> {
            active.changeStatus(TransactionStatus.COMPLETED);
            checkpointer.checkpoint(active);
        });
        metrics.recordCompletedSaga();
        metrics.recordSagaDuration(active.elapsedMillis());
        log.info("Transaction {} completed", active.transactionId());
        running.release(active);
    }

    private void compensateAfterError(ActiveSaga active, RuntimeException cause) {
        try {
            if (compensation.initiate(active, FORWARD, TransactionStatus.FAILED, cause.toString())) {
                compensation.sweep(active);
            }
        } catch (PersistenceException e) {
            running.abandon(active, e);
        }
    }

    private void runStep(ActiveSaga active, SagaStep step) {
        MDC.put(MDC_TRANSACTION_ID, active.transactionId());
        long startedAt = System.currentTimeMillis();
        try {
            executeWithRetries(active, step);
        } catch (PersistenceException e) {
            active.abort(e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Step {} of transaction {} interrupted", step.stepId(), active.transactionId());
        } finally {
            active.releasePermit();
            active.runLocked(active::signalChange);
            metrics.recordStepDuration(System.currentTimeMillis() - startedAt);
            MDC.remove(MDC_TRANSACTION_ID);
        }
    }

    private void executeWithRetries(ActiveSaga active, SagaStep step) throws InterruptedException {
        // a recovered step keeps the attempts it already used
        int previousAttempts = active.supplyLocked(() -> active.state().step(step.stepId()).getRetryCountUsed());
        for (int attempt = previousAttempts; ; attempt++) {
            if (attempt > 0 && failIfStopped(active, step)) {
                return;
            }

            StepExecutionException failure;
            try {
                Map<String, Object> result = invoker.invoke(step);
                active.runLocked(() -> {
                    active.state().markCompleted(step.stepId(), result, Instant.now());
                    checkpointer.checkpoint(active);
                    active.signalChange();
                });
                log.info("Step {} of transaction {} completed", step.stepId(), active.transactionId());
                return;
            } catch (StepExecutionException e) {
                failure = e;
            }

            int attempts = attempt + 1;
            if (!recordFailure(active, step, attempts, failure)) {
                log.error("Step {} of transaction {} failed after {} attempt(s): {}",
                        step.stepId(), active.transactionId(), attempts, failure.getMessage());
                return;
            }

            long delayMs = backoff.delayMillis(attempt);
            log.warn("Step {} of transaction {} failed (attempt {}/{}), retrying in {}ms: {}",
                    step.stepId(), active.transactionId(), attempts, step.retryCount() + 1, delayMs,
                    failure.getMessage());
            metrics.recordStepRetry();
            Thread.sleep(delayMs);
        }
    }

    /**
     * Records a failed attempt and marks the step failed when no retry is left
     * or the saga stopped running.
     *
     * @return true if the step should be retried
     */
    private boolean recordFailure(ActiveSaga active, SagaStep step, int attempts, StepExecutionException failure) {
        return active.supplyLocked(() -> {
            ExecutionState state = active.state();
            boolean retry = attempts <= step.retryCount() && state.status() == TransactionStatus.RUNNING;
            state.recordAttemptFailure(step.stepId(), attempts, failure.getMessage());
            if (!retry) {
                state.markFailed(step.stepId(), Instant.now());
            }
            checkpointer.checkpoint(active);
            active.signalChange();
            return retry;
        });
    }

    /**
     * Marks the step failed without another attempt if the saga stopped running
     * during the backoff.
     */
    private boolean failIfStopped(ActiveSaga active, SagaStep step) {
        return active.supplyLocked(() -> {
            if (active.state().status() == TransactionStatus.RUNNING) {
                return false;
            }
            active.state().markFailed(step.stepId(), Instant.now());
            checkpointer.checkpoint(active);
            active.signalChange();
            log.info("Step {} of transaction {} not retried, transaction is {}",
                    step.stepId(), active.transactionId(), active.state().status());
            return true;
        });
    }
}
