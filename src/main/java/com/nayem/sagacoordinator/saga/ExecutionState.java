package com.nayem.sagacoordinator.saga;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory execution state of one saga instance.
 * <p>
 * Mirrors the durable record and is checkpointed into it after every
 * transition. Not thread-safe: callers serialize access through the owning
 * transaction's lock.
 * </p>
 */
public class ExecutionState {

    private final String transactionId;
    private TransactionStatus status;
    private final Map<String, StepExecution> steps;
    private final List<String> completedSteps;
    private final List<String> failedSteps;

    private ExecutionState(String transactionId, TransactionStatus status, Map<String, StepExecution> steps,
            List<String> completedSteps, List<String> failedSteps) {
        this.transactionId = transactionId;
        this.status = status;
        this.steps = steps;
        this.completedSteps = completedSteps;
        this.failedSteps = failedSteps;
    }

    public static ExecutionState initial(String transactionId, List<SagaStep> definition) {
        Map<String, StepExecution> steps = new LinkedHashMap<>();
        for (SagaStep step : definition) {
            steps.put(step.stepId(), StepExecution.pending(step.stepId()));
        }
        return new ExecutionState(transactionId, TransactionStatus.PENDING, steps, new ArrayList<>(),
                new ArrayList<>());
    }

    /**
     * Rebuilds state from a persisted log. Steps missing from the log (for
     * example a log written before the step was known) start out pending.
     */
    public static ExecutionState fromLog(ExecutionLog log, List<SagaStep> definition) {
        Map<String, StepExecution> steps = new LinkedHashMap<>();
        for (SagaStep step : definition) {
            StepExecution logged = log.step(step.stepId());
            steps.put(step.stepId(), logged == null ? StepExecution.pending(step.stepId()) : logged.copy());
        }
        return new ExecutionState(log.transactionId(), log.status(), steps,
                new ArrayList<>(log.completedSteps()), new ArrayList<>(log.failedSteps()));
    }

    public ExecutionLog snapshot() {
        Map<String, StepExecution> copies = new LinkedHashMap<>();
        steps.forEach((id, execution) -> copies.put(id, execution.copy()));
        return new ExecutionLog(transactionId, status, copies, completedSteps, failedSteps);
    }

    /**
     * Pending steps whose every dependency is completed, in definition order.
     */
    public List<SagaStep> readySteps(Collection<SagaStep> definition) {
        List<SagaStep> ready = new ArrayList<>();
        for (SagaStep step : definition) {
            if (statusOf(step.stepId()) != StepStatus.PENDING) {
                continue;
            }
            boolean dependenciesMet = step.dependsOn().stream()
                    .allMatch(dep -> statusOf(dep) == StepStatus.COMPLETED);
            if (dependenciesMet) {
                ready.add(step);
            }
        }
        return ready;
    }

    /**
     * Resets steps that were interrupted mid-call by a crash so that a new
     * owner re-drives them: running steps go back to pending, steps caught
     * while compensating go back to completed.
     *
     * @return number of steps that were reset
     */
    public int resetInterruptedSteps() {
        int reset = 0;
        for (StepExecution execution : steps.values()) {
            if (execution.getStatus() == StepStatus.RUNNING) {
                execution.setStatus(StepStatus.PENDING);
                execution.setStartTime(null);
                reset++;
            } else if (execution.getStatus() == StepStatus.COMPENSATING) {
                execution.setStatus(StepStatus.COMPLETED);
                reset++;
            }
        }
        return reset;
    }

    public void markRunning(String stepId, Instant now) {
        StepExecution execution = step(stepId);
        execution.setStatus(StepStatus.RUNNING);
        execution.setStartTime(now);
        execution.setEndTime(null);
    }

    public void markCompleted(String stepId, Map<String, Object> result, Instant now) {
        StepExecution execution = step(stepId);
        execution.setStatus(StepStatus.COMPLETED);
        execution.setEndTime(now);
        execution.setResult(result);
        completedSteps.add(stepId);
    }

    public void recordAttemptFailure(String stepId, int attempts, String error) {
        StepExecution execution = step(stepId);
        execution.setRetryCountUsed(attempts);
        execution.setError(error);
    }

    public void markFailed(String stepId, Instant now) {
        StepExecution execution = step(stepId);
        execution.setStatus(StepStatus.FAILED);
        execution.setEndTime(now);
        failedSteps.add(stepId);
    }

    public void markCompensating(String stepId) {
        step(stepId).setStatus(StepStatus.COMPENSATING);
    }

    public void markCompensated(String stepId, String compensationError) {
        StepExecution execution = step(stepId);
        execution.setStatus(StepStatus.COMPENSATED);
        execution.setCompensationError(compensationError);
    }

    public boolean allCompleted() {
        return steps.values().stream().allMatch(s -> s.getStatus() == StepStatus.COMPLETED);
    }

    public boolean hasFailedSteps() {
        return steps.values().stream().anyMatch(s -> s.getStatus() == StepStatus.FAILED);
    }

    public boolean hasRunningSteps() {
        return steps.values().stream().anyMatch(s -> s.getStatus() == StepStatus.RUNNING);
    }

    public StepStatus statusOf(String stepId) {
        StepExecution execution = steps.get(stepId);
        return execution == null ? null : execution.getStatus();
    }

    public StepExecution step(String stepId) {
        StepExecution execution = steps.get(stepId);
        if (execution == null) {
            throw new IllegalArgumentException("Unknown step " + stepId + " in transaction " + transactionId);
        }
        return execution;
    }

    public String transactionId() {
        return transactionId;
    }

    public TransactionStatus status() {
        return status;
    }

    public void setStatus(TransactionStatus status) {
        this.status = status;
    }

    public List<String> completedSteps() {
        return List.copyOf(completedSteps);
    }

    public List<String> failedSteps() {
        return List.copyOf(failedSteps);
    }
}
