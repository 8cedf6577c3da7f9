package com.nayem.sagacoordinator.saga;

/**
 * A service client call for a forward action failed or exceeded the step
 * timeout.
 */
public class StepExecutionException extends SagaException {

    private final String stepId;
    private final boolean timedOut;

    public StepExecutionException(String stepId, String message, Throwable cause, boolean timedOut) {
        super(message, cause);
        this.stepId = stepId;
        this.timedOut = timedOut;
    }

    public String getStepId() {
        return stepId;
    }

    public boolean isTimedOut() {
        return timedOut;
    }
}
