package com.nayem.sagacoordinator.saga;

/**
 * A compensating action failed. Logged and recorded on the step, never retried
 * and never stops the compensation sweep.
 */
public class CompensationException extends SagaException {

    private final String stepId;

    public CompensationException(String stepId, String message, Throwable cause) {
        super(message, cause);
        this.stepId = stepId;
    }

    public String getStepId() {
        return stepId;
    }
}
