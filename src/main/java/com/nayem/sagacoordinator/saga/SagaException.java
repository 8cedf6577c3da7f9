package com.nayem.sagacoordinator.saga;

/**
 * Base type of all exceptions raised by the saga coordinator.
 */
public class SagaException extends RuntimeException {

    public SagaException(String message) {
        super(message);
    }

    public SagaException(String message, Throwable cause) {
        super(message, cause);
    }
}
