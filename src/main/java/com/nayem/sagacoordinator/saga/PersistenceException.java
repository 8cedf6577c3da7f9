package com.nayem.sagacoordinator.saga;

/**
 * Durable store read/write failure, including (de)serialization of stored
 * records. Always propagated; the coordinator never continues on stale state.
 */
public class PersistenceException extends SagaException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
