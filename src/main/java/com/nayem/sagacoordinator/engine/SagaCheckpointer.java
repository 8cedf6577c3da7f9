package com.nayem.sagacoordinator.engine;

import com.nayem.sagacoordinator.saga.ExecutionState;
import com.nayem.sagacoordinator.saga.PersistenceException;
import com.nayem.sagacoordinator.saga.SagaStateSerializer;
import com.nayem.sagacoordinator.saga.SagaTransaction;
import com.nayem.sagacoordinator.store.SagaTransactionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;

/**
 * Writes the in-memory execution state of a transaction to its durable record.
 */
class SagaCheckpointer {

    private static final Logger log = LoggerFactory.getLogger(SagaCheckpointer.class);

    private final SagaTransactionRepository repository;
    private final SagaStateSerializer serializer;

    SagaCheckpointer(SagaTransactionRepository repository, SagaStateSerializer serializer) {
        this.repository = repository;
        this.serializer = serializer;
    }

    /**
     * Caller must hold the transaction lock. A no-op once the transaction was
     * abandoned by this instance. A failed write aborts the transaction.
     *
     * @throws PersistenceException if the write failed
     */
    void checkpoint(ActiveSaga active) {
        if (active.isAbandoned()) {
            log.debug("Skipping checkpoint of abandoned transaction {}", active.transactionId());
            return;
        }
        ExecutionState state = active.state();
        SagaTransaction next = active.record()
                .withProgress(state.status(), serializer.writeLog(state.snapshot()), Instant.now());
        try {
            repository.save(next);
        } catch (PersistenceException e) {
            // stop the scheduler before any other task acts on the unsaved state
            active.abort(e);
            throw e;
        }
        active.setRecord(next);
        log.debug("Checkpointed transaction {} in status {}", next.transactionId(), next.status());
    }
}
