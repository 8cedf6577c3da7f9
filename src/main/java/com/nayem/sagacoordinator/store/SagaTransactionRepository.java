package com.nayem.sagacoordinator.store;

import com.nayem.sagacoordinator.saga.SagaTransaction;
import com.nayem.sagacoordinator.saga.TransactionStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Repository interface for persisting Saga transaction records.
 * <p>
 * Implementations can store records in:
 * - In-Memory (for testing/development)
 * - Redis (recommended for production clustering)
 * </p>
 * <p>
 * Failures are reported as
 * {@link com.nayem.sagacoordinator.saga.PersistenceException}.
 * </p>
 */
public interface SagaTransactionRepository {

    /**
     * Insert or replace the record keyed by its transaction id.
     *
     * @param transaction The record to persist
     */
    void save(SagaTransaction transaction);

    /**
     * Find a record by transaction id.
     *
     * @param transactionId The transaction identifier
     * @return Optional containing the record if found
     */
    Optional<SagaTransaction> findById(String transactionId);

    /**
     * Find records in any of the given statuses.
     * Used by crash recovery to locate in-flight transactions.
     *
     * @param statuses Statuses to match
     * @param limit    Maximum number of records returned
     * @return Matching records, at most {@code limit}
     */
    List<SagaTransaction> findByStatus(Set<TransactionStatus> statuses, int limit);

    /**
     * Find records in any of the given statuses whose deadline is before
     * {@code now}. Used by the timeout monitor.
     *
     * @param now      Reference time
     * @param statuses Statuses to match
     * @param limit    Maximum number of records returned
     * @return Matching records, at most {@code limit}
     */
    default List<SagaTransaction> findTimedOut(Instant now, Set<TransactionStatus> statuses, int limit) {
        return findByStatus(statuses, Integer.MAX_VALUE).stream()
                .filter(transaction -> transaction.isTimedOut(now))
                .limit(limit)
                .toList();
    }

    /**
     * Check if a record with this id already exists.
     *
     * @param transactionId The transaction identifier
     * @return true if exists
     */
    default boolean exists(String transactionId) {
        return findById(transactionId).isPresent();
    }
}
