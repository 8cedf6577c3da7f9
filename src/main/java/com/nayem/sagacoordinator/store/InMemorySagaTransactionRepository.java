package com.nayem.sagacoordinator.store;

import com.nayem.sagacoordinator.saga.SagaTransaction;
import com.nayem.sagacoordinator.saga.TransactionStatus;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of SagaTransactionRepository.
 * <p>
 * Suitable for:
 * - Development and testing
 * - Single-instance deployments that accept losing records on restart
 * </p>
 * <p>
 * Note: Records are lost on application restart, so crash recovery only works
 * across coordinator instances sharing this repository object. For production,
 * use the Redis implementation.
 * </p>
 */
public class InMemorySagaTransactionRepository implements SagaTransactionRepository {

    private final Map<String, SagaTransaction> store = new ConcurrentHashMap<>();

    @Override
    public void save(SagaTransaction transaction) {
        store.put(transaction.transactionId(), transaction);
    }

    @Override
    public Optional<SagaTransaction> findById(String transactionId) {
        return Optional.ofNullable(store.get(transactionId));
    }

    @Override
    public List<SagaTransaction> findByStatus(Set<TransactionStatus> statuses, int limit) {
        return store.values().stream()
                .filter(transaction -> statuses.contains(transaction.status()))
                .sorted(Comparator.comparing(SagaTransaction::createdAt))
                .limit(limit)
                .toList();
    }

    /**
     * Clears all stored records. Useful for testing.
     */
    public void clear() {
        store.clear();
    }

    /**
     * Returns the current number of stored records.
     */
    public int size() {
        return store.size();
    }
}
