package com.nayem.sagacoordinator.store;

import java.time.Duration;

/**
 * Ownership lease on a transaction.
 * <p>
 * A coordinator instance holds the lease of every transaction it drives and
 * renews it periodically. Recovery adopts an orphaned transaction only after
 * acquiring its lease, so two live instances never drive the same saga.
 * </p>
 */
public interface SagaRecoveryLock {

    /**
     * Attempts to acquire the lease.
     *
     * @param transactionId The transaction to own
     * @param ownerId       Identifier of the acquiring coordinator instance
     * @param leaseDuration How long the lease is held without renewal
     * @return true if the lease was acquired, false if another owner holds it
     */
    boolean acquireLock(String transactionId, String ownerId, Duration leaseDuration);

    /**
     * Extends a lease held by {@code ownerId}.
     *
     * @return true if the lease was still held by {@code ownerId} and was extended
     */
    boolean renewLock(String transactionId, String ownerId, Duration leaseDuration);

    /**
     * Releases the lease if held by {@code ownerId}.
     */
    void releaseLock(String transactionId, String ownerId);
}
