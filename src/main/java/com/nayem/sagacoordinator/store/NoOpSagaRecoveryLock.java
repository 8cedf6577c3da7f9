package com.nayem.sagacoordinator.store;

import java.time.Duration;

/**
 * Lease implementation for single-instance deployments, where the in-memory
 * ownership map is the only guard.
 */
public class NoOpSagaRecoveryLock implements SagaRecoveryLock {

    @Override
    public boolean acquireLock(String transactionId, String ownerId, Duration leaseDuration) {
        return true;
    }

    @Override
    public boolean renewLock(String transactionId, String ownerId, Duration leaseDuration) {
        return true;
    }

    @Override
    public void releaseLock(String transactionId, String ownerId) {
    }
}
