package com.nayem.sagacoordinator.engine;

import com.nayem.sagacoordinator.saga.PersistenceException;
import com.nayem.sagacoordinator.store.SagaRecoveryLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Transactions owned by this coordinator instance, together with their
 * ownership leases.
 */
class RunningSagas {

    private static final Logger log = LoggerFactory.getLogger(RunningSagas.class);

    private final Map<String, ActiveSaga> sagas = new ConcurrentHashMap<>();
    private final SagaRecoveryLock leases;
    private final String instanceId;
    private final Duration leaseDuration;
    private final SagaMetrics metrics;

    RunningSagas(SagaRecoveryLock leases, String instanceId, Duration leaseDuration, SagaMetrics metrics) {
        this.leases = leases;
        this.instanceId = instanceId;
        this.leaseDuration = leaseDuration;
        this.metrics = metrics;
    }

    boolean acquireLease(String transactionId) {
        return leases.acquireLock(transactionId, instanceId, leaseDuration);
    }

    void releaseLease(String transactionId) {
        try {
            leases.releaseLock(transactionId, instanceId);
        } catch (RuntimeException e) {
            log.warn("Failed to release lease of transaction {}, it expires after {}", transactionId,
                    leaseDuration, e);
        }
    }

    /**
     * @return false if the transaction is already registered
     */
    boolean register(ActiveSaga active) {
        if (sagas.putIfAbsent(active.transactionId(), active) != null) {
            return false;
        }
        metrics.recordStatusChange(null, active.status());
        return true;
    }

    /**
     * Drops a transaction from memory and gives up its lease.
     */
    void release(ActiveSaga active) {
        if (sagas.remove(active.transactionId(), active)) {
            metrics.recordStatusChange(active.status(), null);
            releaseLease(active.transactionId());
        }
    }

    /**
     * Stops driving a transaction after a store failure. The durable record
     * stays as last written so that recovery can resume it.
     */
    void abandon(ActiveSaga active, PersistenceException cause) {
        log.error("Store failure in transaction {}, releasing it for recovery", active.transactionId(), cause);
        active.abandon();
        release(active);
    }

    void abandonAll() {
        for (ActiveSaga active : sagas.values()) {
            active.abandon();
            release(active);
        }
    }

    Optional<ActiveSaga> find(String transactionId) {
        return Optional.ofNullable(sagas.get(transactionId));
    }

    boolean isOwned(String transactionId) {
        return sagas.containsKey(transactionId);
    }

    Set<String> ids() {
        return Set.copyOf(sagas.keySet());
    }

    /**
     * @return number of leases that could not be renewed
     */
    int renewLeases() {
        int lost = 0;
        for (String transactionId : sagas.keySet()) {
            try {
                if (!leases.renewLock(transactionId, instanceId, leaseDuration)) {
                    log.warn("Lease of transaction {} is no longer held by {}", transactionId, instanceId);
                    lost++;
                }
            } catch (RuntimeException e) {
                log.warn("Failed to renew lease of transaction {}", transactionId, e);
                lost++;
            }
        }
        return lost;
    }

    String instanceId() {
        return instanceId;
    }
}
