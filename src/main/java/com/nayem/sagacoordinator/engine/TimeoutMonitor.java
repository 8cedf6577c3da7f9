package com.nayem.sagacoordinator.engine;

import com.nayem.sagacoordinator.saga.PersistenceException;
import com.nayem.sagacoordinator.saga.SagaTransaction;
import com.nayem.sagacoordinator.saga.TransactionStatus;
import com.nayem.sagacoordinator.store.SagaTransactionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;

/**
 * Force-fails and compensates transactions past their deadline. Precision is
 * bounded by the scan interval.
 */
class TimeoutMonitor extends BackgroundLoop {

    private static final Logger log = LoggerFactory.getLogger(TimeoutMonitor.class);

    private static final Set<TransactionStatus> EXPIRABLE =
            EnumSet.of(TransactionStatus.PENDING, TransactionStatus.RUNNING);

    private final SagaTransactionRepository repository;
    private final RunningSagas running;
    private final RecoveryManager recovery;
    private final CompensationEngine compensation;
    private final SagaMetrics metrics;
    private final ExecutorService workers;
    private final int batchSize;

    TimeoutMonitor(String name, Duration interval, int batchSize, SagaTransactionRepository repository,
            RunningSagas running, RecoveryManager recovery, CompensationEngine compensation, SagaMetrics metrics,
            ExecutorService workers) {
        super(name, interval);
        this.repository = repository;
        this.running = running;
        this.recovery = recovery;
        this.compensation = compensation;
        this.metrics = metrics;
        this.workers = workers;
        this.batchSize = batchSize;
    }

    @Override
    void runOnce() {
        sweepOnce();
    }

    /**
     * @return number of transactions that were timed out
     */
    int sweepOnce() {
        List<SagaTransaction> expired = repository.findTimedOut(Instant.now(), EXPIRABLE, batchSize);
        int timedOut = 0;
        for (SagaTransaction record : expired) {
            try {
                if (timeOut(record)) {
                    timedOut++;
                }
            } catch (RuntimeException e) {
                log.error("Failed to time out transaction {}", record.transactionId(), e);
            }
        }
        return timedOut;
    }

    private boolean timeOut(SagaTransaction record) {
        String transactionId = record.transactionId();
        Optional<ActiveSaga> owned = running.find(transactionId);
        if (owned.isPresent()) {
            return failAndCompensate(owned.get(), record);
        }

        Optional<ActiveSaga> adopted = recovery.adopt(record);
        if (adopted.isEmpty()) {
            return false;
        }
        ActiveSaga saga = adopted.get();
        boolean initiated;
        try {
            initiated = failAndCompensate(saga, record);
        } catch (PersistenceException e) {
            running.abandon(saga, e);
            return false;
        }
        if (!initiated) {
            // the scan was stale, the record already moved past running
            log.info("Transaction {} is {}, resuming it instead of timing it out", transactionId, saga.status());
            recovery.resume(saga);
        }
        return initiated;
    }

    private boolean failAndCompensate(ActiveSaga saga, SagaTransaction record) {
        if (!compensation.initiate(saga, EXPIRABLE, TransactionStatus.FAILED, "timed out at " + record.timeoutAt())) {
            return false;
        }
        metrics.recordTimedOutSaga();
        workers.execute(() -> compensation.sweep(saga));
        return true;
    }
}
