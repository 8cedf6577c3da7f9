package com.nayem.sagacoordinator.engine;

import com.nayem.sagacoordinator.saga.TransactionStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer metrics for saga coordination health and performance monitoring.
 */
public class SagaMetrics {

    private final Map<TransactionStatus, AtomicLong> activeSagasByStatus;
    private final Timer sagaDurationTimer;
    private final Timer stepDurationTimer;
    private final Counter completedCounter;
    private final Counter compensatedCounter;
    private final Counter stepRetryCounter;
    private final Counter compensationTriggeredCounter;
    private final Counter compensationFailureCounter;
    private final Counter recoveredCounter;
    private final Counter timeoutCounter;

    public SagaMetrics(MeterRegistry registry) {
        this.activeSagasByStatus = new EnumMap<>(TransactionStatus.class);
        for (TransactionStatus status : TransactionStatus.values()) {
            activeSagasByStatus.put(status, new AtomicLong(0));
        }

        if (registry != null) {
            activeSagasByStatus.forEach((status, count) -> Gauge.builder("saga.active", count, AtomicLong::get)
                    .description("Number of sagas driven by this instance, by status")
                    .tag("status", status.wireValue())
                    .register(registry));

            this.sagaDurationTimer = Timer.builder("saga.duration")
                    .description("Time from start to a terminal status")
                    .register(registry);

            this.stepDurationTimer = Timer.builder("saga.step.duration")
                    .description("Individual step execution duration, retries included")
                    .register(registry);

            this.completedCounter = Counter.builder("saga.completed")
                    .description("Number of sagas that completed every step")
                    .register(registry);

            this.compensatedCounter = Counter.builder("saga.compensated")
                    .description("Number of sagas that finished compensation")
                    .register(registry);

            this.stepRetryCounter = Counter.builder("saga.step.retries")
                    .description("Number of step attempts retried after a failure")
                    .register(registry);

            this.compensationTriggeredCounter = Counter.builder("saga.compensation.triggered")
                    .description("Number of compensation triggers")
                    .register(registry);

            this.compensationFailureCounter = Counter.builder("saga.compensation.failures")
                    .description("Number of compensating actions that failed")
                    .register(registry);

            this.recoveredCounter = Counter.builder("saga.recovered")
                    .description("Number of transactions adopted by crash recovery")
                    .register(registry);

            this.timeoutCounter = Counter.builder("saga.timeouts")
                    .description("Number of sagas force-failed by the timeout monitor")
                    .register(registry);
        } else {
            this.sagaDurationTimer = null;
            this.stepDurationTimer = null;
            this.completedCounter = null;
            this.compensatedCounter = null;
            this.stepRetryCounter = null;
            this.compensationTriggeredCounter = null;
            this.compensationFailureCounter = null;
            this.recoveredCounter = null;
            this.timeoutCounter = null;
        }
    }

    public void recordStatusChange(TransactionStatus oldStatus, TransactionStatus newStatus) {
        if (oldStatus != null) {
            activeSagasByStatus.get(oldStatus).decrementAndGet();
        }
        if (newStatus != null) {
            activeSagasByStatus.get(newStatus).incrementAndGet();
        }
    }

    public long activeCount(TransactionStatus status) {
        return activeSagasByStatus.get(status).get();
    }

    public void recordSagaDuration(long durationMs) {
        if (sagaDurationTimer != null) {
            sagaDurationTimer.record(durationMs, TimeUnit.MILLISECONDS);
        }
    }

    public void recordStepDuration(long durationMs) {
        if (stepDurationTimer != null) {
            stepDurationTimer.record(durationMs, TimeUnit.MILLISECONDS);
        }
    }

    public void recordCompletedSaga() {
        if (completedCounter != null) {
            completedCounter.increment();
        }
    }

    public void recordCompensatedSaga() {
        if (compensatedCounter != null) {
            compensatedCounter.increment();
        }
    }

    public void recordStepRetry() {
        if (stepRetryCounter != null) {
            stepRetryCounter.increment();
        }
    }

    public void recordCompensationTriggered() {
        if (compensationTriggeredCounter != null) {
            compensationTriggeredCounter.increment();
        }
    }

    public void recordCompensationFailure() {
        if (compensationFailureCounter != null) {
            compensationFailureCounter.increment();
        }
    }

    public void recordRecoveredSaga() {
        if (recoveredCounter != null) {
            recoveredCounter.increment();
        }
    }

    public void recordTimedOutSaga() {
        if (timeoutCounter != null) {
            timeoutCounter.increment();
        }
    }

    public static SagaMetrics noOp() {
        return new SagaMetrics(null);
    }
}
