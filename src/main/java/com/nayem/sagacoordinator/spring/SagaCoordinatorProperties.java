package com.nayem.sagacoordinator.spring;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

/**
 * Configuration properties for the saga coordinator.
 * <p>
 * These properties can be configured in {@code application.yml} under the
 * {@code saga} prefix.
 * </p>
 */
@ConfigurationProperties(prefix = "saga")
@Validated
public class SagaCoordinatorProperties {

    /**
     * Whether the coordinator is created at all.
     */
    private boolean enabled = true;

    /**
     * Durable store backend: 'memory' (development), 'redis' (production).
     */
    @NotBlank
    private String stateStore = "memory";

    /**
     * Identifier of this coordinator instance, used as lease owner.
     * Defaults to a random UUID per process.
     */
    @NotBlank
    private String instanceId = UUID.randomUUID().toString();

    /**
     * Saga-level deadline applied when the caller does not pass one.
     */
    @DurationUnit(ChronoUnit.SECONDS)
    private Duration defaultTimeout = Duration.ofSeconds(300);

    /**
     * Prefix for worker thread names. Useful for monitoring and debugging.
     */
    private String threadNamePrefix = "saga-";

    @Valid
    private Step step = new Step();

    @Valid
    private Retry retry = new Retry();

    @Valid
    private Recovery recovery = new Recovery();

    @Valid
    private TimeoutMonitor timeoutMonitor = new TimeoutMonitor();

    @Valid
    private Redis redis = new Redis();

    /** @return whether the coordinator is enabled */
    public boolean isEnabled() {
        return enabled;
    }

    /** @param enabled whether the coordinator is enabled */
    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    /** @return the durable store backend */
    public String getStateStore() {
        return stateStore;
    }

    /** @param stateStore the durable store backend */
    public void setStateStore(String stateStore) {
        this.stateStore = stateStore;
    }

    /** @return the lease owner id of this instance */
    public String getInstanceId() {
        return instanceId;
    }

    /** @param instanceId the lease owner id of this instance */
    public void setInstanceId(String instanceId) {
        this.instanceId = instanceId;
    }

    /** @return the default saga deadline */
    public Duration getDefaultTimeout() {
        return defaultTimeout;
    }

    /** @param defaultTimeout the default saga deadline */
    public void setDefaultTimeout(Duration defaultTimeout) {
        this.defaultTimeout = defaultTimeout;
    }

    /** @return the worker thread name prefix */
    public String getThreadNamePrefix() {
        return threadNamePrefix;
    }

    /** @param threadNamePrefix the worker thread name prefix */
    public void setThreadNamePrefix(String threadNamePrefix) {
        this.threadNamePrefix = threadNamePrefix;
    }

    /** @return the step execution configuration */
    public Step getStep() {
        return step;
    }

    /** @param step the step execution configuration */
    public void setStep(Step step) {
        this.step = step;
    }

    /** @return the retry configuration */
    public Retry getRetry() {
        return retry;
    }

    /** @param retry the retry configuration */
    public void setRetry(Retry retry) {
        this.retry = retry;
    }

    /** @return the recovery configuration */
    public Recovery getRecovery() {
        return recovery;
    }

    /** @param recovery the recovery configuration */
    public void setRecovery(Recovery recovery) {
        this.recovery = recovery;
    }

    /** @return the timeout monitor configuration */
    public TimeoutMonitor getTimeoutMonitor() {
        return timeoutMonitor;
    }

    /** @param timeoutMonitor the timeout monitor configuration */
    public void setTimeoutMonitor(TimeoutMonitor timeoutMonitor) {
        this.timeoutMonitor = timeoutMonitor;
    }

    /** @return the Redis configuration */
    public Redis getRedis() {
        return redis;
    }

    /** @param redis the Redis configuration */
    public void setRedis(Redis redis) {
        this.redis = redis;
    }

    /**
     * Scheduling of steps within one saga.
     */
    public static class Step {
        /**
         * Maximum number of steps of one saga running at the same time.
         * Ready steps beyond the cap wait for the next scheduling round.
         */
        @Min(1)
        @Max(1024)
        private int maxParallelSteps = 16;

        /**
         * Upper bound on how long the scheduler waits between ready-set
         * computations when no step changed state.
         */
        @DurationUnit(ChronoUnit.MILLIS)
        private Duration pollInterval = Duration.ofMillis(100);

        /** @return the per-saga parallelism cap */
        public int getMaxParallelSteps() {
            return maxParallelSteps;
        }

        /** @param maxParallelSteps the per-saga parallelism cap */
        public void setMaxParallelSteps(int maxParallelSteps) {
            this.maxParallelSteps = maxParallelSteps;
        }

        /** @return the scheduler poll interval */
        public Duration getPollInterval() {
            return pollInterval;
        }

        /** @param pollInterval the scheduler poll interval */
        public void setPollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
        }
    }

    /**
     * Retry configuration for failed saga steps.
     * <p>
     * The delay before retry {@code n} (0-indexed) is {@code backoff * 2^n},
     * capped at {@code maxBackoff}, with optional jitter.
     * </p>
     */
    public static class Retry {
        /**
         * Base backoff duration between retries. Exponential backoff is applied.
         */
        @DurationUnit(ChronoUnit.SECONDS)
        private Duration backoff = Duration.ofSeconds(1);

        /**
         * Maximum backoff between two attempts.
         */
        @DurationUnit(ChronoUnit.SECONDS)
        private Duration maxBackoff = Duration.ofSeconds(60);

        /**
         * Random jitter percentage (0.0-1.0) applied to the backoff to prevent
         * thundering herd.
         */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double jitterPercent = 0.0;

        /** @return the base backoff duration */
        public Duration getBackoff() {
            return backoff;
        }

        /** @param backoff the base backoff duration */
        public void setBackoff(Duration backoff) {
            this.backoff = backoff;
        }

        /** @return the maximum backoff duration */
        public Duration getMaxBackoff() {
            return maxBackoff;
        }

        /** @param maxBackoff the maximum backoff duration */
        public void setMaxBackoff(Duration maxBackoff) {
            this.maxBackoff = maxBackoff;
        }

        /** @return the jitter percentage */
        public double getJitterPercent() {
            return jitterPercent;
        }

        /** @param jitterPercent the jitter percentage */
        public void setJitterPercent(double jitterPercent) {
            this.jitterPercent = jitterPercent;
        }
    }

    /**
     * Configuration for automatic crash recovery of interrupted sagas.
     * <p>
     * When enabled, the coordinator periodically scans for running or
     * compensating sagas that no live instance owns and resumes them.
     * </p>
     */
    public static class Recovery {
        /**
         * Whether automatic crash recovery is enabled.
         */
        private boolean enabled = true;

        /**
         * How frequently to scan for interrupted sagas.
         */
        @DurationUnit(ChronoUnit.SECONDS)
        private Duration interval = Duration.ofSeconds(30);

        /**
         * Maximum number of records examined per scan.
         */
        @Min(1)
        private int batchSize = 1000;

        /**
         * Whether to use Redis leases for ownership in clustered environments.
         */
        private boolean distributedLocking = false;

        /**
         * How long an ownership lease survives without renewal. Must exceed the
         * recovery interval, since leases are renewed on every scan.
         */
        @DurationUnit(ChronoUnit.SECONDS)
        private Duration leaseDuration = Duration.ofSeconds(90);

        /** @return whether crash recovery is enabled */
        public boolean isEnabled() {
            return enabled;
        }

        /** @param enabled whether crash recovery is enabled */
        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        /** @return the recovery scan interval */
        public Duration getInterval() {
            return interval;
        }

        /** @param interval the recovery scan interval */
        public void setInterval(Duration interval) {
            this.interval = interval;
        }

        /** @return the scan batch size */
        public int getBatchSize() {
            return batchSize;
        }

        /** @param batchSize the scan batch size */
        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        /** @return whether distributed locking is enabled */
        public boolean isDistributedLocking() {
            return distributedLocking;
        }

        /** @param distributedLocking whether distributed locking is enabled */
        public void setDistributedLocking(boolean distributedLocking) {
            this.distributedLocking = distributedLocking;
        }

        /** @return the ownership lease duration */
        public Duration getLeaseDuration() {
            return leaseDuration;
        }

        /** @param leaseDuration the ownership lease duration */
        public void setLeaseDuration(Duration leaseDuration) {
            this.leaseDuration = leaseDuration;
        }
    }

    /**
     * Configuration for the saga deadline monitor.
     */
    public static class TimeoutMonitor {
        /**
         * Whether expired sagas are force-failed and compensated.
         */
        private boolean enabled = true;

        /**
         * How frequently to scan for expired sagas. Bounds timeout precision.
         */
        @DurationUnit(ChronoUnit.SECONDS)
        private Duration interval = Duration.ofSeconds(60);

        /**
         * Maximum number of records examined per scan.
         */
        @Min(1)
        private int batchSize = 1000;

        /** @return whether the monitor is enabled */
        public boolean isEnabled() {
            return enabled;
        }

        /** @param enabled whether the monitor is enabled */
        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        /** @return the scan interval */
        public Duration getInterval() {
            return interval;
        }

        /** @param interval the scan interval */
        public void setInterval(Duration interval) {
            this.interval = interval;
        }

        /** @return the scan batch size */
        public int getBatchSize() {
            return batchSize;
        }

        /** @param batchSize the scan batch size */
        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }
    }

    /**
     * Redis key layout shared by the Redis store and the Redis lease.
     */
    public static class Redis {
        /**
         * Prefix for every key the coordinator writes.
         */
        @NotBlank
        private String keyPrefix = "saga:";

        /** @return the key prefix */
        public String getKeyPrefix() {
            return keyPrefix;
        }

        /** @param keyPrefix the key prefix */
        public void setKeyPrefix(String keyPrefix) {
            this.keyPrefix = keyPrefix;
        }
    }
}
