package com.nayem.sagacoordinator.engine;

import com.nayem.sagacoordinator.client.ServiceClient;
import com.nayem.sagacoordinator.client.ServiceClientRegistry;
import com.nayem.sagacoordinator.saga.ExecutionState;
import com.nayem.sagacoordinator.saga.PersistenceException;
import com.nayem.sagacoordinator.saga.SagaStateSerializer;
import com.nayem.sagacoordinator.saga.SagaStep;
import com.nayem.sagacoordinator.saga.SagaTransaction;
import com.nayem.sagacoordinator.saga.SagaValidationException;
import com.nayem.sagacoordinator.saga.TransactionStatus;
import com.nayem.sagacoordinator.saga.TransactionStatusView;
import com.nayem.sagacoordinator.spring.SagaCoordinatorProperties;
import com.nayem.sagacoordinator.store.SagaRecoveryLock;
import com.nayem.sagacoordinator.store.SagaTransactionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Coordinates distributed transactions as sagas.
 * <p>
 * A saga is a list of steps forming a dependency graph. Steps run as soon as
 * their dependencies completed, bounded per saga by
 * {@code saga.step.max-parallel-steps}. A step that still fails after its
 * retries makes the coordinator compensate every completed step in reverse
 * completion order. Every transition is checkpointed to the
 * {@link SagaTransactionRepository}, so a crashed instance's sagas are resumed
 * by the recovery loop of a live one.
 * </p>
 *
 * <h3>Example Usage:</h3>
 *
 * <pre>{@code
 * coordinator.registerServiceClient("order-service", orderClient);
 * coordinator.registerServiceClient("inventory-service", inventoryClient);
 *
 * List<SagaStep> steps = SagaDefinitionBuilder.newSaga()
 *         .step("create_order", s -> s.serviceName("order-service")
 *                 .action("create").compensationAction("cancel"))
 *         .then("reserve_inventory", s -> s.serviceName("inventory-service")
 *                 .action("reserve").compensationAction("release"))
 *         .build();
 *
 * String transactionId = coordinator.startSaga(null, steps);
 * }</pre>
 */
public class SagaCoordinator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SagaCoordinator.class);

    private static final Set<TransactionStatus> CANCELLABLE = EnumSet.of(TransactionStatus.RUNNING);

    private final SagaTransactionRepository repository;
    private final ServiceClientRegistry clients;
    private final SagaStateSerializer serializer;
    private final SagaMetrics metrics;
    private final SagaCoordinatorProperties properties;
    private final SagaGraphValidator validator;
    private final RunningSagas running;
    private final ExecutorService workers;
    private final ExecutorService calls;
    private final SagaExecutionEngine executionEngine;
    private final CompensationEngine compensation;
    private final RecoveryManager recovery;
    private final TimeoutMonitor timeoutMonitor;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public SagaCoordinator(
            SagaTransactionRepository repository,
            ServiceClientRegistry clients,
            SagaCoordinatorProperties properties,
            SagaMetrics metrics,
            SagaRecoveryLock recoveryLock,
            SagaStateSerializer serializer) {
        this.repository = repository;
        this.clients = clients;
        this.properties = properties;
        this.metrics = metrics;
        this.serializer = serializer;
        this.validator = new SagaGraphValidator(clients);

        String prefix = properties.getThreadNamePrefix();
        this.workers = Executors.newCachedThreadPool(daemonThreads(prefix + "worker-"));
        this.calls = Executors.newCachedThreadPool(daemonThreads(prefix + "call-"));

        SagaCoordinatorProperties.Step step = properties.getStep();
        SagaCoordinatorProperties.Retry retry = properties.getRetry();
        SagaCoordinatorProperties.Recovery recoveryConfig = properties.getRecovery();
        SagaCoordinatorProperties.TimeoutMonitor timeoutConfig = properties.getTimeoutMonitor();

        this.running = new RunningSagas(recoveryLock, properties.getInstanceId(),
                recoveryConfig.getLeaseDuration(), metrics);
        SagaCheckpointer checkpointer = new SagaCheckpointer(repository, serializer);
        ServiceInvoker invoker = new ServiceInvoker(clients, calls);
        BackoffStrategy backoff = new BackoffStrategy(retry.getBackoff(), retry.getMaxBackoff(),
                retry.getJitterPercent());

        this.compensation = new CompensationEngine(checkpointer, invoker, running, metrics,
                step.getPollInterval());
        this.executionEngine = new SagaExecutionEngine(checkpointer, invoker, compensation, running, metrics,
                backoff, workers, step.getPollInterval());
        this.recovery = new RecoveryManager(prefix + "recovery", recoveryConfig.getInterval(),
                recoveryConfig.getBatchSize(), step.getMaxParallelSteps(), repository, serializer, running,
                executionEngine, compensation, metrics, workers);
        this.timeoutMonitor = new TimeoutMonitor(prefix + "timeout-monitor", timeoutConfig.getInterval(),
                timeoutConfig.getBatchSize(), repository, running, recovery, compensation, metrics, workers);
    }

    private static CustomizableThreadFactory daemonThreads(String prefix) {
        CustomizableThreadFactory factory = new CustomizableThreadFactory(prefix);
        factory.setDaemon(true);
        return factory;
    }

    /**
     * Starts the recovery loop and the timeout monitor, as configured.
     */
    public void start() {
        ensureOpen();
        if (properties.getRecovery().isEnabled()) {
            recovery.start();
        }
        if (properties.getTimeoutMonitor().isEnabled()) {
            timeoutMonitor.start();
        }
        log.info("Saga coordinator {} started", running.instanceId());
    }

    public void registerServiceClient(String serviceName, ServiceClient client) {
        clients.register(serviceName, client);
    }

    public String startSaga(String sagaId, List<SagaStep> steps) {
        return startSaga(sagaId, steps, properties.getDefaultTimeout());
    }

    /**
     * Validates and persists a new transaction, then executes it
     * asynchronously.
     *
     * @param sagaId      Transaction id; a UUID is generated when null or blank
     * @param steps       Step definitions
     * @param sagaTimeout Deadline after which the transaction is failed and
     *                    compensated; the configured default when null
     * @return The transaction id
     * @throws SagaValidationException if the definition is malformed or the id
     *                                 is already taken
     * @throws PersistenceException    if the initial record could not be written
     */
    public String startSaga(String sagaId, List<SagaStep> steps, Duration sagaTimeout) {
        ensureOpen();
        String transactionId = (sagaId == null || sagaId.isBlank()) ? UUID.randomUUID().toString() : sagaId;
        Duration timeout = sagaTimeout == null ? properties.getDefaultTimeout() : sagaTimeout;
        if (timeout.isNegative() || timeout.isZero()) {
            throw new SagaValidationException("Saga timeout must be positive, was " + timeout);
        }
        validator.validate(steps);
        List<SagaStep> definition = List.copyOf(steps);

        if (running.isOwned(transactionId) || repository.exists(transactionId)) {
            throw new SagaValidationException("Transaction " + transactionId + " already exists");
        }
        if (!running.acquireLease(transactionId)) {
            throw new SagaValidationException("Transaction " + transactionId + " is owned by another instance");
        }

        Instant now = Instant.now();
        ExecutionState state = ExecutionState.initial(transactionId, definition);
        SagaTransaction record = SagaTransaction.pending(transactionId, serializer.writeDefinition(definition),
                serializer.writeLog(state.snapshot()), now, now.plus(timeout));
        ActiveSaga active = new ActiveSaga(record, definition, state, properties.getStep().getMaxParallelSteps(),
                metrics);
        if (!running.register(active)) {
            throw new SagaValidationException("Transaction " + transactionId + " already exists");
        }
        try {
            repository.save(record);
        } catch (PersistenceException e) {
            running.release(active);
            throw e;
        }

        log.info("Started transaction {} with {} step(s), timeout at {}", transactionId, definition.size(),
                record.timeoutAt());
        workers.execute(() -> executionEngine.run(active));
        return transactionId;
    }

    /**
     * @return The durable view of the transaction, empty if unknown
     */
    public Optional<TransactionStatusView> getTransactionStatus(String transactionId) {
        return repository.findById(transactionId).map(record -> new TransactionStatusView(
                record.transactionId(),
                record.status(),
                record.createdAt(),
                record.updatedAt(),
                record.timeoutAt(),
                record.recoveryCount(),
                record.executionLog() == null ? null : serializer.readLog(record.executionLog())));
    }

    /**
     * Moves a running transaction driven by this instance to compensating and
     * starts the compensation sweep. In-flight steps finish without further
     * retries before they are unwound.
     *
     * @return true if compensation was initiated by this call
     */
    public boolean cancelTransaction(String transactionId) {
        Optional<ActiveSaga> owned = running.find(transactionId);
        if (owned.isEmpty()) {
            return false;
        }
        ActiveSaga active = owned.get();
        if (!compensation.initiate(active, CANCELLABLE, TransactionStatus.COMPENSATING, "cancelled")) {
            return false;
        }
        workers.execute(() -> compensation.sweep(active));
        return true;
    }

    /**
     * Runs one recovery pass immediately.
     *
     * @return number of transactions adopted
     */
    public int recoverOrphanedTransactions() {
        ensureOpen();
        return recovery.recoverOnce();
    }

    /**
     * Runs one timeout pass immediately.
     *
     * @return number of transactions timed out
     */
    public int enforceTimeouts() {
        ensureOpen();
        return timeoutMonitor.sweepOnce();
    }

    /**
     * @return ids of the transactions this instance currently drives
     */
    public Set<String> activeTransactionIds() {
        return running.ids();
    }

    public String getInstanceId() {
        return running.instanceId();
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("Saga coordinator is closed");
        }
    }

    /**
     * Stops the background loops and all workers. Transactions in flight keep
     * their last checkpoint and are resumed by recovery.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        recovery.stop();
        timeoutMonitor.stop();
        running.abandonAll();
        workers.shutdownNow();
        calls.shutdownNow();
        log.info("Saga coordinator {} closed", running.instanceId());
    }
}
