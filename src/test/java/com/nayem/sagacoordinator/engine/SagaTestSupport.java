package com.nayem.sagacoordinator.engine;

import com.nayem.sagacoordinator.saga.SagaStep;
import com.nayem.sagacoordinator.saga.TransactionStatus;
import com.nayem.sagacoordinator.saga.TransactionStatusView;
import com.nayem.sagacoordinator.spring.SagaCoordinatorProperties;

import java.time.Duration;
import java.util.Optional;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.fail;

final class SagaTestSupport {

    static final String SERVICE = "test-service";

    private SagaTestSupport() {
    }

    /**
     * Fast retries and polling, no background loops.
     */
    static SagaCoordinatorProperties fastProperties() {
        SagaCoordinatorProperties properties = new SagaCoordinatorProperties();
        properties.setInstanceId("test-instance");
        properties.getRetry().setBackoff(Duration.ofMillis(10));
        properties.getRetry().setMaxBackoff(Duration.ofMillis(50));
        properties.getStep().setPollInterval(Duration.ofMillis(20));
        properties.getRecovery().setEnabled(false);
        properties.getTimeoutMonitor().setEnabled(false);
        return properties;
    }

    /**
     * Step on {@link #SERVICE} with actions {@code do_<id>} and {@code undo_<id>}.
     */
    static SagaStep.Builder step(String stepId, String... dependsOn) {
        return SagaStep.builder(stepId)
                .serviceName(SERVICE)
                .action("do_" + stepId)
                .compensationAction("undo_" + stepId)
                .timeoutSeconds(5)
                .retryCount(0)
                .dependsOn(dependsOn);
    }

    static TransactionStatusView awaitStatus(SagaCoordinator coordinator, String transactionId,
            TransactionStatus expected) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 10_000;
        TransactionStatusView last = null;
        while (System.currentTimeMillis() < deadline) {
            Optional<TransactionStatusView> view = coordinator.getTransactionStatus(transactionId);
            if (view.isPresent()) {
                last = view.get();
                if (last.status() == expected) {
                    return last;
                }
            }
            Thread.sleep(20);
        }
        return fail("Transaction " + transactionId + " did not reach " + expected + ", last seen "
                + (last == null ? "nothing" : last.status()));
    }

    static void awaitCondition(String description, BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 10_000;
        while (System.currentTimeMillis() < deadline) {
            if (condition.getAsBoolean()) {
                return;
            }
            Thread.sleep(20);
        }
        fail("Timed out waiting for " + description);
    }
}
