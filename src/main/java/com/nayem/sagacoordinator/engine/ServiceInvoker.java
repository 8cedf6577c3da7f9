package com.nayem.sagacoordinator.engine;

import com.nayem.sagacoordinator.client.ServiceClientRegistry;
import com.nayem.sagacoordinator.saga.CompensationException;
import com.nayem.sagacoordinator.saga.SagaStep;
import com.nayem.sagacoordinator.saga.StepExecutionException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Invokes service clients on the call pool, bounded by the step timeout.
 * A call that exceeds the timeout is cancelled with an interrupt.
 */
class ServiceInvoker {

    static final String ORIGINAL_RESULT = "original_result";

    private final ServiceClientRegistry clients;
    private final ExecutorService callExecutor;

    ServiceInvoker(ServiceClientRegistry clients, ExecutorService callExecutor) {
        this.clients = clients;
        this.callExecutor = callExecutor;
    }

    Map<String, Object> invoke(SagaStep step) throws InterruptedException {
        try {
            return call(step, step.action(), step.payload());
        } catch (TimeoutException e) {
            throw new StepExecutionException(step.stepId(),
                    "Step " + step.stepId() + " timed out after " + step.timeoutSeconds() + "s", e, true);
        } catch (ExecutionException e) {
            throw new StepExecutionException(step.stepId(),
                    "Step " + step.stepId() + " failed: " + describe(e.getCause()), e.getCause(), false);
        }
    }

    /**
     * Invokes the compensating action with the step payload plus the forward
     * result under {@code original_result}.
     */
    void compensate(SagaStep step, Map<String, Object> originalResult) throws InterruptedException {
        Map<String, Object> payload = new LinkedHashMap<>(step.payload());
        payload.put(ORIGINAL_RESULT, originalResult);
        try {
            call(step, step.compensationAction(), payload);
        } catch (TimeoutException e) {
            throw new CompensationException(step.stepId(),
                    "Compensation of step " + step.stepId() + " timed out after " + step.timeoutSeconds() + "s", e);
        } catch (ExecutionException e) {
            throw new CompensationException(step.stepId(),
                    "Compensation of step " + step.stepId() + " failed: " + describe(e.getCause()), e.getCause());
        }
    }

    private Map<String, Object> call(SagaStep step, String action, Map<String, Object> payload)
            throws InterruptedException, ExecutionException, TimeoutException {
        Future<Map<String, Object>> future = callExecutor.submit(
                () -> clients.require(step.serviceName()).call(action, payload));
        try {
            Map<String, Object> result = future.get(step.timeoutSeconds(), TimeUnit.SECONDS);
            return result == null ? Map.of() : result;
        } catch (TimeoutException | InterruptedException e) {
            future.cancel(true);
            throw e;
        }
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown error";
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
