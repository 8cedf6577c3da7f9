package com.nayem.sagacoordinator.saga;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Serialized snapshot of a saga's execution state, stored in the durable
 * record's {@code execution_log} column.
 *
 * @param transactionId  Owning transaction
 * @param status         Saga status at snapshot time
 * @param steps          Per-step execution records keyed by step id, in definition order
 * @param completedSteps Step ids in completion order
 * @param failedSteps    Step ids in failure order
 */
public record ExecutionLog(
        @JsonProperty("transaction_id") String transactionId,
        @JsonProperty("status") TransactionStatus status,
        @JsonProperty("steps") Map<String, StepExecution> steps,
        @JsonProperty("completed_steps") List<String> completedSteps,
        @JsonProperty("failed_steps") List<String> failedSteps) {

    public ExecutionLog {
        steps = steps == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(steps));
        completedSteps = completedSteps == null ? List.of() : List.copyOf(completedSteps);
        failedSteps = failedSteps == null ? List.of() : List.copyOf(failedSteps);
    }

    public StepExecution step(String stepId) {
        return steps.get(stepId);
    }
}
