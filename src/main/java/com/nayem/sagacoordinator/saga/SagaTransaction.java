package com.nayem.sagacoordinator.saga;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Durable record of a Saga transaction.
 * <p>
 * This record is persisted to enable crash recovery. If the coordinator
 * crashes mid-saga, another instance (or the same one after restart) resumes
 * or compensates based on it. Never deleted by the coordinator.
 * </p>
 *
 * @param transactionId Unique identifier, the record key
 * @param status        Current saga status
 * @param definition    JSON serialized step list
 * @param executionLog  JSON serialized {@link ExecutionLog}
 * @param createdAt     When the saga was started
 * @param updatedAt     When the record was last written
 * @param timeoutAt     Deadline after which the timeout monitor force-fails the saga
 * @param recoveryCount How many times a coordinator adopted this transaction after a crash
 */
public record SagaTransaction(
        @JsonProperty("transaction_id") String transactionId,
        @JsonProperty("status") TransactionStatus status,
        @JsonProperty("definition") String definition,
        @JsonProperty("execution_log") String executionLog,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("updated_at") Instant updatedAt,
        @JsonProperty("timeout_at") Instant timeoutAt,
        @JsonProperty("recovery_count") int recoveryCount) {

    public static SagaTransaction pending(String transactionId, String definition, String executionLog,
            Instant now, Instant timeoutAt) {
        return new SagaTransaction(transactionId, TransactionStatus.PENDING, definition, executionLog,
                now, now, timeoutAt, 0);
    }

    public SagaTransaction withProgress(TransactionStatus newStatus, String newExecutionLog, Instant now) {
        return new SagaTransaction(transactionId, newStatus, definition, newExecutionLog,
                createdAt, now, timeoutAt, recoveryCount);
    }

    public SagaTransaction withRecovery(Instant now) {
        return new SagaTransaction(transactionId, status, definition, executionLog,
                createdAt, now, timeoutAt, recoveryCount + 1);
    }

    public boolean isTimedOut(Instant now) {
        return timeoutAt != null && timeoutAt.isBefore(now);
    }
}
