package com.nayem.sagacoordinator.saga;

import java.time.Instant;

/**
 * Caller-facing view of a transaction, as returned by
 * {@code SagaCoordinator#getTransactionStatus}.
 *
 * @param executionLog Parsed execution log; {@code null} if none was written yet
 */
public record TransactionStatusView(
        String transactionId,
        TransactionStatus status,
        Instant createdAt,
        Instant updatedAt,
        Instant timeoutAt,
        int recoveryCount,
        ExecutionLog executionLog) {

    public StepStatus stepStatus(String stepId) {
        if (executionLog == null || executionLog.step(stepId) == null) {
            return null;
        }
        return executionLog.step(stepId).getStatus();
    }
}
