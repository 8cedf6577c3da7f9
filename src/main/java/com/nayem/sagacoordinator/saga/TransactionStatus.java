package com.nayem.sagacoordinator.saga;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Represents the execution status of a Saga transaction.
 * <p>
 * The wire form is the lower-case name. Unknown wire values are rejected
 * instead of being carried through as free-form strings.
 * </p>
 */
public enum TransactionStatus {

    /**
     * Transaction persisted but scheduling has not started yet.
     */
    PENDING,

    /**
     * Transaction is executing forward steps.
     */
    RUNNING,

    /**
     * All steps completed successfully.
     */
    COMPLETED,

    /**
     * A step failed or the transaction timed out. Immediately followed by
     * {@link #COMPENSATING}.
     */
    FAILED,

    /**
     * Completed steps are being unwound in reverse completion order.
     */
    COMPENSATING,

    /**
     * The compensation sweep finished.
     */
    COMPENSATED;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static TransactionStatus fromWire(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Transaction status must not be null");
        }
        for (TransactionStatus status : values()) {
            if (status.wireValue().equals(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown transaction status: " + value);
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == COMPENSATED;
    }
}
