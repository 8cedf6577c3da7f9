package com.nayem.sagacoordinator.saga;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Status of a single step within one saga instance.
 */
public enum StepStatus {

    PENDING,

    RUNNING,

    COMPLETED,

    FAILED,

    COMPENSATING,

    COMPENSATED;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static StepStatus fromWire(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Step status must not be null");
        }
        for (StepStatus status : values()) {
            if (status.wireValue().equals(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown step status: " + value);
    }
}
