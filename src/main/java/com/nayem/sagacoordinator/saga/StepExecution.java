package com.nayem.sagacoordinator.saga;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Execution record of one step within one saga instance.
 * <p>
 * Not thread-safe. Instances are mutated only by the engines while they hold
 * the owning transaction's lock.
 * </p>
 */
public class StepExecution {

    @JsonProperty("step_id")
    private String stepId;

    @JsonProperty("status")
    private StepStatus status;

    @JsonProperty("start_time")
    private Instant startTime;

    @JsonProperty("end_time")
    private Instant endTime;

    @JsonProperty("result")
    private Map<String, Object> result;

    @JsonProperty("error")
    private String error;

    @JsonProperty("retry_count_used")
    private int retryCountUsed;

    @JsonProperty("compensation_error")
    private String compensationError;

    public StepExecution() {
    }

    public StepExecution(String stepId, StepStatus status) {
        this.stepId = stepId;
        this.status = status;
    }

    public static StepExecution pending(String stepId) {
        return new StepExecution(stepId, StepStatus.PENDING);
    }

    public StepExecution copy() {
        StepExecution copy = new StepExecution(stepId, status);
        copy.startTime = startTime;
        copy.endTime = endTime;
        copy.result = result == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(result));
        copy.error = error;
        copy.retryCountUsed = retryCountUsed;
        copy.compensationError = compensationError;
        return copy;
    }

    public String getStepId() {
        return stepId;
    }

    public void setStepId(String stepId) {
        this.stepId = stepId;
    }

    public StepStatus getStatus() {
        return status;
    }

    public void setStatus(StepStatus status) {
        this.status = status;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public void setStartTime(Instant startTime) {
        this.startTime = startTime;
    }

    public Instant getEndTime() {
        return endTime;
    }

    public void setEndTime(Instant endTime) {
        this.endTime = endTime;
    }

    public Map<String, Object> getResult() {
        return result;
    }

    public void setResult(Map<String, Object> result) {
        this.result = result;
    }

    public String getError() {
        return error;
    }

    public void setError(String error) {
        this.error = error;
    }

    public int getRetryCountUsed() {
        return retryCountUsed;
    }

    public void setRetryCountUsed(int retryCountUsed) {
        this.retryCountUsed = retryCountUsed;
    }

    public String getCompensationError() {
        return compensationError;
    }

    public void setCompensationError(String compensationError) {
        this.compensationError = compensationError;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof StepExecution that)) {
            return false;
        }
        return retryCountUsed == that.retryCountUsed
                && Objects.equals(stepId, that.stepId)
                && status == that.status
                && Objects.equals(startTime, that.startTime)
                && Objects.equals(endTime, that.endTime)
                && Objects.equals(result, that.result)
                && Objects.equals(error, that.error)
                && Objects.equals(compensationError, that.compensationError);
    }

    @Override
    public int hashCode() {
        return Objects.hash(stepId, status, startTime, endTime, result, error, retryCountUsed, compensationError);
    }

    @Override
    public String toString() {
        return "StepExecution{" + stepId + ", " + status + ", retries=" + retryCountUsed + "}";
    }
}
