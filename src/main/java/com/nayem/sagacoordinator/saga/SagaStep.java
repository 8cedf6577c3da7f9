package com.nayem.sagacoordinator.saga;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Definition of an individual step within a Saga transaction.
 * <p>
 * Each step is bound to one service and has:
 * - A forward action
 * - A compensating action used to reverse the forward action
 * </p>
 * <p>
 * Immutable once the saga starts. {@code dependsOn} names other steps of the
 * same saga that must complete before this step may run.
 * </p>
 *
 * <h3>Example Usage:</h3>
 *
 * <pre>{@code
 * SagaStep reserve = SagaStep.builder("reserve_inventory")
 *         .serviceName("inventory-service")
 *         .action("reserve_items")
 *         .compensationAction("release_items")
 *         .payload(Map.of("items", List.of("item1", "item2")))
 *         .dependsOn("create_order")
 *         .build();
 * }</pre>
 *
 * @param stepId             Unique identifier within the saga
 * @param serviceName        Logical name of the service client executing the step
 * @param action             Forward action name
 * @param compensationAction Compensating action name
 * @param payload            Arguments passed to both actions
 * @param timeoutSeconds     Upper bound for a single service call
 * @param retryCount         Retries after the first failed attempt
 * @param dependsOn          Step ids that must be completed first
 */
public record SagaStep(
        @JsonProperty("step_id") String stepId,
        @JsonProperty("service_name") String serviceName,
        @JsonProperty("action") String action,
        @JsonProperty("compensation_action") String compensationAction,
        @JsonProperty("payload") Map<String, Object> payload,
        @JsonProperty("timeout") int timeoutSeconds,
        @JsonProperty("retry_count") int retryCount,
        @JsonProperty("depends_on") List<String> dependsOn) {

    public static final int DEFAULT_TIMEOUT_SECONDS = 30;
    public static final int DEFAULT_RETRY_COUNT = 3;

    public SagaStep {
        // payload values may be null, which Map.copyOf rejects
        payload = payload == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        dependsOn = dependsOn == null
                ? List.of()
                : List.copyOf(new LinkedHashSet<>(dependsOn));
        if (timeoutSeconds <= 0) {
            timeoutSeconds = DEFAULT_TIMEOUT_SECONDS;
        }
        if (retryCount < 0) {
            throw new IllegalArgumentException("retryCount must not be negative for step " + stepId);
        }
    }

    public static Builder builder(String stepId) {
        return new Builder(stepId);
    }

    public static class Builder {
        private final String stepId;
        private String serviceName;
        private String action;
        private String compensationAction;
        private final Map<String, Object> payload = new LinkedHashMap<>();
        private int timeoutSeconds = DEFAULT_TIMEOUT_SECONDS;
        private int retryCount = DEFAULT_RETRY_COUNT;
        private final List<String> dependsOn = new ArrayList<>();

        private Builder(String stepId) {
            this.stepId = stepId;
        }

        public Builder serviceName(String serviceName) {
            this.serviceName = serviceName;
            return this;
        }

        public Builder action(String action) {
            this.action = action;
            return this;
        }

        public Builder compensationAction(String compensationAction) {
            this.compensationAction = compensationAction;
            return this;
        }

        public Builder payload(Map<String, Object> payload) {
            this.payload.putAll(payload);
            return this;
        }

        public Builder payload(String key, Object value) {
            this.payload.put(key, value);
            return this;
        }

        public Builder timeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
            return this;
        }

        public Builder retryCount(int retryCount) {
            this.retryCount = retryCount;
            return this;
        }

        public Builder dependsOn(String... stepIds) {
            this.dependsOn.addAll(List.of(stepIds));
            return this;
        }

        public SagaStep build() {
            return new SagaStep(stepId, serviceName, action, compensationAction, payload,
                    timeoutSeconds, retryCount, dependsOn);
        }
    }
}
