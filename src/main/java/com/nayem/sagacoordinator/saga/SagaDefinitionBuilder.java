package com.nayem.sagacoordinator.saga;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * A fluent builder for saga step lists.
 * <p>
 * Steps declared with {@link #then} depend on the previously declared step,
 * which covers the common sequential case without repeating ids.
 * </p>
 *
 * <h3>Example Usage:</h3>
 *
 * <pre>{@code
 * List<SagaStep> steps = SagaDefinitionBuilder.newSaga()
 *         .step("create_order", s -> s
 *                 .serviceName("user-service")
 *                 .action("create_order")
 *                 .compensationAction("cancel_order"))
 *         .then("reserve_inventory", s -> s
 *                 .serviceName("inventory-service")
 *                 .action("reserve_items")
 *                 .compensationAction("release_items"))
 *         .build();
 * }</pre>
 */
public class SagaDefinitionBuilder {

    private final List<SagaStep> steps = new ArrayList<>();

    private SagaDefinitionBuilder() {
    }

    public static SagaDefinitionBuilder newSaga() {
        return new SagaDefinitionBuilder();
    }

    /**
     * Adds a step with the dependencies configured on the step builder.
     */
    public SagaDefinitionBuilder step(String stepId, Consumer<SagaStep.Builder> customizer) {
        SagaStep.Builder builder = SagaStep.builder(stepId);
        customizer.accept(builder);
        steps.add(builder.build());
        return this;
    }

    /**
     * Adds an already built step.
     */
    public SagaDefinitionBuilder step(SagaStep step) {
        steps.add(step);
        return this;
    }

    /**
     * Adds a step that depends on the most recently added step.
     *
     * @throws IllegalStateException if no step was added before
     */
    public SagaDefinitionBuilder then(String stepId, Consumer<SagaStep.Builder> customizer) {
        if (steps.isEmpty()) {
            throw new IllegalStateException("then() requires a preceding step");
        }
        String previous = steps.get(steps.size() - 1).stepId();
        SagaStep.Builder builder = SagaStep.builder(stepId).dependsOn(previous);
        customizer.accept(builder);
        steps.add(builder.build());
        return this;
    }

    /**
     * Builds the step list in declaration order.
     *
     * @throws IllegalStateException if no steps are defined
     */
    public List<SagaStep> build() {
        if (steps.isEmpty()) {
            throw new IllegalStateException("A saga must have at least one step");
        }
        return List.copyOf(steps);
    }
}
