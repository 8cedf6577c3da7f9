package com.nayem.sagacoordinator.engine;

import com.nayem.sagacoordinator.client.ServiceClientRegistry;
import com.nayem.sagacoordinator.saga.SagaStep;
import com.nayem.sagacoordinator.saga.SagaValidationException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;

/**
 * Checks a step list before anything is persisted.
 * <p>
 * Every problem found is collected and reported in a single
 * {@link SagaValidationException}.
 * </p>
 */
public class SagaGraphValidator {

    private final ServiceClientRegistry clients;

    public SagaGraphValidator(ServiceClientRegistry clients) {
        this.clients = clients;
    }

    public void validate(List<SagaStep> steps) {
        if (steps == null || steps.isEmpty()) {
            throw new SagaValidationException("Saga must contain at least one step");
        }

        List<String> problems = new ArrayList<>();
        Map<String, SagaStep> byId = new LinkedHashMap<>();
        for (SagaStep step : steps) {
            if (step == null) {
                problems.add("Saga contains a null step");
                continue;
            }
            if (step.stepId() == null || step.stepId().isBlank()) {
                problems.add("Step id must not be blank");
                continue;
            }
            if (byId.putIfAbsent(step.stepId(), step) != null) {
                problems.add("Duplicate step id " + step.stepId());
            }
        }

        for (SagaStep step : byId.values()) {
            if (step.action() == null || step.action().isBlank()) {
                problems.add("Step " + step.stepId() + " has no action");
            }
            if (step.compensationAction() == null || step.compensationAction().isBlank()) {
                problems.add("Step " + step.stepId() + " has no compensation action");
            }
            if (!clients.isRegistered(step.serviceName())) {
                problems.add("Step " + step.stepId() + " uses unregistered service " + step.serviceName());
            }
            for (String dependency : step.dependsOn()) {
                if (dependency.equals(step.stepId())) {
                    problems.add("Step " + step.stepId() + " depends on itself");
                } else if (!byId.containsKey(dependency)) {
                    problems.add("Step " + step.stepId() + " depends on unknown step " + dependency);
                }
            }
        }

        if (problems.isEmpty()) {
            List<String> cycle = unorderedSteps(byId);
            if (!cycle.isEmpty()) {
                problems.add("Dependency cycle among steps " + cycle);
            }
        }

        if (!problems.isEmpty()) {
            throw new SagaValidationException(problems);
        }
    }

    /**
     * Kahn's algorithm over the dependency graph.
     *
     * @return steps that could not be ordered, empty when the graph is acyclic
     */
    private static List<String> unorderedSteps(Map<String, SagaStep> byId) {
        Map<String, Integer> indegree = new LinkedHashMap<>();
        Map<String, List<String>> dependents = new LinkedHashMap<>();
        for (String id : byId.keySet()) {
            indegree.put(id, 0);
            dependents.put(id, new ArrayList<>());
        }
        for (SagaStep step : byId.values()) {
            for (String dependency : step.dependsOn()) {
                indegree.merge(step.stepId(), 1, Integer::sum);
                dependents.get(dependency).add(step.stepId());
            }
        }

        Queue<String> queue = new ArrayDeque<>();
        indegree.forEach((id, degree) -> {
            if (degree == 0) {
                queue.add(id);
            }
        });

        Set<String> ordered = new HashSet<>();
        while (!queue.isEmpty()) {
            String id = queue.poll();
            ordered.add(id);
            for (String dependent : dependents.get(id)) {
                if (indegree.merge(dependent, -1, Integer::sum) == 0) {
                    queue.add(dependent);
                }
            }
        }

        return byId.keySet().stream().filter(id -> !ordered.contains(id)).toList();
    }
}
