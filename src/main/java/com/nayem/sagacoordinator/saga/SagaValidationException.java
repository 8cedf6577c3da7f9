package com.nayem.sagacoordinator.saga;

import java.util.List;

/**
 * Raised synchronously by {@code startSaga} for a malformed saga definition,
 * before anything is persisted. Never retried.
 */
public class SagaValidationException extends SagaException {

    private final List<String> problems;

    public SagaValidationException(List<String> problems) {
        super("Invalid saga definition: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public SagaValidationException(String problem) {
        this(List.of(problem));
    }

    public List<String> getProblems() {
        return problems;
    }
}
