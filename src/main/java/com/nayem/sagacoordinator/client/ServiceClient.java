package com.nayem.sagacoordinator.client;

import java.util.Map;

/**
 * Client for one business service taking part in sagas.
 * <p>
 * Used identically for forward actions and compensating actions. The
 * coordinator may re-invoke an action after a crash or a timeout, so
 * implementations must make both kinds of action idempotent.
 * </p>
 */
@FunctionalInterface
public interface ServiceClient {

    /**
     * Invokes a named action.
     *
     * @param action  The action name from the step definition
     * @param payload The step payload; compensations also receive
     *                {@code original_result}
     * @return The action result, stored on the step and handed back to its
     *         compensation
     * @throws Exception if the action failed; the coordinator retries or
     *                   compensates
     */
    Map<String, Object> call(String action, Map<String, Object> payload) throws Exception;
}
