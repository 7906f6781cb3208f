package com.routemind.core.routing;

/**
 * Raised when a task cannot be placed on any routable backend.
 * Routing itself reports this as an unavailable {@link com.routemind.core.model.RoutingDecision};
 * the executor converts it into this exception to fail the task.
 */
public class NoHealthyBackendException extends RuntimeException {

    public NoHealthyBackendException(String message) {
        super(message);
    }
}
