package com.routemind.core.execution;

/**
 * Sends a task to a backend and returns its textual output.
 */
@FunctionalInterface
public interface BackendInvoker {

    /**
     * @throws BackendTimeoutException if the backend did not answer in time
     * @throws BackendErrorException   if the backend failed or was unreachable
     */
    String invoke(InvocationRequest request) throws BackendInvocationException;
}
