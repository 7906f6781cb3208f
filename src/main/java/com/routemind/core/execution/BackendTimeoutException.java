package com.routemind.core.execution;

/**
 * The backend did not answer within the attempt timeout. Retryable: the executor
 * re-queues the backend once at the end of the candidate list.
 */
public class BackendTimeoutException extends BackendInvocationException {

    public BackendTimeoutException(String backend, String message) {
        super(backend, message);
    }

    public BackendTimeoutException(String backend, String message, Throwable cause) {
        super(backend, message, cause);
    }
}
