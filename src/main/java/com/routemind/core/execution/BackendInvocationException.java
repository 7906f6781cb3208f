package com.routemind.core.execution;

/**
 * Failure of a single call to a backend. Subclasses decide whether the executor
 * may try the same backend again.
 */
public class BackendInvocationException extends Exception {

    private final String backend;

    public BackendInvocationException(String backend, String message) {
        super(message);
        this.backend = backend;
    }

    public BackendInvocationException(String backend, String message, Throwable cause) {
        super(message, cause);
        this.backend = backend;
    }

    public String getBackend() {
        return backend;
    }
}
