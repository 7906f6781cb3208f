package com.routemind.core.execution;

/**
 * The backend answered with an error or could not be reached. Terminal for that
 * backend within the current task.
 */
public class BackendErrorException extends BackendInvocationException {

    private final int statusCode;

    public BackendErrorException(String backend, String message) {
        this(backend, message, -1, null);
    }

    public BackendErrorException(String backend, String message, Throwable cause) {
        this(backend, message, -1, cause);
    }

    public BackendErrorException(String backend, String message, int statusCode, Throwable cause) {
        super(backend, message, cause);
        this.statusCode = statusCode;
    }

    /** HTTP status, or -1 when no response was received. */
    public int getStatusCode() {
        return statusCode;
    }
}
