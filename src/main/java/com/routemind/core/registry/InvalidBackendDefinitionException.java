package com.routemind.core.registry;

/**
 * Thrown at load time when a backend definition or fallback chain is invalid.
 */
public class InvalidBackendDefinitionException extends RuntimeException {

    public InvalidBackendDefinitionException(String message) {
        super(message);
    }

    public InvalidBackendDefinitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
