package com.routemind.core.workflow;

/**
 * Thrown at load time when a workflow template is malformed.
 */
public class InvalidTemplateDefinitionException extends RuntimeException {

    public InvalidTemplateDefinitionException(String message) {
        super(message);
    }

    public InvalidTemplateDefinitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
