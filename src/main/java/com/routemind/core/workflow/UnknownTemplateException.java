package com.routemind.core.workflow;

/**
 * Thrown when a workflow is requested with a template key the catalog does not know.
 */
public class UnknownTemplateException extends RuntimeException {

    private final String templateKey;

    public UnknownTemplateException(String templateKey) {
        super("Unknown workflow template: " + templateKey);
        this.templateKey = templateKey;
    }

    public String getTemplateKey() {
        return templateKey;
    }
}
