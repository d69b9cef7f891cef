package com.docflow.workflow.exception;

/**
 * Root of every failure the workflow engine reports to its callers.
 *
 * Unchecked so callers only catch it when they have a specific recovery
 * strategy; the REST layer maps each subtype to an HTTP status.
 */
public class WorkflowException extends RuntimeException {

    public WorkflowException(String message) {
        super(message);
    }

    public WorkflowException(String message, Throwable cause) {
        super(message, cause);
    }
}
