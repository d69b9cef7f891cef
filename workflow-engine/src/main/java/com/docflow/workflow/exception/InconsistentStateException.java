package com.docflow.workflow.exception;

/**
 * The instance points at something that no longer exists in its definition
 * (e.g. the current step order has no step).
 */
public class InconsistentStateException extends WorkflowException {

    public InconsistentStateException(String message) {
        super(message);
    }
}
