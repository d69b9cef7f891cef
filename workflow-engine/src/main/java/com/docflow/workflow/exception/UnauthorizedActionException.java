package com.docflow.workflow.exception;

/** The acting user is not allowed to perform the requested operation. */
public class UnauthorizedActionException extends WorkflowException {

    public UnauthorizedActionException(String message) {
        super(message);
    }
}
