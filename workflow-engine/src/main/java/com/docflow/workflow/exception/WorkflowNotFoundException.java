package com.docflow.workflow.exception;

/** A workflow definition, instance or document could not be found. */
public class WorkflowNotFoundException extends WorkflowException {

    public WorkflowNotFoundException(String what, Object id) {
        super(what + " not found: " + id);
    }
}
