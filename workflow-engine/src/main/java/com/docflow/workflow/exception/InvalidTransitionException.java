package com.docflow.workflow.exception;

import com.docflow.workflow.model.WorkflowStatus;

/** Requested status change is not in the transition table, or the instance is in the wrong status for the action. */
public class InvalidTransitionException extends WorkflowException {

    private final WorkflowStatus from;
    private final WorkflowStatus to;

    public InvalidTransitionException(WorkflowStatus from, WorkflowStatus to) {
        super("Invalid state transition from " + from.label() + " to " + to.label());
        this.from = from;
        this.to   = to;
    }

    public InvalidTransitionException(WorkflowStatus current, String message) {
        super(message);
        this.from = current;
        this.to   = null;
    }

    public WorkflowStatus getFrom() { return from; }
    public WorkflowStatus getTo()   { return to; }
}
