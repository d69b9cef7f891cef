package com.docflow.workflow.exception;

public class ActiveInstanceExistsException extends WorkflowException {

    public ActiveInstanceExistsException(String documentId) {
        super("An active workflow already exists for document " + documentId);
    }
}
