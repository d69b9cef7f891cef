package com.docflow.workflow.model;

/**
 * Kind of node in a workflow definition.
 *
 * TASK, APPROVAL and REVIEW behave identically in the engine; the
 * distinction is only shown to users.
 */
public enum StepType {
    START,
    TASK,
    APPROVAL,
    REVIEW,
    NOTIFICATION,
    END
}
