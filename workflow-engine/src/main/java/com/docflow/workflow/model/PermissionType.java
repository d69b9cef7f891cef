package com.docflow.workflow.model;

/** What a {@link WorkflowPermission} grants on a definition. */
public enum PermissionType {
    START,
    READ,
    WRITE,
    ADMIN
}
