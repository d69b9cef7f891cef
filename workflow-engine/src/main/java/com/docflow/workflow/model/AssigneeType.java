package com.docflow.workflow.model;

/**
 * How a step's assignees are computed from its {@code assigneeValue}.
 */
public enum AssigneeType {
    NONE,           // nobody is assigned (typical for END steps)
    ROLE,           // assigneeValue is a role; every enabled holder is assigned
    USER,           // assigneeValue is a single user id
    FIELD_BASED,    // assigneeValue names a document field holding a user or a role
    DYNAMIC         // assigneeValue names a registered DynamicAssigneeResolver
}
