package com.docflow.workflow.model;

import jakarta.persistence.*;

/**
 * Role-based grant attached to a workflow definition.
 */
@Embeddable
public class WorkflowPermission {

    @Column(nullable = false)
    private String role;

    @Column(name = "allow_start", nullable = false)
    private boolean allowStart;

    @Column(name = "allow_read", nullable = false)
    private boolean allowRead;

    @Column(name = "allow_write", nullable = false)
    private boolean allowWrite;

    @Column(name = "allow_admin", nullable = false)
    private boolean allowAdmin;

    protected WorkflowPermission() {}   // required by JPA

    public WorkflowPermission(String role, boolean allowStart, boolean allowRead,
                              boolean allowWrite, boolean allowAdmin) {
        this.role       = role;
        this.allowStart = allowStart;
        this.allowRead  = allowRead;
        this.allowWrite = allowWrite;
        this.allowAdmin = allowAdmin;
    }

    public boolean grants(PermissionType type) {
        return switch (type) {
            case START -> allowStart;
            case READ  -> allowRead;
            case WRITE -> allowWrite;
            case ADMIN -> allowAdmin;
        };
    }

    public String  getRole()       { return role; }
    public boolean isAllowStart()  { return allowStart; }
    public boolean isAllowRead()   { return allowRead; }
    public boolean isAllowWrite()  { return allowWrite; }
    public boolean isAllowAdmin()  { return allowAdmin; }

    public WorkflowPermission copy() {
        return new WorkflowPermission(role, allowStart, allowRead, allowWrite, allowAdmin);
    }
}
