package com.docflow.workflow.api.dto;

import com.docflow.workflow.model.WorkflowPermission;

public record PermissionDto(String role, boolean allowStart, boolean allowRead,
                            boolean allowWrite, boolean allowAdmin) {

    public static PermissionDto from(WorkflowPermission p) {
        return new PermissionDto(p.getRole(), p.isAllowStart(), p.isAllowRead(), p.isAllowWrite(), p.isAllowAdmin());
    }

    public WorkflowPermission toEntity() {
        return new WorkflowPermission(role, allowStart, allowRead, allowWrite, allowAdmin);
    }
}
