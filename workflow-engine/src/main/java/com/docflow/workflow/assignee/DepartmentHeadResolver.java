package com.docflow.workflow.assignee;

import com.docflow.workflow.gateway.DocumentSnapshot;
import com.docflow.workflow.gateway.IdentityDirectory;
import com.docflow.workflow.model.WorkflowStep;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Routes the step to holders of the "&lt;department&gt; Head" role, where the
 * department comes from the document's {@code department} field.
 */
@Component
public class DepartmentHeadResolver implements DynamicAssigneeResolver {

    static final String DEPARTMENT_FIELD = "department";

    private final IdentityDirectory identity;

    public DepartmentHeadResolver(IdentityDirectory identity) {
        this.identity = identity;
    }

    @Override
    public String name() { return "department-head"; }

    @Override
    public Set<String> resolve(WorkflowStep step, DocumentSnapshot document, String actor) {
        String department = document.fieldAsString(DEPARTMENT_FIELD).trim();
        if (department.isEmpty()) return Set.of();
        return identity.usersWithRole(department + " Head");
    }
}
