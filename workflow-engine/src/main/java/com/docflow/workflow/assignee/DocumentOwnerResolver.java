package com.docflow.workflow.assignee;

import com.docflow.workflow.gateway.DocumentSnapshot;
import com.docflow.workflow.gateway.IdentityDirectory;
import com.docflow.workflow.model.WorkflowStep;
import org.springframework.stereotype.Component;

import java.util.Set;

/** Routes the step to the user named in the document's {@code owner} field. */
@Component
public class DocumentOwnerResolver implements DynamicAssigneeResolver {

    static final String OWNER_FIELD = "owner";

    private final IdentityDirectory identity;

    public DocumentOwnerResolver(IdentityDirectory identity) {
        this.identity = identity;
    }

    @Override
    public String name() { return "document-owner"; }

    @Override
    public Set<String> resolve(WorkflowStep step, DocumentSnapshot document, String actor) {
        String owner = document.fieldAsString(OWNER_FIELD);
        return identity.userExists(owner) ? Set.of(owner) : Set.of();
    }
}
