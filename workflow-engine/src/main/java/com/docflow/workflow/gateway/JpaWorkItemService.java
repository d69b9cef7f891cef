package com.docflow.workflow.gateway;

import com.docflow.workflow.model.WorkItem;
import com.docflow.workflow.repository.WorkItemRepository;
import org.springframework.stereotype.Component;

@Component
public class JpaWorkItemService implements WorkItemService {

    private final WorkItemRepository workItems;

    public JpaWorkItemService(WorkItemRepository workItems) {
        this.workItems = workItems;
    }

    @Override
    public void createWorkItem(WorkItemRequest r) {
        workItems.save(new WorkItem(r.instanceId(), r.stepName(), r.assignee(), r.subject(),
                r.description(), r.referenceType(), r.referenceId(), r.dueAt()));
    }
}
