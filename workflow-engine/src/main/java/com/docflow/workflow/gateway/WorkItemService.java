package com.docflow.workflow.gateway;

/** Creates to-do records for step assignees. */
public interface WorkItemService {

    void createWorkItem(WorkItemRequest request);
}
