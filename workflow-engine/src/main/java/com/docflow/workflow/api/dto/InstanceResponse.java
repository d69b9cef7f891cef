package com.docflow.workflow.api.dto;

import com.docflow.workflow.model.WorkflowInstance;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/** Response body for the instance endpoints. Status is the display label, e.g. "In Progress". */
public record InstanceResponse(
        UUID         id,
        String       workflowName,
        String       documentId,
        String       status,
        int          currentStep,
        String       currentStepName,
        List<String> currentAssignees,
        String       startedBy,
        Instant      startedOn,
        String       completedBy,
        Instant      completedOn,
        long         version
) {
    public static InstanceResponse from(WorkflowInstance i) {
        return new InstanceResponse(
                i.getId(),
                i.getDefinition().getName(),
                i.getDocumentId(),
                i.getStatus().label(),
                i.getCurrentStep(),
                i.getDefinition().stepByOrder(i.getCurrentStep()).map(s -> s.getStepName()).orElse(null),
                i.getCurrentAssignees().stream().sorted().toList(),
                i.getStartedBy(),
                i.getStartedOn(),
                i.getCompletedBy(),
                i.getCompletedOn(),
                i.getVersion()
        );
    }
}
