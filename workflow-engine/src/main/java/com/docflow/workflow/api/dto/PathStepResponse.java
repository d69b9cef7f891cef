package com.docflow.workflow.api.dto;

import com.docflow.workflow.model.WorkflowStep;

public record PathStepResponse(int stepOrder, String stepName, String stepType, String assigneeType, String assigneeValue) {

    public static PathStepResponse from(WorkflowStep s) {
        return new PathStepResponse(
                s.getStepOrder(),
                s.getStepName(),
                s.getStepType().name(),
                s.getAssigneeType().name(),
                s.getAssigneeValue()
        );
    }
}
