package com.docflow.workflow.api.dto;

import com.docflow.workflow.model.WorkflowTransition;

import java.util.List;

/** action may be null: the transition then matches any action. */
public record TransitionDto(String fromStep, String toStep, String action, List<ConditionDto> conditions) {

    public static TransitionDto from(WorkflowTransition t) {
        return new TransitionDto(t.getFromStep(), t.getToStep(), t.getAction(),
                ConditionDto.fromEntities(t.getConditions()));
    }

    public WorkflowTransition toEntity() {
        WorkflowTransition transition = new WorkflowTransition(fromStep, toStep, action);
        transition.setConditions(ConditionDto.toEntities(conditions));
        return transition;
    }
}
