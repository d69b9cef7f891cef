package com.docflow.workflow.api.dto;

import com.docflow.workflow.model.AssigneeType;
import com.docflow.workflow.model.StepType;
import com.docflow.workflow.model.WorkflowStep;

import java.util.List;
import java.util.Set;

public record StepDto(
        String              stepName,
        String              description,
        StepType            stepType,
        int                 stepOrder,
        AssigneeType        assigneeType,
        String              assigneeValue,
        Set<String>         allowedRoles,
        Integer             timeoutDays,
        Integer             timeLimitHours,
        Integer             escalationDays,
        boolean             notifyOnTimeout,
        boolean             notifyOnEscalation,
        boolean             allowSkip,
        Boolean             allowReject,
        List<StepActionDto> actions,
        List<ConditionDto>  conditions
) {
    public static StepDto from(WorkflowStep s) {
        return new StepDto(
                s.getStepName(),
                s.getDescription(),
                s.getStepType(),
                s.getStepOrder(),
                s.getAssigneeType(),
                s.getAssigneeValue(),
                s.getAllowedRoles(),
                s.getTimeoutDays(),
                s.getTimeLimitHours(),
                s.getEscalationDays(),
                s.isNotifyOnTimeout(),
                s.isNotifyOnEscalation(),
                s.isAllowSkip(),
                s.isAllowReject(),
                s.getActions().stream().map(StepActionDto::from).toList(),
                ConditionDto.fromEntities(s.getConditions())
        );
    }

    public WorkflowStep toEntity() {
        WorkflowStep step = new WorkflowStep(stepName, stepType, stepOrder);
        step.setDescription(description);
        step.setAssigneeType(assigneeType == null ? AssigneeType.NONE : assigneeType);
        step.setAssigneeValue(assigneeValue);
        step.setAllowedRoles(allowedRoles == null ? Set.of() : allowedRoles);
        step.setTimeoutDays(timeoutDays);
        step.setTimeLimitHours(timeLimitHours);
        step.setEscalationDays(escalationDays);
        step.setNotifyOnTimeout(notifyOnTimeout);
        step.setNotifyOnEscalation(notifyOnEscalation);
        step.setAllowSkip(allowSkip);
        step.setAllowReject(allowReject == null || allowReject);
        if (actions != null) actions.forEach(a -> step.addAction(a.toEntity()));
        step.setConditions(ConditionDto.toEntities(conditions));
        return step;
    }
}
