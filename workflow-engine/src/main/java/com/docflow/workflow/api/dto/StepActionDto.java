package com.docflow.workflow.api.dto;

import com.docflow.workflow.model.ActionType;
import com.docflow.workflow.model.StepAction;

import java.util.List;

/** actionName defaults to the type's label; requiredRole "All" or blank means anyone eligible. */
public record StepActionDto(String actionName, ActionType actionType, String requiredRole,
                            List<ConditionDto> conditions) {

    public static StepActionDto from(StepAction a) {
        return new StepActionDto(a.getActionName(), a.getActionType(), a.getRequiredRole(),
                ConditionDto.fromEntities(a.getConditions()));
    }

    public StepAction toEntity() {
        StepAction action = actionName == null || actionName.isBlank()
                ? new StepAction(actionType)
                : new StepAction(actionName, actionType);
        action.setRequiredRole(requiredRole);
        action.setConditions(ConditionDto.toEntities(conditions));
        return action;
    }
}
