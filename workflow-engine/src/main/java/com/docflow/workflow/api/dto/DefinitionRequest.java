package com.docflow.workflow.api.dto;

import com.docflow.workflow.model.WorkflowDefinition;

import java.util.List;

/**
 * Request body for POST /workflows/definitions and PUT /workflows/definitions/{name}.
 *
 * Steps, transitions, conditions and permissions replace the stored ones
 * wholesale on update. Transition order is significant.
 */
public record DefinitionRequest(
        String              name,
        String              description,
        String              documentType,
        boolean             active,
        boolean             defaultForType,
        List<StepDto>       steps,
        List<TransitionDto> transitions,
        List<ConditionDto>  conditions,
        List<PermissionDto> permissions
) {
    public WorkflowDefinition toEntity() {
        WorkflowDefinition definition = new WorkflowDefinition(name, documentType);
        definition.setDescription(description);
        definition.setActive(active);
        definition.setDefaultForType(defaultForType);
        if (steps != null)       steps.forEach(s -> definition.addStep(s.toEntity()));
        if (transitions != null) transitions.forEach(t -> definition.addTransition(t.toEntity()));
        definition.setConditions(ConditionDto.toEntities(conditions));
        definition.setPermissions(permissions == null ? List.of()
                : permissions.stream().map(PermissionDto::toEntity).toList());
        return definition;
    }
}
