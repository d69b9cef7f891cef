package com.docflow.workflow.api.dto;

import com.docflow.workflow.model.WorkflowDefinition;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record DefinitionResponse(
        UUID                id,
        String              name,
        String              description,
        String              documentType,
        boolean             active,
        boolean             defaultForType,
        List<StepDto>       steps,
        List<TransitionDto> transitions,
        List<ConditionDto>  conditions,
        List<PermissionDto> permissions,
        Instant             createdAt,
        Instant             updatedAt
) {
    public static DefinitionResponse from(WorkflowDefinition d) {
        return new DefinitionResponse(
                d.getId(),
                d.getName(),
                d.getDescription(),
                d.getDocumentType(),
                d.isActive(),
                d.isDefaultForType(),
                d.stepsInOrder().stream().map(StepDto::from).toList(),
                d.getTransitions().stream().map(TransitionDto::from).toList(),
                ConditionDto.fromEntities(d.getConditions()),
                d.getPermissions().stream().map(PermissionDto::from).toList(),
                d.getCreatedAt(),
                d.getUpdatedAt()
        );
    }
}
