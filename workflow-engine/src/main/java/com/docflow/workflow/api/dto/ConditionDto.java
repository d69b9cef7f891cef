package com.docflow.workflow.api.dto;

import com.docflow.workflow.model.Condition;
import com.docflow.workflow.model.ConditionOperator;
import com.docflow.workflow.model.LogicalOperator;

import java.util.List;

/** JSON form of a condition row; logicalOperator defaults to AND. */
public record ConditionDto(String field, ConditionOperator operator, String value, LogicalOperator logicalOperator) {

    public static ConditionDto from(Condition c) {
        return new ConditionDto(c.getField(), c.getOperator(), c.getValue(), c.getLogicalOperator());
    }

    public Condition toEntity() {
        return new Condition(field, operator, value, logicalOperator == null ? LogicalOperator.AND : logicalOperator);
    }

    static List<Condition> toEntities(List<ConditionDto> dtos) {
        return dtos == null ? List.of() : dtos.stream().map(ConditionDto::toEntity).toList();
    }

    static List<ConditionDto> fromEntities(List<Condition> conditions) {
        return conditions.stream().map(ConditionDto::from).toList();
    }
}
