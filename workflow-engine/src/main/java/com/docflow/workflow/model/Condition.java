package com.docflow.workflow.model;

import jakarta.persistence.*;

/**
 * One typed comparison against a document field.
 *
 * Stored as an element collection on its owner (definition, step,
 * step action or transition); a condition has no identity of its own.
 */
@Embeddable
public class Condition {

    @Column(name = "field_name", nullable = false)
    private String field;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ConditionOperator operator;

    @Column(name = "condition_value")
    private String value;

    // Tags the condition into the AND accumulator or the OR accumulator.
    @Enumerated(EnumType.STRING)
    @Column(name = "logical_operator", nullable = false)
    private LogicalOperator logicalOperator = LogicalOperator.AND;

    protected Condition() {}   // required by JPA

    public Condition(String field, ConditionOperator operator, String value, LogicalOperator logicalOperator) {
        this.field           = field;
        this.operator        = operator;
        this.value           = value;
        this.logicalOperator = logicalOperator == null ? LogicalOperator.AND : logicalOperator;
    }

    public static Condition and(String field, ConditionOperator operator, String value) {
        return new Condition(field, operator, value, LogicalOperator.AND);
    }

    public static Condition or(String field, ConditionOperator operator, String value) {
        return new Condition(field, operator, value, LogicalOperator.OR);
    }

    public String            getField()           { return field; }
    public ConditionOperator getOperator()        { return operator; }
    public String            getValue()           { return value; }
    public LogicalOperator   getLogicalOperator() { return logicalOperator; }

    public Condition copy() {
        return new Condition(field, operator, value, logicalOperator);
    }

    @Override
    public String toString() {
        return logicalOperator + "(" + field + " " + operator + " " + value + ")";
    }
}
