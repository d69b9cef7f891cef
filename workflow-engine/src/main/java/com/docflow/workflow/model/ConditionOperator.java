package com.docflow.workflow.model;

/**
 * Comparison applied by a {@link Condition} to a document field value.
 *
 * Numeric operators compare as decimals. IN / NOT_IN take a
 * comma-separated value list.
 */
public enum ConditionOperator {
    EQUALS,
    NOT_EQUALS,
    CONTAINS,
    NOT_CONTAINS,
    STARTS_WITH,
    ENDS_WITH,
    GREATER_THAN,
    GREATER_THAN_OR_EQUAL,
    LESS_THAN,
    LESS_THAN_OR_EQUAL,
    IN,
    NOT_IN,
    IS_EMPTY,
    IS_NOT_EMPTY
}
