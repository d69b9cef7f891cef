package com.docflow.workflow.model;

public enum LogicalOperator {
    AND,
    OR
}
