package com.docflow.workflow.instance;

import java.util.Map;

/**
 * Totals by status, overall and per definition name.
 */
public record WorkflowStatistics(StatusCounts overall, Map<String, StatusCounts> byDefinition) {

    public WorkflowStatistics {
        byDefinition = Map.copyOf(byDefinition);
    }
}
