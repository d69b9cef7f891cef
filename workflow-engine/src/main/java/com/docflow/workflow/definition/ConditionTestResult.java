package com.docflow.workflow.definition;

import java.util.Map;

/**
 * Outcome of evaluating a definition's condition groups against one document.
 *
 * @param stepResults step name to whether its condition group passed, in step order
 */
public record ConditionTestResult(String definitionName,
                                  String documentId,
                                  boolean definitionConditionsMet,
                                  Map<String, Boolean> stepResults) {}
