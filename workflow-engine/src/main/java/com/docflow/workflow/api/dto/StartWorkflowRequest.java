package com.docflow.workflow.api.dto;

/**
 * Request body for POST /workflows/instances.
 *
 * workflowName is optional; without it the default (or first applicable)
 * definition for the document's type is used.
 */
public record StartWorkflowRequest(String documentId, String workflowName) {}
