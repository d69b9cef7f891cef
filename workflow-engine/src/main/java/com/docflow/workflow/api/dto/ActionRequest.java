package com.docflow.workflow.api.dto;

/**
 * Request body for POST /workflows/instances/{id}/actions.
 *
 * action is a built-in label ("Approve", "Reject", "Request Changes",
 * "Forward", "Skip") or a step action's configured name. targetStep is
 * only read for Forward and may be a step name or a step order.
 */
public record ActionRequest(String action, String comment, String targetStep) {}
