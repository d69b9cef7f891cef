package com.docflow.workflow.api.dto;

public record ReassignRequest(String assignee, String comment) {}
