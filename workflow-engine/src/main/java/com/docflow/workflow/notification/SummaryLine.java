package com.docflow.workflow.notification;

/** One row of a user's daily summary. */
public record SummaryLine(String documentId, String workflowName, String currentStep, String status) {}
