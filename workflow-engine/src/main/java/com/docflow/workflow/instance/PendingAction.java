package com.docflow.workflow.instance;

import com.docflow.workflow.model.WorkflowInstance;

import java.util.List;

/** An in-progress instance together with the action names a user may take on it. */
public record PendingAction(WorkflowInstance instance, String currentStep, List<String> actions) {}
