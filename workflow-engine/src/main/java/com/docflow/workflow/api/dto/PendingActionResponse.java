package com.docflow.workflow.api.dto;

import com.docflow.workflow.instance.PendingAction;

import java.util.List;
import java.util.UUID;

/** One entry of GET /workflows/pending. */
public record PendingActionResponse(
        UUID         instanceId,
        String       documentId,
        String       workflowName,
        String       currentStep,
        List<String> actions
) {
    public static PendingActionResponse from(PendingAction p) {
        return new PendingActionResponse(
                p.instance().getId(),
                p.instance().getDocumentId(),
                p.instance().getDefinition().getName(),
                p.currentStep(),
                p.actions()
        );
    }
}
