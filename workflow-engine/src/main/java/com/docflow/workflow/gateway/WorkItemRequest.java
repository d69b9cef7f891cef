package com.docflow.workflow.gateway;

import java.time.Instant;
import java.util.UUID;

public record WorkItemRequest(
        UUID instanceId,
        String stepName,
        String assignee,
        String subject,
        String description,
        String referenceType,
        String referenceId,
        Instant dueAt
) {}
