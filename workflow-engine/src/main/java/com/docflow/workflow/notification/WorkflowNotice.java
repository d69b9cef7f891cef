package com.docflow.workflow.notification;

import com.docflow.workflow.model.NotificationType;

/** Composed subject/body pair ready for delivery. */
public record WorkflowNotice(WorkflowEvent event, NotificationType type, String subject, String body) {}
