package com.docflow.workflow.gateway;

import com.docflow.workflow.model.NotificationType;

import java.util.Collection;

/**
 * Outbound delivery of workflow notifications. Implementations may throw;
 * the dispatcher contains every failure.
 */
public interface NotificationTransport {

    void send(Collection<String> recipients, String subject, String body,
              String referenceType, String referenceId);

    void appendInAppLog(String recipient, NotificationType type, String subject, String body,
                        String referenceType, String referenceId);
}
