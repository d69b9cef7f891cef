package com.docflow.workflow.gateway;

import com.docflow.workflow.model.NotificationLogEntry;
import com.docflow.workflow.model.NotificationType;
import com.docflow.workflow.repository.NotificationLogRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;

/**
 * Default transport: outgoing mail is written to the log (a real mail
 * relay is deployment-specific), in-app entries go to notification_log.
 *
 * In-app writes use their own transaction so a failed insert cannot mark
 * the surrounding workflow transaction rollback-only.
 */
@Component
public class DefaultNotificationTransport implements NotificationTransport {

    private static final Logger log = LoggerFactory.getLogger(DefaultNotificationTransport.class);

    private final NotificationLogRepository notificationLog;

    public DefaultNotificationTransport(NotificationLogRepository notificationLog) {
        this.notificationLog = notificationLog;
    }

    @Override
    public void send(Collection<String> recipients, String subject, String body,
                     String referenceType, String referenceId) {
        log.info("MAIL to={} subject='{}' ref={}/{}", recipients, subject, referenceType, referenceId);
        log.debug("MAIL body:\n{}", body);
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void appendInAppLog(String recipient, NotificationType type, String subject, String body,
                               String referenceType, String referenceId) {
        notificationLog.save(new NotificationLogEntry(recipient, subject, body, referenceType, referenceId, type));
    }
}
