package com.docflow.workflow.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * In-app notification shown to a user in their inbox.
 *
 * DB table: notification_log
 */
@Entity
@Table(name = "notification_log")
public class NotificationLogEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "for_user", nullable = false)
    private String forUser;

    @Column(nullable = false)
    private String subject;

    @Column(name = "email_content", columnDefinition = "TEXT")
    private String emailContent;

    @Column(name = "document_type")
    private String documentType;

    @Column(name = "document_id")
    private String documentId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private NotificationType type;

    @Column(name = "is_read", nullable = false)
    private boolean read;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    protected NotificationLogEntry() {}   // required by JPA

    public NotificationLogEntry(String forUser, String subject, String emailContent,
                                String documentType, String documentId, NotificationType type) {
        this.forUser      = forUser;
        this.subject      = subject;
        this.emailContent = emailContent;
        this.documentType = documentType;
        this.documentId   = documentId;
        this.type         = type;
    }

    public UUID             getId()           { return id; }
    public String           getForUser()      { return forUser; }
    public String           getSubject()      { return subject; }
    public String           getEmailContent() { return emailContent; }
    public String           getDocumentType() { return documentType; }
    public String           getDocumentId()   { return documentId; }
    public NotificationType getType()         { return type; }
    public boolean          isRead()          { return read; }
    public Instant          getCreatedAt()    { return createdAt; }
}
