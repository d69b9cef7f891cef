package com.docflow.workflow.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * Per-assignee task created when a step becomes current.
 *
 * DB table: work_items
 */
@Entity
@Table(name = "work_items")
public class WorkItem {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "instance_id", nullable = false)
    private UUID instanceId;

    @Column(name = "step_name", nullable = false)
    private String stepName;

    @Column(nullable = false)
    private String assignee;

    @Column(nullable = false)
    private String subject;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Column(name = "reference_type", nullable = false)
    private String referenceType;

    @Column(name = "reference_id", nullable = false)
    private String referenceId;

    @Column(name = "due_at", nullable = false)
    private Instant dueAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    protected WorkItem() {}   // required by JPA

    public WorkItem(UUID instanceId, String stepName, String assignee, String subject,
                    String description, String referenceType, String referenceId, Instant dueAt) {
        this.instanceId    = instanceId;
        this.stepName      = stepName;
        this.assignee      = assignee;
        this.subject       = subject;
        this.description   = description;
        this.referenceType = referenceType;
        this.referenceId   = referenceId;
        this.dueAt         = dueAt;
    }

    public UUID    getId()            { return id; }
    public UUID    getInstanceId()    { return instanceId; }
    public String  getStepName()      { return stepName; }
    public String  getAssignee()      { return assignee; }
    public String  getSubject()       { return subject; }
    public String  getDescription()   { return description; }
    public String  getReferenceType() { return referenceType; }
    public String  getReferenceId()   { return referenceId; }
    public Instant getDueAt()         { return dueAt; }
    public Instant getCreatedAt()     { return createdAt; }
}
