package com.docflow.workflow.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * A running (or finished) execution of a definition against one document.
 *
 * Every mutation happens under a row lock ({@code findByIdForUpdate});
 * the version column rejects writes that slipped past it.
 *
 * DB table: workflow_instances
 */
@Entity
@Table(name = "workflow_instances")
public class WorkflowInstance {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.EAGER, optional = false)
    @JoinColumn(name = "definition_id", nullable = false)
    private WorkflowDefinition definition;

    @Column(name = "document_id", nullable = false)
    private String documentId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private WorkflowStatus status = WorkflowStatus.DRAFT;

    // stepOrder of the step the instance is parked on.
    @Column(name = "current_step", nullable = false)
    private int currentStep = 1;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "instance_assignees", joinColumns = @JoinColumn(name = "instance_id"))
    @Column(name = "user_id")
    private Set<String> currentAssignees = new LinkedHashSet<>();

    @Column(name = "started_by", nullable = false)
    private String startedBy;

    @Column(name = "started_on")
    private Instant startedOn;

    @Column(name = "completed_by")
    private String completedBy;

    @Column(name = "completed_on")
    private Instant completedOn;

    @OneToMany(cascade = CascadeType.ALL, orphanRemoval = true)
    @JoinColumn(name = "instance_id", nullable = false)
    @OrderColumn(name = "seq")
    private List<WorkflowHistoryEntry> history = new ArrayList<>();

    @Version
    private long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected WorkflowInstance() {}   // required by JPA

    public WorkflowInstance(WorkflowDefinition definition, String documentId, String startedBy) {
        this.definition = definition;
        this.documentId = documentId;
        this.startedBy  = startedBy;
    }

    // ------------------------------------------------------------------
    // History (append-only)
    // ------------------------------------------------------------------

    public void appendHistory(WorkflowHistoryEntry entry) {
        history.add(entry);
    }

    public List<WorkflowHistoryEntry> getHistory() {
        return Collections.unmodifiableList(history);
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID               getId()               { return id; }
    public WorkflowDefinition getDefinition()       { return definition; }
    public String             getDocumentId()       { return documentId; }
    public WorkflowStatus     getStatus()           { return status; }
    public int                getCurrentStep()      { return currentStep; }
    public Set<String>        getCurrentAssignees() { return currentAssignees; }
    public String             getStartedBy()        { return startedBy; }
    public Instant            getStartedOn()        { return startedOn; }
    public String             getCompletedBy()      { return completedBy; }
    public Instant            getCompletedOn()      { return completedOn; }
    public long               getVersion()          { return version; }
    public Instant            getCreatedAt()        { return createdAt; }
    public Instant            getUpdatedAt()        { return updatedAt; }

    public void setStatus(WorkflowStatus status)        { this.status = status; }
    public void setCurrentStep(int currentStep)         { this.currentStep = currentStep; }
    public void setStartedOn(Instant startedOn)         { this.startedOn = startedOn; }
    public void setCompletedBy(String completedBy)      { this.completedBy = completedBy; }
    public void setCompletedOn(Instant completedOn)     { this.completedOn = completedOn; }

    public void setCurrentAssignees(Set<String> assignees) {
        this.currentAssignees.clear();
        this.currentAssignees.addAll(assignees);
    }
}
