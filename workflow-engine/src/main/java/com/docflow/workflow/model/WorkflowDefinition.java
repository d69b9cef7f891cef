package com.docflow.workflow.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Reusable template describing how one type of document gets approved.
 *
 * A definition owns its steps (ordered by stepOrder), the directed
 * transitions between them (kept in declaration order, which decides
 * first-match routing), definition-level applicability conditions and
 * role permissions.
 *
 * DB table: workflow_definitions
 */
@Entity
@Table(name = "workflow_definitions")
public class WorkflowDefinition {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, unique = true)
    private String name;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Column(name = "document_type", nullable = false)
    private String documentType;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    // At most one default per document type; enforced on save.
    @Column(name = "is_default", nullable = false)
    private boolean defaultForType;

    @OneToMany(cascade = CascadeType.ALL, orphanRemoval = true)
    @JoinColumn(name = "definition_id", nullable = false)
    @OrderBy("stepOrder ASC")
    private List<WorkflowStep> steps = new ArrayList<>();

    @OneToMany(cascade = CascadeType.ALL, orphanRemoval = true)
    @JoinColumn(name = "definition_id", nullable = false)
    @OrderColumn(name = "position")
    private List<WorkflowTransition> transitions = new ArrayList<>();

    @ElementCollection
    @CollectionTable(name = "definition_conditions", joinColumns = @JoinColumn(name = "definition_id"))
    @OrderColumn(name = "position")
    private List<Condition> conditions = new ArrayList<>();

    @ElementCollection
    @CollectionTable(name = "definition_permissions", joinColumns = @JoinColumn(name = "definition_id"))
    @OrderColumn(name = "position")
    private List<WorkflowPermission> permissions = new ArrayList<>();

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

    protected WorkflowDefinition() {}   // required by JPA

    public WorkflowDefinition(String name, String documentType) {
        this.name         = name;
        this.documentType = documentType;
    }

    // ------------------------------------------------------------------
    // Lookups
    // ------------------------------------------------------------------

    public Optional<WorkflowStep> startStep() {
        return steps.stream().filter(WorkflowStep::isStart).findFirst();
    }

    public Optional<WorkflowStep> stepByOrder(int order) {
        return steps.stream().filter(s -> s.getStepOrder() == order).findFirst();
    }

    public Optional<WorkflowStep> stepByName(String stepName) {
        if (stepName == null) return Optional.empty();
        return steps.stream().filter(s -> s.getStepName().equals(stepName)).findFirst();
    }

    /** Outgoing transitions of a step, in declaration order. */
    public List<WorkflowTransition> transitionsFrom(String stepName) {
        return transitions.stream().filter(t -> t.getFromStep().equals(stepName)).toList();
    }

    public List<WorkflowStep> stepsInOrder() {
        return steps.stream().sorted(Comparator.comparingInt(WorkflowStep::getStepOrder)).toList();
    }

    /** True when any of the given roles holds the permission on this definition. */
    public boolean permits(Collection<String> roles, PermissionType type) {
        return permissions.stream()
                .anyMatch(p -> roles.contains(p.getRole()) && p.grants(type));
    }

    public WorkflowDefinition addStep(WorkflowStep step) {
        steps.add(step);
        return this;
    }

    public WorkflowDefinition addTransition(WorkflowTransition transition) {
        transitions.add(transition);
        return this;
    }

    /** Deep copy of the structure; the copy is named by the caller and starts inactive. */
    public WorkflowDefinition copyAs(String newName) {
        WorkflowDefinition copy = new WorkflowDefinition(newName, documentType);
        copy.description = description;
        steps.forEach(s -> copy.steps.add(s.copy()));
        transitions.forEach(t -> copy.transitions.add(t.copy()));
        conditions.forEach(c -> copy.conditions.add(c.copy()));
        permissions.forEach(p -> copy.permissions.add(p.copy()));
        return copy;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID                     getId()             { return id; }
    public String                   getName()           { return name; }
    public String                   getDescription()    { return description; }
    public String                   getDocumentType()   { return documentType; }
    public boolean                  isActive()          { return active; }
    public boolean                  isDefaultForType()  { return defaultForType; }
    public List<WorkflowStep>       getSteps()          { return steps; }
    public List<WorkflowTransition> getTransitions()    { return transitions; }
    public List<Condition>          getConditions()     { return conditions; }
    public List<WorkflowPermission> getPermissions()    { return permissions; }
    public Instant                  getCreatedAt()      { return createdAt; }
    public Instant                  getUpdatedAt()      { return updatedAt; }

    public void setName(String name)                   { this.name = name; }
    public void setDescription(String description)     { this.description = description; }
    public void setDocumentType(String documentType)   { this.documentType = documentType; }
    public void setActive(boolean active)              { this.active = active; }
    public void setDefaultForType(boolean v)           { this.defaultForType = v; }

    public void setSteps(List<WorkflowStep> steps) {
        this.steps.clear();
        this.steps.addAll(steps);
    }

    public void setTransitions(List<WorkflowTransition> transitions) {
        this.transitions.clear();
        this.transitions.addAll(transitions);
    }

    public void setConditions(List<Condition> conditions) {
        this.conditions.clear();
        this.conditions.addAll(conditions);
    }

    public void setPermissions(List<WorkflowPermission> permissions) {
        this.permissions.clear();
        this.permissions.addAll(permissions);
    }
}
