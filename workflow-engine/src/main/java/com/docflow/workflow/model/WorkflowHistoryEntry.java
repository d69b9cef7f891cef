package com.docflow.workflow.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * One append-only audit record of an instance.
 *
 * Entries are never edited once written; their position in the owning
 * instance's history list (the seq column) is the audit order.
 *
 * DB table: workflow_history
 */
@Entity
@Table(name = "workflow_history")
public class WorkflowHistoryEntry {

    public static final String STATE_TRANSITION = "State Transition";

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "recorded_at", nullable = false, updatable = false)
    private Instant recordedAt;

    @Column(nullable = false, updatable = false)
    private String action;

    @Column(updatable = false)
    private String step;

    @Column(updatable = false)
    private String actor;

    @Column(columnDefinition = "TEXT", updatable = false)
    private String comment;

    // Only set on "State Transition" entries.
    @Enumerated(EnumType.STRING)
    @Column(name = "from_state", updatable = false)
    private WorkflowStatus fromState;

    @Enumerated(EnumType.STRING)
    @Column(name = "to_state", updatable = false)
    private WorkflowStatus toState;

    protected WorkflowHistoryEntry() {}   // required by JPA

    private WorkflowHistoryEntry(String action, String step, String actor, String comment,
                                 WorkflowStatus fromState, WorkflowStatus toState) {
        this.recordedAt = Instant.now();
        this.action     = action;
        this.step       = step;
        this.actor      = actor;
        this.comment    = comment;
        this.fromState  = fromState;
        this.toState    = toState;
    }

    public static WorkflowHistoryEntry action(String action, String step, String actor, String comment) {
        return new WorkflowHistoryEntry(action, step, actor, comment, null, null);
    }

    public static WorkflowHistoryEntry stateTransition(WorkflowStatus from, WorkflowStatus to,
                                                       String actor, String comment) {
        return new WorkflowHistoryEntry(STATE_TRANSITION, null, actor, comment, from, to);
    }

    public boolean isStateTransition() { return STATE_TRANSITION.equals(action); }

    public UUID           getId()         { return id; }
    public Instant        getRecordedAt() { return recordedAt; }
    public String         getAction()     { return action; }
    public String         getStep()       { return step; }
    public String         getActor()      { return actor; }
    public String         getComment()    { return comment; }
    public WorkflowStatus getFromState()  { return fromState; }
    public WorkflowStatus getToState()    { return toState; }
}
