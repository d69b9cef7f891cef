package com.docflow.workflow.model;

import jakarta.persistence.*;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Directed edge between two steps of the same definition.
 *
 * {@code action} restricts the edge to one action label ("Approve",
 * "Request Changes", ...), matched exactly; null means the edge applies
 * to any action.
 * The edge fires only when its condition group passes.
 *
 * DB table: workflow_transitions (position column keeps declaration order)
 */
@Entity
@Table(name = "workflow_transitions")
public class WorkflowTransition {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "from_step", nullable = false)
    private String fromStep;

    @Column(name = "to_step", nullable = false)
    private String toStep;

    @Column
    private String action;

    @ElementCollection
    @CollectionTable(name = "transition_conditions", joinColumns = @JoinColumn(name = "transition_id"))
    @OrderColumn(name = "position")
    private List<Condition> conditions = new ArrayList<>();

    protected WorkflowTransition() {}   // required by JPA

    public WorkflowTransition(String fromStep, String toStep, String action) {
        this.fromStep = fromStep;
        this.toStep   = toStep;
        this.action   = action;
    }

    /** True when this edge is eligible for the given action (null action matches everything). */
    public boolean appliesTo(String requestedAction) {
        return requestedAction == null || action == null || action.isBlank()
                || action.equals(requestedAction);
    }

    public WorkflowTransition withCondition(Condition condition) {
        this.conditions.add(condition);
        return this;
    }

    public WorkflowTransition copy() {
        WorkflowTransition copy = new WorkflowTransition(fromStep, toStep, action);
        conditions.forEach(c -> copy.conditions.add(c.copy()));
        return copy;
    }

    public UUID            getId()         { return id; }
    public String          getFromStep()   { return fromStep; }
    public String          getToStep()     { return toStep; }
    public String          getAction()     { return action; }
    public List<Condition> getConditions() { return conditions; }

    public void setFromStep(String fromStep)              { this.fromStep = fromStep; }
    public void setToStep(String toStep)                  { this.toStep = toStep; }
    public void setAction(String action)                  { this.action = action; }
    public void setConditions(List<Condition> conditions) { this.conditions = new ArrayList<>(conditions); }
}
