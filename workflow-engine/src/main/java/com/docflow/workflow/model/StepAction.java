package com.docflow.workflow.model;

import jakarta.persistence.*;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * A named operation a user can perform at a step (e.g. "Approve", "Sign off").
 *
 * The action is offered only to holders of {@code requiredRole} (unless the
 * role is unset or the sentinel "All") and only when its condition group
 * passes against the document.
 *
 * DB table: workflow_step_actions
 */
@Entity
@Table(name = "workflow_step_actions")
public class StepAction {

    /** Role value that lets every user through the role check. */
    public static final String ALL_ROLES = "All";

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "action_name", nullable = false)
    private String actionName;

    @Enumerated(EnumType.STRING)
    @Column(name = "action_type", nullable = false)
    private ActionType actionType;

    @Column(name = "required_role")
    private String requiredRole;

    @ElementCollection
    @CollectionTable(name = "action_conditions", joinColumns = @JoinColumn(name = "action_id"))
    @OrderColumn(name = "position")
    private List<Condition> conditions = new ArrayList<>();

    protected StepAction() {}   // required by JPA

    public StepAction(String actionName, ActionType actionType) {
        this.actionName = actionName;
        this.actionType = actionType;
    }

    public StepAction(ActionType actionType) {
        this(actionType.label(), actionType);
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID            getId()           { return id; }
    public String          getActionName()   { return actionName; }
    public ActionType      getActionType()   { return actionType; }
    public String          getRequiredRole() { return requiredRole; }
    public List<Condition> getConditions()   { return conditions; }

    public void setActionName(String actionName)          { this.actionName = actionName; }
    public void setActionType(ActionType actionType)      { this.actionType = actionType; }
    public void setRequiredRole(String requiredRole)      { this.requiredRole = requiredRole; }
    public void setConditions(List<Condition> conditions) { this.conditions = new ArrayList<>(conditions); }

    public StepAction withRequiredRole(String role) {
        this.requiredRole = role;
        return this;
    }

    public StepAction withCondition(Condition condition) {
        this.conditions.add(condition);
        return this;
    }

    public StepAction copy() {
        StepAction copy = new StepAction(actionName, actionType);
        copy.requiredRole = requiredRole;
        conditions.forEach(c -> copy.conditions.add(c.copy()));
        return copy;
    }
}
