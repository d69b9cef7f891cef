package com.docflow.workflow.model;

import jakarta.persistence.*;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * One node of a workflow definition.
 *
 * Steps are addressed two ways: by {@code stepOrder} (the instance's
 * current-step pointer and the sequential fallback route) and by
 * {@code stepName} (transition endpoints). Both are unique within a
 * definition.
 *
 * DB table: workflow_steps
 */
@Entity
@Table(name = "workflow_steps")
public class WorkflowStep {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "step_name", nullable = false)
    private String stepName;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(name = "step_type", nullable = false)
    private StepType stepType;

    @Column(name = "step_order", nullable = false)
    private int stepOrder;

    @Enumerated(EnumType.STRING)
    @Column(name = "assignee_type", nullable = false)
    private AssigneeType assigneeType = AssigneeType.NONE;

    @Column(name = "assignee_value")
    private String assigneeValue;

    // Holders of these roles may act on the step in addition to its assignees.
    @ElementCollection
    @CollectionTable(name = "step_allowed_roles", joinColumns = @JoinColumn(name = "step_id"))
    @Column(name = "role")
    private Set<String> allowedRoles = new LinkedHashSet<>();

    @Column(name = "timeout_days")
    private Integer timeoutDays;

    // Deadline in hours; takes precedence over timeoutDays when set.
    @Column(name = "time_limit_hours")
    private Integer timeLimitHours;

    @Column(name = "escalation_days")
    private Integer escalationDays;

    @Column(name = "notify_on_timeout", nullable = false)
    private boolean notifyOnTimeout;

    @Column(name = "notify_on_escalation", nullable = false)
    private boolean notifyOnEscalation;

    @Column(name = "allow_skip", nullable = false)
    private boolean allowSkip;

    @Column(name = "allow_reject", nullable = false)
    private boolean allowReject = true;

    @OneToMany(cascade = CascadeType.ALL, orphanRemoval = true)
    @JoinColumn(name = "step_id", nullable = false)
    @OrderColumn(name = "position")
    private List<StepAction> actions = new ArrayList<>();

    // Gate the step itself; evaluated with the same AND/OR group rules as actions.
    @ElementCollection
    @CollectionTable(name = "step_conditions", joinColumns = @JoinColumn(name = "step_id"))
    @OrderColumn(name = "position")
    private List<Condition> conditions = new ArrayList<>();

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected WorkflowStep() {}   // required by JPA

    public WorkflowStep(String stepName, StepType stepType, int stepOrder) {
        this.stepName  = stepName;
        this.stepType  = stepType;
        this.stepOrder = stepOrder;
    }

    // ------------------------------------------------------------------
    // Behaviour
    // ------------------------------------------------------------------

    public boolean isStart() { return stepType == StepType.START; }
    public boolean isEnd()   { return stepType == StepType.END; }

    /**
     * Deadline for work started at {@code from}: time limit in hours when
     * set, otherwise timeout in days, otherwise none.
     */
    public Optional<Instant> deadlineFrom(Instant from) {
        if (timeLimitHours != null && timeLimitHours > 0) {
            return Optional.of(from.plus(Duration.ofHours(timeLimitHours)));
        }
        if (timeoutDays != null && timeoutDays > 0) {
            return Optional.of(from.plus(Duration.ofDays(timeoutDays)));
        }
        return Optional.empty();
    }

    public List<StepAction> actionsOfType(ActionType type) {
        return actions.stream().filter(a -> a.getActionType() == type).toList();
    }

    public Optional<StepAction> actionNamed(String name) {
        return actions.stream()
                .filter(a -> a.getActionName().equalsIgnoreCase(name))
                .findFirst();
    }

    public WorkflowStep addAction(StepAction action) {
        actions.add(action);
        return this;
    }

    public WorkflowStep assignedTo(AssigneeType type, String value) {
        this.assigneeType  = type;
        this.assigneeValue = value;
        return this;
    }

    public WorkflowStep copy() {
        WorkflowStep copy = new WorkflowStep(stepName, stepType, stepOrder);
        copy.description        = description;
        copy.assigneeType       = assigneeType;
        copy.assigneeValue      = assigneeValue;
        copy.allowedRoles       = new LinkedHashSet<>(allowedRoles);
        copy.timeoutDays        = timeoutDays;
        copy.timeLimitHours     = timeLimitHours;
        copy.escalationDays     = escalationDays;
        copy.notifyOnTimeout    = notifyOnTimeout;
        copy.notifyOnEscalation = notifyOnEscalation;
        copy.allowSkip          = allowSkip;
        copy.allowReject        = allowReject;
        actions.forEach(a -> copy.actions.add(a.copy()));
        conditions.forEach(c -> copy.conditions.add(c.copy()));
        return copy;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID             getId()                 { return id; }
    public String           getStepName()           { return stepName; }
    public String           getDescription()        { return description; }
    public StepType         getStepType()           { return stepType; }
    public int              getStepOrder()          { return stepOrder; }
    public AssigneeType     getAssigneeType()       { return assigneeType; }
    public String           getAssigneeValue()      { return assigneeValue; }
    public Set<String>      getAllowedRoles()       { return allowedRoles; }
    public Integer          getTimeoutDays()        { return timeoutDays; }
    public Integer          getTimeLimitHours()     { return timeLimitHours; }
    public Integer          getEscalationDays()     { return escalationDays; }
    public boolean          isNotifyOnTimeout()     { return notifyOnTimeout; }
    public boolean          isNotifyOnEscalation()  { return notifyOnEscalation; }
    public boolean          isAllowSkip()           { return allowSkip; }
    public boolean          isAllowReject()         { return allowReject; }
    public List<StepAction> getActions()            { return actions; }
    public List<Condition>  getConditions()         { return conditions; }

    public void setStepName(String stepName)                 { this.stepName = stepName; }
    public void setDescription(String description)           { this.description = description; }
    public void setStepType(StepType stepType)               { this.stepType = stepType; }
    public void setStepOrder(int stepOrder)                  { this.stepOrder = stepOrder; }
    public void setAssigneeType(AssigneeType assigneeType)   { this.assigneeType = assigneeType; }
    public void setAssigneeValue(String assigneeValue)       { this.assigneeValue = assigneeValue; }
    public void setAllowedRoles(Set<String> allowedRoles)    { this.allowedRoles = new LinkedHashSet<>(allowedRoles); }
    public void setTimeoutDays(Integer timeoutDays)          { this.timeoutDays = timeoutDays; }
    public void setTimeLimitHours(Integer timeLimitHours)    { this.timeLimitHours = timeLimitHours; }
    public void setEscalationDays(Integer escalationDays)    { this.escalationDays = escalationDays; }
    public void setNotifyOnTimeout(boolean v)                { this.notifyOnTimeout = v; }
    public void setNotifyOnEscalation(boolean v)             { this.notifyOnEscalation = v; }
    public void setAllowSkip(boolean allowSkip)              { this.allowSkip = allowSkip; }
    public void setAllowReject(boolean allowReject)          { this.allowReject = allowReject; }
    public void setActions(List<StepAction> actions)         { this.actions.clear(); this.actions.addAll(actions); }
    public void setConditions(List<Condition> conditions)    { this.conditions = new ArrayList<>(conditions); }
}
