package com.docflow.workflow.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * Deferred "has this step timed out?" check.
 *
 * Rows are claimed by the timeout poller once {@code dueAt} has passed.
 * The check is idempotent: when it fires after the instance has moved
 * on, it is simply discarded.
 *
 * DB table: scheduled_timeout_checks
 */
@Entity
@Table(name = "scheduled_timeout_checks")
public class ScheduledTimeoutCheck {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "instance_id", nullable = false)
    private UUID instanceId;

    // stepOrder the instance was on when the check was scheduled.
    @Column(name = "step_order", nullable = false)
    private int stepOrder;

    @Column(name = "step_name", nullable = false)
    private String stepName;

    @Column(name = "due_at", nullable = false)
    private Instant dueAt;

    @Column(name = "fired_at")
    private Instant firedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    protected ScheduledTimeoutCheck() {}   // required by JPA

    public ScheduledTimeoutCheck(UUID instanceId, int stepOrder, String stepName, Instant dueAt) {
        this.instanceId = instanceId;
        this.stepOrder  = stepOrder;
        this.stepName   = stepName;
        this.dueAt      = dueAt;
    }

    public UUID    getId()         { return id; }
    public UUID    getInstanceId() { return instanceId; }
    public int     getStepOrder()  { return stepOrder; }
    public String  getStepName()   { return stepName; }
    public Instant getDueAt()      { return dueAt; }
    public Instant getFiredAt()    { return firedAt; }
    public Instant getCreatedAt()  { return createdAt; }

    public void setFiredAt(Instant firedAt) { this.firedAt = firedAt; }
}
