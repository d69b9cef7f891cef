package com.docflow.workflow.notification;

/** Kinds of notification the dispatcher sends; used as the metric tag. */
public enum WorkflowEvent {
    STARTED,
    STEP_ASSIGNED,
    STEP_COMPLETED,
    ACTION_TAKEN,
    COMPLETED,
    REJECTED,
    CANCELLED,
    ON_HOLD,
    RESUMED,
    REASSIGNED,
    STEP_TIMEOUT,
    ESCALATION,
    REMINDER,
    DAILY_SUMMARY,
    DIGEST;

    public String tag() {
        return name().toLowerCase();
    }
}
