package com.docflow.workflow.model;

/**
 * Lifecycle state of a {@link WorkflowInstance}.
 *
 * Happy path:
 *   PENDING → IN_PROGRESS → COMPLETED
 *
 * COMPLETED is final. REJECTED can be re-opened to PENDING and CANCELLED
 * can be re-opened to DRAFT; the full transition table lives in
 * {@code WorkflowStateMachine}.
 */
public enum WorkflowStatus {
    DRAFT("Draft"),
    PENDING("Pending"),
    IN_PROGRESS("In Progress"),
    COMPLETED("Completed"),
    REJECTED("Rejected"),
    CANCELLED("Cancelled"),
    ON_HOLD("On Hold");

    private final String label;

    WorkflowStatus(String label) {
        this.label = label;
    }

    public String label() { return label; }

    /** Entering one of these stamps completedBy / completedOn. */
    public boolean isTerminal() {
        return this == COMPLETED || this == REJECTED || this == CANCELLED;
    }

    /** At most one instance per document may be in one of these states. */
    public boolean isActive() {
        return this == PENDING || this == IN_PROGRESS || this == ON_HOLD;
    }
}
