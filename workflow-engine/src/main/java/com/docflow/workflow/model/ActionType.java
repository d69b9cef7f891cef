package com.docflow.workflow.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Semantic type of a user action configured on a step.
 *
 * The label is the action name used for transition matching and in
 * history entries, e.g. a transition tagged "Request Changes" only
 * fires for REQUEST_CHANGES.
 */
public enum ActionType {
    APPROVAL("Approve"),
    REJECTION("Reject"),
    REQUEST_CHANGES("Request Changes"),
    FORWARD("Forward"),
    SKIP("Skip");

    private final String label;

    ActionType(String label) {
        this.label = label;
    }

    public String label() { return label; }

    /** Case-insensitive lookup by label ("approve") or constant name ("REQUEST_CHANGES"). */
    public static Optional<ActionType> fromName(String name) {
        if (name == null || name.isBlank()) return Optional.empty();
        String trimmed = name.trim();
        return Arrays.stream(values())
                .filter(t -> t.label.equalsIgnoreCase(trimmed) || t.name().equalsIgnoreCase(trimmed))
                .findFirst();
    }
}
