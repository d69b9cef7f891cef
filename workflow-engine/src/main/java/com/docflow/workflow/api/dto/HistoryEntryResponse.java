package com.docflow.workflow.api.dto;

import com.docflow.workflow.model.WorkflowHistoryEntry;

import java.time.Instant;

public record HistoryEntryResponse(
        Instant timestamp,
        String  action,
        String  step,
        String  actor,
        String  comment,
        String  fromState,
        String  toState
) {
    public static HistoryEntryResponse from(WorkflowHistoryEntry h) {
        return new HistoryEntryResponse(
                h.getRecordedAt(),
                h.getAction(),
                h.getStep(),
                h.getActor(),
                h.getComment(),
                h.getFromState() == null ? null : h.getFromState().label(),
                h.getToState()   == null ? null : h.getToState().label()
        );
    }
}
