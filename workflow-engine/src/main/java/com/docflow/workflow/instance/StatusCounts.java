package com.docflow.workflow.instance;

import com.docflow.workflow.model.WorkflowStatus;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/** Instance counts per status; every status is present, zero when unused. */
public record StatusCounts(long total, Map<WorkflowStatus, Long> byStatus) {

    public StatusCounts {
        EnumMap<WorkflowStatus, Long> complete = new EnumMap<>(WorkflowStatus.class);
        for (WorkflowStatus s : WorkflowStatus.values()) complete.put(s, 0L);
        if (byStatus != null) complete.putAll(byStatus);
        byStatus = Collections.unmodifiableMap(complete);
    }

    public long count(WorkflowStatus status) {
        return byStatus.get(status);
    }
}
