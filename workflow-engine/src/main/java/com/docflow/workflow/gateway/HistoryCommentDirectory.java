package com.docflow.workflow.gateway;

import com.docflow.workflow.repository.WorkflowHistoryRepository;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.UUID;

/**
 * Treats every actor who left a comment on a history entry as a commenter.
 */
@Component
public class HistoryCommentDirectory implements CommentDirectory {

    private final WorkflowHistoryRepository history;

    public HistoryCommentDirectory(WorkflowHistoryRepository history) {
        this.history = history;
    }

    @Override
    public Set<String> commentersOf(UUID instanceId) {
        return new LinkedHashSet<>(history.findCommenters(instanceId));
    }
}
