package com.docflow.workflow.assignee;

import com.docflow.workflow.gateway.DocumentSnapshot;
import com.docflow.workflow.model.WorkflowStep;

import java.util.Set;

/**
 * Compiled, named assignee computation for steps with assignee type DYNAMIC.
 *
 * A step refers to a resolver by {@link #name()} in its assignee value.
 * Declare an implementation as a Spring {@code @Component} to register it.
 */
public interface DynamicAssigneeResolver {

    String name();

    /**
     * @param step     the step being routed
     * @param document the bound document
     * @param actor    user driving the current operation; may be null for system-triggered routing
     */
    Set<String> resolve(WorkflowStep step, DocumentSnapshot document, String actor);
}
