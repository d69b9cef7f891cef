package com.docflow.workflow.gateway;

import java.util.Set;
import java.util.UUID;

/** Who has commented on an instance. */
public interface CommentDirectory {

    Set<String> commentersOf(UUID instanceId);
}
