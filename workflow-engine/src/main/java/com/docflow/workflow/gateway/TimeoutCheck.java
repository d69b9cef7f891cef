package com.docflow.workflow.gateway;

import java.util.UUID;

/** Descriptor of a deferred timeout check: which instance, on which step. */
public record TimeoutCheck(UUID instanceId, int stepOrder, String stepName) {}
