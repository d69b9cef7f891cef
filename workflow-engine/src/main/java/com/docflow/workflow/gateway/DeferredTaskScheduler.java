package com.docflow.workflow.gateway;

import java.time.Instant;

/**
 * Deferred execution capability. The engine never cancels a scheduled
 * check; the handler re-validates the instance when the check fires.
 */
public interface DeferredTaskScheduler {

    void scheduleTimeoutCheck(Instant dueAt, TimeoutCheck check);
}
