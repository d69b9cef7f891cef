package com.docflow.workflow.timeout;

import com.docflow.workflow.model.WorkflowHistoryEntry;
import com.docflow.workflow.model.WorkflowInstance;
import com.docflow.workflow.model.WorkflowStep;
import com.docflow.workflow.notification.NotificationDispatcher;
import com.docflow.workflow.repository.WorkflowInstanceRepository;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;
import java.util.UUID;

/**
 * Acts on a fired timeout check.
 *
 * The check only applies if the instance is not terminal and is still on
 * the exact step (order and name) the check was scheduled for. Otherwise
 * the instance has moved on and the check is dropped; this is how pending
 * checks get cancelled.
 *
 * Runs in its own transaction so one failing check cannot roll back the
 * rest of the poller's batch.
 */
@Component
public class StepTimeoutHandler {

    private static final Logger log = LoggerFactory.getLogger(StepTimeoutHandler.class);

    public static final String STEP_TIMED_OUT = "Step Timed Out";

    private final WorkflowInstanceRepository instances;
    private final NotificationDispatcher     notifications;
    private final MeterRegistry              meterRegistry;

    public StepTimeoutHandler(WorkflowInstanceRepository instances,
                              NotificationDispatcher notifications,
                              MeterRegistry meterRegistry) {
        this.instances     = instances;
        this.notifications = notifications;
        this.meterRegistry = meterRegistry;
    }

    /** @return true when the timeout applied and notifications went out */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean handle(UUID instanceId, int stepOrder, String stepName) {
        Optional<WorkflowInstance> found = instances.findByIdForUpdate(instanceId);
        if (found.isEmpty()) {
            log.warn("Timeout check for unknown instance {} dropped", instanceId);
            return stale();
        }

        WorkflowInstance instance = found.get();
        if (instance.getStatus().isTerminal() || instance.getCurrentStep() != stepOrder) {
            log.debug("Instance {} moved on (status={}, step={}); timeout for step {} dropped",
                    instanceId, instance.getStatus(), instance.getCurrentStep(), stepOrder);
            return stale();
        }
        Optional<WorkflowStep> step = instance.getDefinition().stepByOrder(stepOrder)
                .filter(s -> s.getStepName().equals(stepName));
        if (step.isEmpty()) {
            return stale();
        }

        instance.appendHistory(WorkflowHistoryEntry.action(STEP_TIMED_OUT, stepName, null,
                "Step '" + stepName + "' timed out"));
        instances.save(instance);
        notifications.notifyStepTimeout(instance, step.get());

        meterRegistry.counter("docflow.workflow.timeouts", "outcome", "fired").increment();
        log.info("Instance {} step '{}' timed out", instanceId, stepName);
        return true;
    }

    private boolean stale() {
        meterRegistry.counter("docflow.workflow.timeouts", "outcome", "stale").increment();
        return false;
    }
}
