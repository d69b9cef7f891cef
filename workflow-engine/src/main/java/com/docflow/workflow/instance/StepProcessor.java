package com.docflow.workflow.instance;

import com.docflow.workflow.gateway.DeferredTaskScheduler;
import com.docflow.workflow.gateway.DocumentSnapshot;
import com.docflow.workflow.gateway.TimeoutCheck;
import com.docflow.workflow.gateway.WorkItemRequest;
import com.docflow.workflow.gateway.WorkItemService;
import com.docflow.workflow.model.WorkflowHistoryEntry;
import com.docflow.workflow.model.WorkflowInstance;
import com.docflow.workflow.model.WorkflowStep;
import com.docflow.workflow.notification.NotificationDispatcher;
import com.docflow.workflow.routing.RoutingResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;

/**
 * Makes a step the live step of an instance.
 *
 * Processing a step:
 *  1. resolves its assignees and stores them on the instance
 *  2. creates one work item per assignee (due at the step deadline, default one day)
 *  3. schedules a timeout check when the step has a deadline and notify-on-timeout
 *  4. notifies the assignees
 *  5. appends a "Step Processed" history entry
 *
 * Callers hold the instance lock and persist the instance afterwards.
 */
@Component
public class StepProcessor {

    private static final Logger log = LoggerFactory.getLogger(StepProcessor.class);

    public static final String STEP_PROCESSED = "Step Processed";

    static final String REFERENCE_TYPE = "Document";

    private final RoutingResolver        routing;
    private final WorkItemService        workItems;
    private final DeferredTaskScheduler  scheduler;
    private final NotificationDispatcher notifications;
    private final Clock                  clock;

    public StepProcessor(RoutingResolver routing,
                         WorkItemService workItems,
                         DeferredTaskScheduler scheduler,
                         NotificationDispatcher notifications,
                         Clock clock) {
        this.routing       = routing;
        this.workItems     = workItems;
        this.scheduler     = scheduler;
        this.notifications = notifications;
        this.clock         = clock;
    }

    public void processStep(WorkflowInstance instance, WorkflowStep step, String actor) {
        DocumentSnapshot document = routing.documentOf(instance);
        Set<String> assignees = routing.getStepAssignees(step, document, actor);
        instance.setCurrentAssignees(assignees);

        Instant now = clock.instant();
        Optional<Instant> deadline = step.deadlineFrom(now);
        Instant dueAt = deadline.orElse(now.plus(Duration.ofDays(1)));

        for (String assignee : assignees) {
            workItems.createWorkItem(new WorkItemRequest(
                    instance.getId(),
                    step.getStepName(),
                    assignee,
                    step.getStepName() + " - " + instance.getDocumentId(),
                    step.getDescription() != null ? step.getDescription() : "Workflow task for " + step.getStepName(),
                    REFERENCE_TYPE,
                    instance.getDocumentId(),
                    dueAt));
        }

        if (deadline.isPresent() && step.isNotifyOnTimeout()) {
            scheduler.scheduleTimeoutCheck(deadline.get(),
                    new TimeoutCheck(instance.getId(), step.getStepOrder(), step.getStepName()));
        }

        notifications.notifyStepAssigned(instance, step, assignees, deadline);

        instance.appendHistory(WorkflowHistoryEntry.action(STEP_PROCESSED, step.getStepName(), actor,
                "Step '" + step.getStepName() + "' processed with assignees: " + String.join(", ", assignees)));
        log.info("Instance {} processed step '{}' (order={}) with {} assignee(s)",
                instance.getId(), step.getStepName(), step.getStepOrder(), assignees.size());
    }
}
