package com.docflow.workflow.notification;

import com.docflow.workflow.exception.NotificationDeliveryException;
import com.docflow.workflow.gateway.CommentDirectory;
import com.docflow.workflow.gateway.DocumentSnapshot;
import com.docflow.workflow.gateway.IdentityDirectory;
import com.docflow.workflow.gateway.NotificationTransport;
import com.docflow.workflow.instance.WorkflowStatistics;
import com.docflow.workflow.model.*;
import com.docflow.workflow.routing.RoutingResolver;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.*;

/**
 * Composes workflow notifications and delivers them to computed recipient sets.
 *
 * Delivery is fire-and-forget relative to the workflow operation that
 * triggered it: every failure (recipient resolution included) is logged,
 * counted and swallowed, never rethrown.
 *
 * Metric: {@code docflow.notifications{event, status="sent|skipped|failed"}}
 */
@Component
public class NotificationDispatcher {

    private static final Logger log = LoggerFactory.getLogger(NotificationDispatcher.class);

    static final String REFERENCE_TYPE = "Workflow Instance";

    private final NotificationTransport transport;
    private final RoutingResolver       routing;
    private final IdentityDirectory     identity;
    private final CommentDirectory      comments;
    private final MeterRegistry         meterRegistry;
    private final String                escalationRole;

    public NotificationDispatcher(NotificationTransport transport,
                                  RoutingResolver routing,
                                  IdentityDirectory identity,
                                  CommentDirectory comments,
                                  MeterRegistry meterRegistry,
                                  @Value("${docflow.notifications.escalation-role:System Manager}") String escalationRole) {
        this.transport      = transport;
        this.routing        = routing;
        this.identity       = identity;
        this.comments       = comments;
        this.meterRegistry  = meterRegistry;
        this.escalationRole = escalationRole;
    }

    // ------------------------------------------------------------------
    // Lifecycle events
    // ------------------------------------------------------------------

    public void notifyWorkflowStarted(WorkflowInstance instance) {
        deliver(instance, WorkflowMessages.started(instance), () -> setOf(instance.getStartedBy()));
    }

    public void notifyStepAssigned(WorkflowInstance instance, WorkflowStep step,
                                   Collection<String> assignees, Optional<Instant> deadline) {
        deliver(instance, WorkflowMessages.stepAssigned(instance, step, deadline), () -> new LinkedHashSet<>(assignees));
    }

    /** Tells the starter that a step finished and which step is up next. */
    public void notifyStepCompleted(WorkflowInstance instance, WorkflowStep completed, WorkflowStep next,
                                    String actor, String comment) {
        deliver(instance, WorkflowMessages.stepCompleted(instance, completed, next, actor, comment),
                () -> without(setOf(instance.getStartedBy()), actor));
    }

    public void notifyWorkflowCompleted(WorkflowInstance instance) {
        deliver(instance, WorkflowMessages.completed(instance), () -> participants(instance));
    }

    public void notifyWorkflowRejected(WorkflowInstance instance, String actor, String comment) {
        deliver(instance, WorkflowMessages.rejected(instance, actor, comment), () -> participants(instance));
    }

    public void notifyWorkflowCancelled(WorkflowInstance instance, String actor, String comment) {
        deliver(instance, WorkflowMessages.cancelled(instance, actor, comment), () -> participants(instance));
    }

    public void notifyWorkflowOnHold(WorkflowInstance instance, String actor, String comment) {
        deliver(instance, WorkflowMessages.onHold(instance, actor, comment), () -> currentStepAssignees(instance));
    }

    public void notifyWorkflowResumed(WorkflowInstance instance, String actor) {
        deliver(instance, WorkflowMessages.resumed(instance, actor), () -> setOf(instance.getStartedBy()));
    }

    public void notifyStepReassigned(WorkflowInstance instance, WorkflowStep step, String newAssignee, String actor) {
        deliver(instance, WorkflowMessages.reassigned(instance, step, actor), () -> setOf(newAssignee));
    }

    /** Action notice to {@link #getActionRecipients}, composed from the instance's state after the action. */
    public void notifyActionTaken(WorkflowInstance instance, String action, String actor, String comment) {
        String stepName = instance.getDefinition().stepByOrder(instance.getCurrentStep())
                .map(WorkflowStep::getStepName).orElse("-");
        deliver(instance, WorkflowMessages.actionTaken(instance, action, actor, comment, stepName),
                () -> getActionRecipients(instance, action, actor));
    }

    // ------------------------------------------------------------------
    // Timeouts, escalation, reminders
    // ------------------------------------------------------------------

    /** Timeout notice to the step's assignees and the starter, then escalation when the step has escalation days. */
    public void notifyStepTimeout(WorkflowInstance instance, WorkflowStep step) {
        deliver(instance, WorkflowMessages.stepTimeout(instance, step), () -> {
            Set<String> recipients = stepAssignees(instance, step);
            recipients.addAll(setOf(instance.getStartedBy()));
            return recipients;
        });
        if (step.getEscalationDays() != null && step.getEscalationDays() > 0) {
            escalate(instance, step);
        }
    }

    public void escalate(WorkflowInstance instance, WorkflowStep step) {
        deliver(instance, WorkflowMessages.escalation(instance, step),
                () -> new LinkedHashSet<>(identity.usersWithRole(escalationRole)));
    }

    public void sendReminder(WorkflowInstance instance, WorkflowStep step, long daysUntilTimeout) {
        deliver(instance, WorkflowMessages.reminder(instance, step, daysUntilTimeout),
                () -> stepAssignees(instance, step));
    }

    // ------------------------------------------------------------------
    // Summaries
    // ------------------------------------------------------------------

    public void sendDailySummary(String user, List<SummaryLine> lines) {
        if (lines.isEmpty()) return;
        deliver(null, WorkflowMessages.dailySummary(lines), () -> setOf(user));
    }

    public void sendDigest(String role, String frequency, WorkflowStatistics statistics) {
        deliver(null, WorkflowMessages.digest(frequency, statistics),
                () -> new LinkedHashSet<>(identity.usersWithRole(role)));
    }

    // ------------------------------------------------------------------
    // Recipients
    // ------------------------------------------------------------------

    /**
     * Starter (unless they are the actor), the assignees of the step the
     * action leads to from the current step, and for Reject / Request
     * Changes the assignees of the preceding step. The actor is never a
     * recipient.
     */
    public Set<String> getActionRecipients(WorkflowInstance instance, String action, String actor) {
        Set<String> recipients = new LinkedHashSet<>(setOf(instance.getStartedBy()));
        WorkflowDefinition definition = instance.getDefinition();
        Optional<WorkflowStep> current = definition.stepByOrder(instance.getCurrentStep());
        if (current.isPresent()) {
            DocumentSnapshot document = routing.documentOf(instance);
            routing.getNextStep(instance, current.get(), action, document)
                    .ifPresent(next -> recipients.addAll(routing.getStepAssignees(next, document, actor)));

            if (isReturnAction(action)) {
                definition.stepByOrder(instance.getCurrentStep() - 1)
                        .ifPresent(prev -> recipients.addAll(routing.getStepAssignees(prev, document, actor)));
            }
        }
        return without(recipients, actor);
    }

    /** Starter, every user named in the history, and everyone who commented. */
    public Set<String> participants(WorkflowInstance instance) {
        Set<String> participants = new LinkedHashSet<>(setOf(instance.getStartedBy()));
        instance.getHistory().stream()
                .map(WorkflowHistoryEntry::getActor)
                .filter(Objects::nonNull)
                .forEach(participants::add);
        if (instance.getId() != null) {
            participants.addAll(comments.commentersOf(instance.getId()));
        }
        return participants;
    }

    private static boolean isReturnAction(String action) {
        return ActionType.fromName(action)
                .map(t -> t == ActionType.REJECTION || t == ActionType.REQUEST_CHANGES)
                .orElse(false);
    }

    private Set<String> currentStepAssignees(WorkflowInstance instance) {
        return instance.getDefinition().stepByOrder(instance.getCurrentStep())
                .map(step -> stepAssignees(instance, step))
                .orElseGet(LinkedHashSet::new);
    }

    private Set<String> stepAssignees(WorkflowInstance instance, WorkflowStep step) {
        Set<String> assignees = new LinkedHashSet<>();
        if (instance.getCurrentStep() == step.getStepOrder()) {
            assignees.addAll(instance.getCurrentAssignees());
        }
        assignees.addAll(routing.getStepAssignees(step, routing.documentOf(instance), null));
        return assignees;
    }

    private static Set<String> setOf(String user) {
        Set<String> set = new LinkedHashSet<>();
        if (user != null && !user.isBlank()) set.add(user);
        return set;
    }

    private static Set<String> without(Set<String> recipients, String actor) {
        if (actor != null) recipients.remove(actor);
        return recipients;
    }

    // ------------------------------------------------------------------
    // Delivery
    // ------------------------------------------------------------------

    @FunctionalInterface
    private interface Recipients {
        Set<String> resolve();
    }

    private void deliver(WorkflowInstance instance, WorkflowNotice notice, Recipients recipients) {
        String status = "sent";
        try {
            Set<String> to = recipients.resolve();
            if (to.isEmpty()) {
                status = "skipped";
                log.debug("No recipients for {} notification", notice.event().tag());
                return;
            }
            send(instance, notice, to);
            log.info("Sent {} notification to {} recipient(s)", notice.event().tag(), to.size());
        } catch (Exception e) {
            status = "failed";
            log.warn("Could not deliver {} notification{}: {}", notice.event().tag(),
                    instance == null ? "" : " for instance " + instance.getId(), e.getMessage());
        } finally {
            meterRegistry.counter("docflow.notifications",
                    "event", notice.event().tag(), "status", status).increment();
        }
    }

    private void send(WorkflowInstance instance, WorkflowNotice notice, Set<String> to) {
        String refType = instance == null ? null : REFERENCE_TYPE;
        String refId   = instance == null || instance.getId() == null ? null : instance.getId().toString();
        try {
            transport.send(to, notice.subject(), notice.body(), refType, refId);
            for (String recipient : to) {
                transport.appendInAppLog(recipient, notice.type(), notice.subject(), notice.body(), refType, refId);
            }
        } catch (RuntimeException e) {
            throw new NotificationDeliveryException("Delivery of '" + notice.subject() + "' failed", e);
        }
    }
}
