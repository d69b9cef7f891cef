package com.docflow.workflow.statemachine;

import com.docflow.workflow.exception.InconsistentStateException;
import com.docflow.workflow.exception.InvalidTransitionException;
import com.docflow.workflow.gateway.DocumentGateway;
import com.docflow.workflow.instance.StepProcessor;
import com.docflow.workflow.model.WorkflowHistoryEntry;
import com.docflow.workflow.model.WorkflowInstance;
import com.docflow.workflow.model.WorkflowStatus;
import com.docflow.workflow.model.WorkflowStep;
import com.docflow.workflow.notification.NotificationDispatcher;
import com.docflow.workflow.routing.RoutingResolver;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static com.docflow.workflow.model.WorkflowStatus.*;

/**
 * Owns the instance lifecycle.
 *
 * <pre>
 *   Draft       -> Pending, Cancelled
 *   Pending     -> In Progress, Cancelled
 *   In Progress -> Completed, Rejected, On Hold, Cancelled
 *   On Hold     -> In Progress, Cancelled
 *   Completed   -> (terminal)
 *   Rejected    -> Pending, Cancelled
 *   Cancelled   -> Draft
 * </pre>
 *
 * A rejected transition throws before anything on the instance changes.
 * The caller holds the instance lock and saves the instance afterwards.
 */
@Component
public class WorkflowStateMachine {

    private static final Logger log = LoggerFactory.getLogger(WorkflowStateMachine.class);

    private static final Map<WorkflowStatus, Set<WorkflowStatus>> TRANSITIONS = new EnumMap<>(WorkflowStatus.class);

    static {
        TRANSITIONS.put(DRAFT,       EnumSet.of(PENDING, CANCELLED));
        TRANSITIONS.put(PENDING,     EnumSet.of(IN_PROGRESS, CANCELLED));
        TRANSITIONS.put(IN_PROGRESS, EnumSet.of(COMPLETED, REJECTED, ON_HOLD, CANCELLED));
        TRANSITIONS.put(ON_HOLD,     EnumSet.of(IN_PROGRESS, CANCELLED));
        TRANSITIONS.put(COMPLETED,   EnumSet.noneOf(WorkflowStatus.class));
        TRANSITIONS.put(REJECTED,    EnumSet.of(PENDING, CANCELLED));
        TRANSITIONS.put(CANCELLED,   EnumSet.of(DRAFT));
    }

    private final StepProcessor          stepProcessor;
    private final RoutingResolver        routing;
    private final DocumentGateway        documents;
    private final NotificationDispatcher notifications;
    private final MeterRegistry          meterRegistry;
    private final Clock                  clock;

    public WorkflowStateMachine(StepProcessor stepProcessor,
                                RoutingResolver routing,
                                DocumentGateway documents,
                                NotificationDispatcher notifications,
                                MeterRegistry meterRegistry,
                                Clock clock) {
        this.stepProcessor = stepProcessor;
        this.routing       = routing;
        this.documents     = documents;
        this.notifications = notifications;
        this.meterRegistry = meterRegistry;
        this.clock         = clock;
    }

    public static Set<WorkflowStatus> validTransitionsFrom(WorkflowStatus from) {
        return Collections.unmodifiableSet(TRANSITIONS.get(from));
    }

    public static boolean canTransition(WorkflowStatus from, WorkflowStatus to) {
        return TRANSITIONS.get(from).contains(to);
    }

    /** @throws InvalidTransitionException when the table does not allow the instance's status to move to {@code to} */
    public void assertCanTransition(WorkflowInstance instance, WorkflowStatus to) {
        if (!canTransition(instance.getStatus(), to)) {
            throw new InvalidTransitionException(instance.getStatus(), to);
        }
    }

    // ------------------------------------------------------------------
    // Transition
    // ------------------------------------------------------------------

    public void transitionTo(WorkflowInstance instance, WorkflowStatus to, String actor, String comment) {
        WorkflowStatus from = instance.getStatus();
        assertCanTransition(instance, to);

        instance.appendHistory(WorkflowHistoryEntry.stateTransition(from, to, actor, comment));
        instance.setStatus(to);

        if (to.isTerminal()) {
            if (instance.getCompletedBy() == null) {
                instance.setCompletedBy(actor);
                instance.setCompletedOn(clock.instant());
            }
        } else if (from.isTerminal()) {
            // re-opened
            instance.setCompletedBy(null);
            instance.setCompletedOn(null);
        }

        meterRegistry.counter("docflow.workflow.transitions", "to", to.name().toLowerCase()).increment();
        log.info("Instance {} {} -> {} by {}", instance.getId(), from.label(), to.label(), actor);

        onEnter(instance, from, to, actor, comment);
    }

    // ------------------------------------------------------------------
    // State-entry side effects
    // ------------------------------------------------------------------

    private void onEnter(WorkflowInstance instance, WorkflowStatus from, WorkflowStatus to,
                         String actor, String comment) {
        switch (to) {
            case IN_PROGRESS -> {
                if (from == ON_HOLD) resume(instance, actor);
                else start(instance, actor);
            }
            case COMPLETED -> {
                instance.getCurrentAssignees().clear();
                documents.updateStatus(instance.getDocumentId(), "Approved");
                notifications.notifyWorkflowCompleted(instance);
            }
            case REJECTED -> {
                instance.getCurrentAssignees().clear();
                documents.updateStatus(instance.getDocumentId(), "Rejected");
                notifications.notifyWorkflowRejected(instance, actor, comment);
            }
            case CANCELLED -> {
                instance.getCurrentAssignees().clear();
                documents.updateStatus(instance.getDocumentId(), "Cancelled");
                notifications.notifyWorkflowCancelled(instance, actor, comment);
            }
            case ON_HOLD -> notifications.notifyWorkflowOnHold(instance, actor, comment);
            case DRAFT, PENDING -> { }
        }
    }

    private void start(WorkflowInstance instance, String actor) {
        WorkflowStep startStep = instance.getDefinition().startStep()
                .orElseThrow(() -> new InconsistentStateException(
                        "Workflow definition " + instance.getDefinition().getName() + " has no Start step"));
        if (instance.getStartedOn() == null) {
            instance.setStartedOn(clock.instant());
        }
        instance.setCurrentStep(startStep.getStepOrder());
        stepProcessor.processStep(instance, startStep, actor);
        notifications.notifyWorkflowStarted(instance);
    }

    private void resume(WorkflowInstance instance, String actor) {
        WorkflowStep current = routing.currentStepOf(instance);
        stepProcessor.processStep(instance, current, actor);
        notifications.notifyWorkflowResumed(instance, actor);
    }
}
