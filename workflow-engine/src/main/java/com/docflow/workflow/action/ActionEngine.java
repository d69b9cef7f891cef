package com.docflow.workflow.action;

import com.docflow.workflow.exception.*;
import com.docflow.workflow.gateway.DocumentSnapshot;
import com.docflow.workflow.instance.StepProcessor;
import com.docflow.workflow.model.*;
import com.docflow.workflow.notification.NotificationDispatcher;
import com.docflow.workflow.repository.WorkflowInstanceRepository;
import com.docflow.workflow.routing.RoutingResolver;
import com.docflow.workflow.statemachine.WorkflowStateMachine;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;
import java.util.UUID;

/**
 * The five user actions: Approve, Reject, Request Changes, Forward and Skip.
 *
 * Each action runs in one transaction with the instance row locked:
 *  1. status and permission checks (nothing is changed when they fail)
 *  2. a history entry naming action, step, actor and comment
 *  3. the consequence (advance, go back, complete or reject)
 *  4. save, then notify the recipients computed from the new state
 *
 * Metric: {@code docflow.workflow.actions{action, outcome}}
 */
@Service
public class ActionEngine {

    private static final Logger log = LoggerFactory.getLogger(ActionEngine.class);

    private final WorkflowInstanceRepository instances;
    private final RoutingResolver            routing;
    private final WorkflowStateMachine       stateMachine;
    private final StepProcessor              stepProcessor;
    private final NotificationDispatcher     notifications;
    private final MeterRegistry              meterRegistry;

    public ActionEngine(WorkflowInstanceRepository instances,
                        RoutingResolver routing,
                        WorkflowStateMachine stateMachine,
                        StepProcessor stepProcessor,
                        NotificationDispatcher notifications,
                        MeterRegistry meterRegistry) {
        this.instances     = instances;
        this.routing       = routing;
        this.stateMachine  = stateMachine;
        this.stepProcessor = stepProcessor;
        this.notifications = notifications;
        this.meterRegistry = meterRegistry;
    }

    // ------------------------------------------------------------------
    // Entry points
    // ------------------------------------------------------------------

    /**
     * Execute an action by name: a built-in label ("Approve", "Request Changes", ...)
     * or the configured name of one of the current step's actions.
     *
     * @param targetStep Forward only: step order or step name to jump to; may be null
     */
    @Transactional
    public WorkflowInstance execute(UUID instanceId, String actionName, String actor,
                                    String comment, String targetStep) {
        WorkflowInstance instance = lock(instanceId);
        ActionType type = resolveType(instance, actionName);
        return perform(instance, type, actor, comment, targetStep);
    }

    @Transactional
    public WorkflowInstance approve(UUID instanceId, String actor, String comment) {
        return perform(lock(instanceId), ActionType.APPROVAL, actor, comment, null);
    }

    @Transactional
    public WorkflowInstance reject(UUID instanceId, String actor, String comment) {
        return perform(lock(instanceId), ActionType.REJECTION, actor, comment, null);
    }

    @Transactional
    public WorkflowInstance requestChanges(UUID instanceId, String actor, String comment) {
        return perform(lock(instanceId), ActionType.REQUEST_CHANGES, actor, comment, null);
    }

    @Transactional
    public WorkflowInstance forward(UUID instanceId, String actor, String targetStep, String comment) {
        return perform(lock(instanceId), ActionType.FORWARD, actor, comment, targetStep);
    }

    @Transactional
    public WorkflowInstance skip(UUID instanceId, String actor, String comment) {
        return perform(lock(instanceId), ActionType.SKIP, actor, comment, null);
    }

    // ------------------------------------------------------------------
    // Dispatch
    // ------------------------------------------------------------------

    WorkflowInstance perform(WorkflowInstance instance, ActionType type, String actor,
                             String comment, String targetStep) {
        String outcome = "success";
        try {
            switch (type) {
                case APPROVAL        -> doApprove(instance, actor, comment);
                case REJECTION       -> doReject(instance, actor, comment);
                case REQUEST_CHANGES -> doRequestChanges(instance, actor, comment);
                case FORWARD         -> doForward(instance, actor, targetStep, comment);
                case SKIP            -> doSkip(instance, actor, comment);
            }
            WorkflowInstance saved = instances.save(instance);
            notifications.notifyActionTaken(saved, type.label(), actor, comment);
            log.info("Instance {}: '{}' by {} -> status={}, step={}",
                    saved.getId(), type.label(), actor, saved.getStatus().label(), saved.getCurrentStep());
            return saved;
        } catch (UnauthorizedActionException e) {
            outcome = "denied";
            throw e;
        } catch (InvalidTransitionException | WorkflowValidationException e) {
            outcome = "invalid";
            throw e;
        } catch (RuntimeException e) {
            outcome = "error";
            throw e;
        } finally {
            meterRegistry.counter("docflow.workflow.actions",
                    "action", type.name().toLowerCase(), "outcome", outcome).increment();
        }
    }

    // ------------------------------------------------------------------
    // Actions
    // ------------------------------------------------------------------

    private void doApprove(WorkflowInstance instance, String actor, String comment) {
        requireInProgress(instance);
        WorkflowStep current = routing.currentStepOf(instance);
        DocumentSnapshot document = routing.documentOf(instance);
        requirePermitted(instance, current, ActionType.APPROVAL, actor, document);

        record(instance, ActionType.APPROVAL, current.getStepName(), actor, comment);
        Optional<WorkflowStep> next = routing.getNextStep(instance, current, ActionType.APPROVAL.label(), document);
        advanceOrComplete(instance, current, next, actor, comment);
    }

    private void doReject(WorkflowInstance instance, String actor, String comment) {
        stateMachine.assertCanTransition(instance, WorkflowStatus.REJECTED);
        WorkflowStep current = routing.currentStepOf(instance);
        DocumentSnapshot document = routing.documentOf(instance);
        requirePermitted(instance, current, ActionType.REJECTION, actor, document);

        record(instance, ActionType.REJECTION, current.getStepName(), actor, comment);
        stateMachine.transitionTo(instance, WorkflowStatus.REJECTED, actor, comment);
    }

    /**
     * Goes to the next step routed for "Request Changes"; when routing finds
     * none, back to the step one order below. On the first step only the
     * history entry is written.
     */
    private void doRequestChanges(WorkflowInstance instance, String actor, String comment) {
        requireInProgress(instance);
        WorkflowStep current = routing.currentStepOf(instance);
        DocumentSnapshot document = routing.documentOf(instance);
        requirePermitted(instance, current, ActionType.REQUEST_CHANGES, actor, document);

        record(instance, ActionType.REQUEST_CHANGES, current.getStepName(), actor, comment);
        Optional<WorkflowStep> target =
                routing.getNextStep(instance, current, ActionType.REQUEST_CHANGES.label(), document);

        if (target.isEmpty() && instance.getCurrentStep() > 1) {
            target = instance.getDefinition().stepByOrder(instance.getCurrentStep() - 1);
        }
        if (target.isEmpty()) {
            log.info("Instance {}: changes requested on first step '{}', nothing to return to",
                    instance.getId(), current.getStepName());
            return;
        }
        instance.setCurrentStep(target.get().getStepOrder());
        stepProcessor.processStep(instance, target.get(), actor);
    }

    private void doForward(WorkflowInstance instance, String actor, String targetStep, String comment) {
        requireInProgress(instance);
        WorkflowStep current = routing.currentStepOf(instance);
        DocumentSnapshot document = routing.documentOf(instance);
        requirePermitted(instance, current, ActionType.FORWARD, actor, document);

        WorkflowStep target;
        if (targetStep != null && !targetStep.isBlank()) {
            target = findStep(instance.getDefinition(), targetStep)
                    .orElseThrow(() -> new WorkflowValidationException("Target step not found: " + targetStep));
        } else {
            target = routing.getNextStep(instance, current, ActionType.FORWARD.label(), document)
                    .orElseThrow(() -> new WorkflowValidationException("No target step found for forward action"));
        }

        record(instance, ActionType.FORWARD, current.getStepName() + " -> " + target.getStepName(), actor, comment);
        advanceOrComplete(instance, current, Optional.of(target), actor, comment);
    }

    private void doSkip(WorkflowInstance instance, String actor, String comment) {
        requireInProgress(instance);
        WorkflowStep current = routing.currentStepOf(instance);
        if (!current.isAllowSkip()) {
            throw new UnauthorizedActionException("Step '" + current.getStepName() + "' cannot be skipped");
        }
        DocumentSnapshot document = routing.documentOf(instance);
        requirePermitted(instance, current, ActionType.SKIP, actor, document);

        record(instance, ActionType.SKIP, current.getStepName(), actor, comment);
        Optional<WorkflowStep> next = routing.getNextStep(instance, current, ActionType.SKIP.label(), document);
        advanceOrComplete(instance, current, next, actor, comment);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /** No next step, or an End step, completes the workflow; anything else becomes the live step. */
    private void advanceOrComplete(WorkflowInstance instance, WorkflowStep current, Optional<WorkflowStep> next,
                                   String actor, String comment) {
        if (next.isEmpty() || next.get().isEnd()) {
            next.ifPresent(end -> instance.setCurrentStep(end.getStepOrder()));
            stateMachine.transitionTo(instance, WorkflowStatus.COMPLETED, actor, comment);
            return;
        }
        WorkflowStep step = next.get();
        instance.setCurrentStep(step.getStepOrder());
        stepProcessor.processStep(instance, step, actor);
        notifications.notifyStepCompleted(instance, current, step, actor, comment);
    }

    private void requireInProgress(WorkflowInstance instance) {
        if (instance.getStatus() != WorkflowStatus.IN_PROGRESS) {
            throw new InvalidTransitionException(instance.getStatus(),
                    "Workflow is " + instance.getStatus().label() + ", actions require In Progress");
        }
    }

    /**
     * The actor must be able to act on the step and hold at least one
     * allowed action of the given type configured on it.
     */
    private void requirePermitted(WorkflowInstance instance, WorkflowStep step, ActionType type,
                                  String actor, DocumentSnapshot document) {
        boolean permitted = routing.canActOnStep(instance, step, actor, document)
                && step.actionsOfType(type).stream().anyMatch(a -> routing.isActionAllowed(a, actor, document));
        if (!permitted) {
            throw new UnauthorizedActionException("You are not allowed to perform '" + type.label()
                    + "' on step '" + step.getStepName() + "'");
        }
    }

    private static void record(WorkflowInstance instance, ActionType type, String step, String actor, String comment) {
        instance.appendHistory(WorkflowHistoryEntry.action(type.label(), step, actor, comment));
    }

    private static Optional<WorkflowStep> findStep(WorkflowDefinition definition, String ref) {
        String trimmed = ref.trim();
        if (trimmed.chars().allMatch(Character::isDigit)) {
            try {
                return definition.stepByOrder(Integer.parseInt(trimmed));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return definition.stepByName(trimmed);
    }

    private ActionType resolveType(WorkflowInstance instance, String actionName) {
        return ActionType.fromName(actionName)
                .or(() -> instance.getDefinition().stepByOrder(instance.getCurrentStep())
                        .flatMap(step -> step.actionNamed(actionName))
                        .map(StepAction::getActionType))
                .orElseThrow(() -> new WorkflowValidationException("Invalid action: " + actionName));
    }

    private WorkflowInstance lock(UUID instanceId) {
        return instances.findByIdForUpdate(instanceId)
                .orElseThrow(() -> new WorkflowNotFoundException("Workflow instance", instanceId));
    }
}
