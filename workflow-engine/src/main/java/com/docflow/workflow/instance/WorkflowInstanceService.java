package com.docflow.workflow.instance;

import com.docflow.workflow.action.ActionEngine;
import com.docflow.workflow.exception.*;
import com.docflow.workflow.gateway.*;
import com.docflow.workflow.model.*;
import com.docflow.workflow.notification.NotificationDispatcher;
import com.docflow.workflow.notification.SummaryLine;
import com.docflow.workflow.repository.WorkflowDefinitionRepository;
import com.docflow.workflow.repository.WorkflowInstanceRepository;
import com.docflow.workflow.routing.RoutingResolver;
import com.docflow.workflow.statemachine.WorkflowStateMachine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;

/**
 * Entry point for everything that happens to workflow instances:
 * starting, user actions, lifecycle operations and read queries.
 *
 * Mutating methods lock the instance row for the whole transaction.
 * Queries read without locking.
 */
@Service
public class WorkflowInstanceService {

    private static final Logger log = LoggerFactory.getLogger(WorkflowInstanceService.class);

    public static final String WORKFLOW_STARTED = "Workflow Started";
    public static final String STEP_REASSIGNED  = "Step Reassigned";

    private static final List<WorkflowStatus> ACTIVE =
            List.of(WorkflowStatus.PENDING, WorkflowStatus.IN_PROGRESS, WorkflowStatus.ON_HOLD);

    private final WorkflowInstanceRepository   instances;
    private final WorkflowDefinitionRepository definitions;
    private final DocumentGateway              documents;
    private final IdentityDirectory            identity;
    private final WorkItemService              workItems;
    private final RoutingResolver              routing;
    private final WorkflowStateMachine         stateMachine;
    private final ActionEngine                 actionEngine;
    private final NotificationDispatcher       notifications;
    private final Clock                        clock;

    public WorkflowInstanceService(WorkflowInstanceRepository instances,
                                   WorkflowDefinitionRepository definitions,
                                   DocumentGateway documents,
                                   IdentityDirectory identity,
                                   WorkItemService workItems,
                                   RoutingResolver routing,
                                   WorkflowStateMachine stateMachine,
                                   ActionEngine actionEngine,
                                   NotificationDispatcher notifications,
                                   Clock clock) {
        this.instances     = instances;
        this.definitions   = definitions;
        this.documents     = documents;
        this.identity      = identity;
        this.workItems     = workItems;
        this.routing       = routing;
        this.stateMachine  = stateMachine;
        this.actionEngine  = actionEngine;
        this.notifications = notifications;
        this.clock         = clock;
    }

    // ------------------------------------------------------------------
    // Start
    // ------------------------------------------------------------------

    /**
     * Start a workflow for a document.
     *
     * Definition choice: the named one, else the active default for the
     * document type, else the first active definition of that type whose
     * conditions match the document. The instance is created in Pending on
     * step 1 and immediately moved to In Progress, which processes the
     * Start step.
     */
    @Transactional
    public WorkflowInstance startWorkflow(String documentId, String definitionName, String actor) {
        DocumentSnapshot document = documents.find(documentId)
                .orElseThrow(() -> new WorkflowNotFoundException("Document", documentId));

        WorkflowDefinition definition = chooseDefinition(document, definitionName);
        if (!definition.isActive()) {
            throw new WorkflowValidationException("Workflow definition " + definition.getName() + " is not active");
        }
        if (!definition.getPermissions().isEmpty()
                && !definition.permits(identity.rolesOf(actor), PermissionType.START)) {
            throw new UnauthorizedActionException(actor + " may not start workflow " + definition.getName());
        }
        if (instances.existsByDocumentIdAndStatusIn(documentId, ACTIVE)) {
            throw new ActiveInstanceExistsException(documentId);
        }

        WorkflowInstance instance = new WorkflowInstance(definition, documentId, actor);
        instance.setStatus(WorkflowStatus.PENDING);
        instance.setStartedOn(clock.instant());
        instance.appendHistory(WorkflowHistoryEntry.action(WORKFLOW_STARTED, null, actor,
                "Workflow " + definition.getName() + " started for document " + documentId));
        instance = instances.save(instance);

        stateMachine.transitionTo(instance, WorkflowStatus.IN_PROGRESS, actor, null);
        instance = instances.save(instance);
        log.info("Started workflow '{}' for document {} (instance={}, by={})",
                definition.getName(), documentId, instance.getId(), actor);
        return instance;
    }

    private WorkflowDefinition chooseDefinition(DocumentSnapshot document, String definitionName) {
        if (definitionName != null && !definitionName.isBlank()) {
            return definitions.findByName(definitionName)
                    .orElseThrow(() -> new WorkflowNotFoundException("Workflow definition", definitionName));
        }
        return definitions.findFirstByDocumentTypeAndDefaultForTypeTrueAndActiveTrue(document.documentType())
                .or(() -> definitions.findByDocumentTypeAndActiveTrueOrderByCreatedAtAsc(document.documentType())
                        .stream()
                        .filter(d -> routing.definitionApplies(d, document))
                        .findFirst())
                .orElseThrow(() -> new WorkflowNotFoundException(
                        "Workflow definition for document", document.documentId()));
    }

    // ------------------------------------------------------------------
    // Actions and lifecycle
    // ------------------------------------------------------------------

    public WorkflowInstance executeAction(UUID instanceId, String actionName, String actor,
                                          String comment, String targetStep) {
        return actionEngine.execute(instanceId, actionName, actor, comment, targetStep);
    }

    @Transactional
    public WorkflowInstance cancel(UUID instanceId, String actor, String reason) {
        WorkflowInstance instance = lock(instanceId);
        requireManager(instance, actor);
        stateMachine.transitionTo(instance, WorkflowStatus.CANCELLED, actor, reason);
        return instances.save(instance);
    }

    @Transactional
    public WorkflowInstance hold(UUID instanceId, String actor, String reason) {
        WorkflowInstance instance = lock(instanceId);
        requireManager(instance, actor);
        stateMachine.transitionTo(instance, WorkflowStatus.ON_HOLD, actor, reason);
        return instances.save(instance);
    }

    @Transactional
    public WorkflowInstance resume(UUID instanceId, String actor, String comment) {
        WorkflowInstance instance = lock(instanceId);
        requireManager(instance, actor);
        if (instance.getStatus() != WorkflowStatus.ON_HOLD) {
            throw new InvalidTransitionException(instance.getStatus(), "Only an On Hold workflow can be resumed");
        }
        stateMachine.transitionTo(instance, WorkflowStatus.IN_PROGRESS, actor, comment);
        return instances.save(instance);
    }

    /** Rejected -> Pending -> In Progress, starting again from the Start step. */
    @Transactional
    public WorkflowInstance resubmit(UUID instanceId, String actor, String comment) {
        WorkflowInstance instance = lock(instanceId);
        requireManager(instance, actor);
        if (instance.getStatus() != WorkflowStatus.REJECTED) {
            throw new InvalidTransitionException(instance.getStatus(), "Only a Rejected workflow can be resubmitted");
        }
        if (instances.existsByDocumentIdAndStatusIn(instance.getDocumentId(), ACTIVE)) {
            throw new ActiveInstanceExistsException(instance.getDocumentId());
        }
        stateMachine.transitionTo(instance, WorkflowStatus.PENDING, actor, comment);
        stateMachine.transitionTo(instance, WorkflowStatus.IN_PROGRESS, actor, null);
        return instances.save(instance);
    }

    /**
     * Add an assignee to the current step. The existing assignees keep
     * their work items.
     */
    @Transactional
    public WorkflowInstance reassign(UUID instanceId, String newAssignee, String actor, String comment) {
        WorkflowInstance instance = lock(instanceId);
        if (instance.getStatus() != WorkflowStatus.IN_PROGRESS) {
            throw new InvalidTransitionException(instance.getStatus(), "Only an In Progress workflow can be reassigned");
        }
        if (!identity.userExists(newAssignee)) {
            throw new WorkflowValidationException("Unknown user: " + newAssignee);
        }
        WorkflowStep step = routing.currentStepOf(instance);
        if (!isManager(instance, actor) && !routing.canActOnStep(instance, step, actor, routing.documentOf(instance))) {
            throw new UnauthorizedActionException(actor + " may not reassign step '" + step.getStepName() + "'");
        }

        instance.getCurrentAssignees().add(newAssignee);
        Instant now = clock.instant();
        workItems.createWorkItem(new WorkItemRequest(instance.getId(), step.getStepName(), newAssignee,
                step.getStepName() + " - " + instance.getDocumentId(),
                step.getDescription() != null ? step.getDescription() : "Workflow task for " + step.getStepName(),
                "Document", instance.getDocumentId(),
                step.deadlineFrom(now).orElse(now.plus(Duration.ofDays(1)))));
        instance.appendHistory(WorkflowHistoryEntry.action(STEP_REASSIGNED, step.getStepName(), actor,
                comment != null && !comment.isBlank() ? comment
                        : "Step '" + step.getStepName() + "' reassigned to " + newAssignee));
        WorkflowInstance saved = instances.save(instance);
        notifications.notifyStepReassigned(saved, step, newAssignee, actor);
        log.info("Instance {} step '{}' reassigned to {} by {}", instanceId, step.getStepName(), newAssignee, actor);
        return saved;
    }

    /**
     * Remind the current step's assignees of the deadline, one day ahead.
     *
     * @return false when the step has no deadline or it is less than a day away
     */
    @Transactional(readOnly = true)
    public boolean sendReminder(UUID instanceId) {
        WorkflowInstance instance = get(instanceId);
        if (instance.getStatus() != WorkflowStatus.IN_PROGRESS) return false;
        WorkflowStep step = routing.currentStepOf(instance);

        Instant assignedAt = instance.getHistory().stream()
                .filter(h -> StepProcessor.STEP_PROCESSED.equals(h.getAction()))
                .filter(h -> step.getStepName().equals(h.getStep()))
                .map(WorkflowHistoryEntry::getRecordedAt)
                .reduce((first, second) -> second)
                .orElse(instance.getStartedOn());
        if (assignedAt == null) return false;

        Optional<Instant> deadline = step.deadlineFrom(assignedAt);
        if (deadline.isEmpty()) return false;
        long daysUntilTimeout = Duration.between(clock.instant(), deadline.get()).toDays() - 1;
        if (daysUntilTimeout <= 0) return false;

        notifications.sendReminder(instance, step, daysUntilTimeout);
        return true;
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    @Transactional(readOnly = true)
    public WorkflowInstance get(UUID instanceId) {
        return instances.findById(instanceId)
                .orElseThrow(() -> new WorkflowNotFoundException("Workflow instance", instanceId));
    }

    /** Latest instance for the document, if any. */
    @Transactional(readOnly = true)
    public Optional<WorkflowInstance> statusForDocument(String documentId) {
        return instances.findByDocumentIdOrderByCreatedAtDesc(documentId).stream().findFirst();
    }

    @Transactional(readOnly = true)
    public List<String> availableActions(UUID instanceId, String user) {
        return routing.getAvailableActions(get(instanceId), user).stream()
                .map(StepAction::getActionName)
                .toList();
    }

    /** Every In Progress instance where the user has at least one action available. */
    @Transactional(readOnly = true)
    public List<PendingAction> pendingActions(String user) {
        List<PendingAction> pending = new ArrayList<>();
        for (WorkflowInstance instance : instances.findByStatus(WorkflowStatus.IN_PROGRESS)) {
            try {
                List<String> actions = routing.getAvailableActions(instance, user).stream()
                        .map(StepAction::getActionName)
                        .toList();
                if (!actions.isEmpty()) {
                    String step = routing.currentStepOf(instance).getStepName();
                    pending.add(new PendingAction(instance, step, actions));
                }
            } catch (WorkflowException e) {
                log.warn("Skipping instance {} in pending actions for {}: {}", instance.getId(), user, e.getMessage());
            }
        }
        return pending;
    }

    @Transactional(readOnly = true)
    public List<WorkflowHistoryEntry> history(UUID instanceId) {
        return List.copyOf(get(instanceId).getHistory());
    }

    /** Creation followed by every state change, oldest first. */
    @Transactional(readOnly = true)
    public List<TimelineEvent> timeline(UUID instanceId) {
        WorkflowInstance instance = get(instanceId);
        List<TimelineEvent> events = new ArrayList<>();
        events.add(new TimelineEvent(instance.getCreatedAt(), "Workflow Created", instance.getStartedBy(),
                "Workflow " + instance.getId() + " created for document " + instance.getDocumentId()));
        for (WorkflowHistoryEntry entry : instance.getHistory()) {
            if (!entry.isStateTransition()) continue;
            String from = entry.getFromState().label();
            String to   = entry.getToState().label();
            events.add(new TimelineEvent(entry.getRecordedAt(), "State Changed: " + from + " -> " + to,
                    entry.getActor(),
                    entry.getComment() != null && !entry.getComment().isBlank()
                            ? entry.getComment()
                            : "Workflow state changed from " + from + " to " + to));
        }
        events.sort(Comparator.comparing(TimelineEvent::timestamp));
        return events;
    }

    @Transactional(readOnly = true)
    public List<WorkflowStep> path(UUID instanceId) {
        return routing.getWorkflowPath(get(instanceId));
    }

    @Transactional(readOnly = true)
    public Set<String> participants(UUID instanceId) {
        return notifications.participants(get(instanceId));
    }

    /** Counts by status, overall and per definition; optionally limited to one document type. */
    @Transactional(readOnly = true)
    public WorkflowStatistics statistics(String documentType) {
        List<WorkflowInstance> all = instances.findAll().stream()
                .filter(i -> documentType == null || documentType.equals(i.getDefinition().getDocumentType()))
                .toList();

        Map<String, List<WorkflowInstance>> byDefinition = new TreeMap<>();
        for (WorkflowInstance i : all) {
            byDefinition.computeIfAbsent(i.getDefinition().getName(), k -> new ArrayList<>()).add(i);
        }
        Map<String, StatusCounts> perDefinition = new LinkedHashMap<>();
        byDefinition.forEach((name, list) -> perDefinition.put(name, count(list)));
        return new WorkflowStatistics(count(all), perDefinition);
    }

    /** Lines for a user's daily summary: active instances whose current step the user can act on. */
    @Transactional(readOnly = true)
    public List<SummaryLine> dailySummaryFor(String user) {
        List<SummaryLine> lines = new ArrayList<>();
        for (WorkflowInstance instance : instances.findByStatusIn(
                List.of(WorkflowStatus.PENDING, WorkflowStatus.IN_PROGRESS))) {
            Optional<WorkflowStep> step = instance.getDefinition().stepByOrder(instance.getCurrentStep());
            if (step.isEmpty()) continue;
            Optional<DocumentSnapshot> document = documents.find(instance.getDocumentId());
            if (document.isPresent() && routing.canActOnStep(instance, step.get(), user, document.get())) {
                lines.add(new SummaryLine(instance.getDocumentId(), instance.getDefinition().getName(),
                        step.get().getStepName(), instance.getStatus().label()));
            }
        }
        return lines;
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static StatusCounts count(List<WorkflowInstance> list) {
        Map<WorkflowStatus, Long> counts = new EnumMap<>(WorkflowStatus.class);
        for (WorkflowInstance i : list) counts.merge(i.getStatus(), 1L, Long::sum);
        return new StatusCounts(list.size(), counts);
    }

    /** Starter, or holder of the definition's write or admin permission. */
    private boolean isManager(WorkflowInstance instance, String actor) {
        if (actor == null) return false;
        if (actor.equals(instance.getStartedBy())) return true;
        Set<String> roles = identity.rolesOf(actor);
        WorkflowDefinition definition = instance.getDefinition();
        return definition.permits(roles, PermissionType.ADMIN) || definition.permits(roles, PermissionType.WRITE);
    }

    private void requireManager(WorkflowInstance instance, String actor) {
        if (!isManager(instance, actor)) {
            throw new UnauthorizedActionException(actor + " may not manage workflow instance " + instance.getId());
        }
    }

    private WorkflowInstance lock(UUID instanceId) {
        return instances.findByIdForUpdate(instanceId)
                .orElseThrow(() -> new WorkflowNotFoundException("Workflow instance", instanceId));
    }
}
