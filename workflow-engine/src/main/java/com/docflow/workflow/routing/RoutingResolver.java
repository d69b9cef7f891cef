package com.docflow.workflow.routing;

import com.docflow.workflow.assignee.DynamicAssigneeRegistry;
import com.docflow.workflow.condition.ConditionEvaluator;
import com.docflow.workflow.exception.InconsistentStateException;
import com.docflow.workflow.exception.WorkflowNotFoundException;
import com.docflow.workflow.gateway.DocumentGateway;
import com.docflow.workflow.gateway.DocumentSnapshot;
import com.docflow.workflow.gateway.IdentityDirectory;
import com.docflow.workflow.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Decides who works on a step, where an instance goes next and which
 * actions a user may take.
 *
 * Stateless; every call reads the definition held by the instance and
 * the current document snapshot.
 */
@Component
public class RoutingResolver {

    private static final Logger log = LoggerFactory.getLogger(RoutingResolver.class);

    private final ConditionEvaluator       conditions;
    private final IdentityDirectory        identity;
    private final DocumentGateway          documents;
    private final DynamicAssigneeRegistry  dynamicAssignees;

    public RoutingResolver(ConditionEvaluator conditions,
                           IdentityDirectory identity,
                           DocumentGateway documents,
                           DynamicAssigneeRegistry dynamicAssignees) {
        this.conditions       = conditions;
        this.identity         = identity;
        this.documents        = documents;
        this.dynamicAssignees = dynamicAssignees;
    }

    // ------------------------------------------------------------------
    // Lookups shared by the engine
    // ------------------------------------------------------------------

    public DocumentSnapshot documentOf(WorkflowInstance instance) {
        return documents.find(instance.getDocumentId())
                .orElseThrow(() -> new WorkflowNotFoundException("Document", instance.getDocumentId()));
    }

    /**
     * The step the instance is parked on.
     *
     * @throws InconsistentStateException when the definition has no step with that order
     */
    public WorkflowStep currentStepOf(WorkflowInstance instance) {
        return instance.getDefinition().stepByOrder(instance.getCurrentStep())
                .orElseThrow(() -> {
                    log.error("Instance {} points at step order {} which definition '{}' does not have",
                            instance.getId(), instance.getCurrentStep(), instance.getDefinition().getName());
                    return new InconsistentStateException("Current step " + instance.getCurrentStep()
                            + " not found in workflow definition " + instance.getDefinition().getName());
                });
    }

    // ------------------------------------------------------------------
    // Assignees
    // ------------------------------------------------------------------

    /**
     * Identities eligible to act at a step.
     *
     * ROLE: enabled holders of the role. USER: the named user. FIELD_BASED:
     * the document field names a user (that user) or a role (its holders).
     * DYNAMIC: the registered resolver named by the assignee value.
     */
    public Set<String> getStepAssignees(WorkflowStep step, DocumentSnapshot document, String actor) {
        String value = step.getAssigneeValue();
        return switch (step.getAssigneeType()) {
            case ROLE        -> new LinkedHashSet<>(identity.usersWithRole(value));
            case USER        -> value == null || value.isBlank() ? Set.of() : Set.of(value);
            case FIELD_BASED -> fieldAssignees(document.fieldAsString(value));
            case DYNAMIC     -> dynamicAssignees.resolve(value, step, document, actor);
            case NONE        -> Set.of();
        };
    }

    public boolean isUserAssignedToStep(WorkflowStep step, String user, DocumentSnapshot document) {
        if (user == null) return false;
        String value = step.getAssigneeValue();
        return switch (step.getAssigneeType()) {
            case ROLE        -> identity.hasRole(user, value);
            case USER        -> user.equals(value);
            case FIELD_BASED -> {
                String named = document.fieldAsString(value);
                yield user.equals(named) || (identity.roleExists(named) && identity.hasRole(user, named));
            }
            case DYNAMIC     -> dynamicAssignees.resolve(value, step, document, user).contains(user);
            case NONE        -> false;
        };
    }

    /**
     * Whether the user may act on the instance's current step: assigned by
     * the step's routing, listed in the instance's current assignees (e.g.
     * after a reassignment), or holding one of the step's allowed roles.
     */
    public boolean canActOnStep(WorkflowInstance instance, WorkflowStep step, String user, DocumentSnapshot document) {
        if (user == null) return false;
        if (instance.getCurrentAssignees().contains(user)) return true;
        if (step.getAllowedRoles().stream().anyMatch(role -> identity.hasRole(user, role))) return true;
        return isUserAssignedToStep(step, user, document);
    }

    private Set<String> fieldAssignees(String named) {
        if (named.isBlank()) return Set.of();
        if (identity.userExists(named)) return Set.of(named);
        if (identity.roleExists(named)) return new LinkedHashSet<>(identity.usersWithRole(named));
        return Set.of();
    }

    // ------------------------------------------------------------------
    // Next step
    // ------------------------------------------------------------------

    public Optional<WorkflowStep> getNextStep(WorkflowInstance instance, WorkflowStep current, String action) {
        return getNextStep(instance, current, action, documentOf(instance));
    }

    /**
     * First outgoing transition (declaration order) that matches the action
     * and whose conditions pass wins. Without one, falls back to the step
     * whose order is current + 1.
     */
    public Optional<WorkflowStep> getNextStep(WorkflowInstance instance, WorkflowStep current,
                                              String action, DocumentSnapshot document) {
        Optional<WorkflowStep> routed = firstPassingTransition(instance, current, action, document);
        if (routed.isPresent()) return routed;
        return instance.getDefinition().stepByOrder(current.getStepOrder() + 1);
    }

    private Optional<WorkflowStep> firstPassingTransition(WorkflowInstance instance, WorkflowStep current,
                                                          String action, DocumentSnapshot document) {
        WorkflowDefinition definition = instance.getDefinition();
        for (WorkflowTransition transition : definition.transitionsFrom(current.getStepName())) {
            if (!transition.appliesTo(action)) {
                continue;
            }
            if (conditions.evaluateGroup(transition.getConditions(), document)) {
                Optional<WorkflowStep> target = definition.stepByName(transition.getToStep());
                if (target.isEmpty()) {
                    throw new InconsistentStateException("Transition target '" + transition.getToStep()
                            + "' not found in workflow definition " + definition.getName());
                }
                return target;
            }
        }
        return Optional.empty();
    }

    // ------------------------------------------------------------------
    // Actions
    // ------------------------------------------------------------------

    /** Role gate (unset or "All" lets everyone through) AND the action's condition group. */
    public boolean isActionAllowed(StepAction action, String user, DocumentSnapshot document) {
        String role = action.getRequiredRole();
        if (role != null && !role.isBlank() && !StepAction.ALL_ROLES.equals(role)
                && !identity.hasRole(user, role)) {
            return false;
        }
        return conditions.evaluateGroup(action.getConditions(), document);
    }

    /**
     * Current step's actions the user may take; none unless the user can act
     * on the step. Rejection is not offered on steps with allowReject off.
     */
    public List<StepAction> getAvailableActions(WorkflowInstance instance, String user) {
        if (instance.getStatus() != WorkflowStatus.IN_PROGRESS) return List.of();
        Optional<WorkflowStep> current = instance.getDefinition().stepByOrder(instance.getCurrentStep());
        if (current.isEmpty()) return List.of();

        DocumentSnapshot document = documentOf(instance);
        if (!canActOnStep(instance, current.get(), user, document)) return List.of();
        boolean offerReject = current.get().isAllowReject();
        return current.get().getActions().stream()
                .filter(a -> offerReject || a.getActionType() != ActionType.REJECTION)
                .filter(a -> isActionAllowed(a, user, document))
                .toList();
    }

    // ------------------------------------------------------------------
    // Definition-level routing
    // ------------------------------------------------------------------

    public boolean definitionApplies(WorkflowDefinition definition, DocumentSnapshot document) {
        return conditions.evaluateGroup(definition.getConditions(), document);
    }

    public boolean stepConditionsMet(WorkflowStep step, DocumentSnapshot document) {
        return conditions.evaluateGroup(step.getConditions(), document);
    }

    /**
     * Current step followed by the route the instance would take if every
     * step were approved. Stops at an End step, at a missing step, or when
     * a step would repeat.
     */
    public List<WorkflowStep> getWorkflowPath(WorkflowInstance instance) {
        Optional<WorkflowStep> start = instance.getDefinition().stepByOrder(instance.getCurrentStep());
        if (start.isEmpty()) return List.of();

        DocumentSnapshot document = documentOf(instance);
        List<WorkflowStep> path = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        WorkflowStep step = start.get();
        while (step != null && seen.add(step.getStepName())) {
            path.add(step);
            if (step.isEnd()) break;
            step = getNextStep(instance, step, ActionType.APPROVAL.label(), document).orElse(null);
        }
        return path;
    }
}
