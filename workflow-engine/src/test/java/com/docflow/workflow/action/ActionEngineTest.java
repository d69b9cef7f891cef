package com.docflow.workflow.action;

import com.docflow.workflow.exception.InvalidTransitionException;
import com.docflow.workflow.exception.UnauthorizedActionException;
import com.docflow.workflow.exception.WorkflowNotFoundException;
import com.docflow.workflow.exception.WorkflowValidationException;
import com.docflow.workflow.model.*;
import com.docflow.workflow.support.EngineHarness;
import com.docflow.workflow.support.TestWorkflows;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static com.docflow.workflow.model.WorkflowStatus.*;
import static com.docflow.workflow.support.TestWorkflows.step;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * The five actions end to end through routing, step processing and the
 * state machine. Persistence and delivery are mocked.
 */
class ActionEngineTest {

    EngineHarness      engine;
    ActionEngine       actions;
    WorkflowDefinition definition;

    @BeforeEach
    void setUp() {
        engine     = new EngineHarness();
        actions    = engine.actions;
        definition = TestWorkflows.purchaseOrderFlow();
        engine.documents.put("PO-1", TestWorkflows.PURCHASE_ORDER, Map.of("amount", "2500"));
    }

    private WorkflowInstance onStep(int order) {
        return engine.store(TestWorkflows.instance(definition, "PO-1", IN_PROGRESS, order));
    }

    // ------------------------------------------------------------------
    // Approve
    // ------------------------------------------------------------------

    @Test
    void approve_onStartEndWorkflow_completesInOneChain() {
        WorkflowDefinition quick = TestWorkflows.startEndFlow();
        WorkflowInstance instance = engine.store(TestWorkflows.instance(quick, "PO-1", PENDING, 1));

        engine.stateMachine.transitionTo(instance, IN_PROGRESS, "alice", null);
        WorkflowInstance result = actions.approve(instance.getId(), "alice", "looks good");

        assertThat(result.getStatus()).isEqualTo(COMPLETED);
        assertThat(result.getCurrentStep()).isEqualTo(2);
        assertThat(result.getCompletedBy()).isEqualTo("alice");
        assertThat(engine.documents.statusOf("PO-1")).isEqualTo("Approved");
        assertThat(result.getHistory()).extracting(WorkflowHistoryEntry::getAction)
                .containsSubsequence("Step Processed", "Approve", WorkflowHistoryEntry.STATE_TRANSITION);
        assertThat(result.getHistory()).filteredOn(WorkflowHistoryEntry::isStateTransition)
                .extracting(WorkflowHistoryEntry::getToState)
                .containsExactly(IN_PROGRESS, COMPLETED);
    }

    @Test
    void approve_advancesToNextStepAndAssignsIt() {
        WorkflowInstance instance = onStep(2);

        WorkflowInstance result = actions.approve(instance.getId(), "bob", null);

        assertThat(result.getStatus()).isEqualTo(IN_PROGRESS);
        assertThat(result.getCurrentStep()).isEqualTo(3);
        assertThat(result.getCurrentAssignees()).containsExactlyInAnyOrder("carol", "dave");
        verify(engine.workItems, times(2)).createWorkItem(any());
        verify(engine.transport).send(any(), eq("Workflow Step Completed: Manager Approval"), anyString(), any(), any());
        verify(engine.instances).save(instance);
        assertThat(engine.counter("docflow.workflow.actions", "action", "approval", "outcome", "success")).isEqualTo(1.0);
    }

    @Test
    void approve_byUnassignedUser_isDeniedWithoutSideEffects() {
        WorkflowInstance instance = onStep(2);

        assertThatThrownBy(() -> actions.approve(instance.getId(), "carol", null))
                .isInstanceOf(UnauthorizedActionException.class)
                .hasMessageContaining("Approve");

        assertThat(instance.getHistory()).isEmpty();
        assertThat(instance.getCurrentStep()).isEqualTo(2);
        verify(engine.instances, never()).save(any());
        assertThat(engine.counter("docflow.workflow.actions", "action", "approval", "outcome", "denied")).isEqualTo(1.0);
    }

    @Test
    void approve_requiresActionOfThatTypeOnStep() {
        WorkflowInstance instance = onStep(4);   // End step, no actions configured

        assertThatThrownBy(() -> actions.approve(instance.getId(), "admin", null))
                .isInstanceOf(UnauthorizedActionException.class);
    }

    @Test
    void actions_requireInProgress() {
        WorkflowInstance instance = engine.store(TestWorkflows.instance(definition, "PO-1", ON_HOLD, 2));

        assertThatThrownBy(() -> actions.approve(instance.getId(), "bob", null))
                .isInstanceOf(InvalidTransitionException.class);
    }

    @Test
    void unknownInstance_isNotFound() {
        UUID id = UUID.randomUUID();
        when(engine.instances.findByIdForUpdate(id)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> actions.approve(id, "bob", null))
                .isInstanceOf(WorkflowNotFoundException.class);
    }

    @Test
    void notificationFailure_doesNotFailTheAction() {
        WorkflowInstance instance = onStep(2);
        doThrow(new IllegalStateException("smtp down")).when(engine.transport).send(any(), any(), any(), any(), any());

        WorkflowInstance result = actions.approve(instance.getId(), "bob", null);

        assertThat(result.getCurrentStep()).isEqualTo(3);
        assertThat(engine.counter("docflow.notifications", "event", "step_completed", "status", "failed"))
                .isEqualTo(1.0);
    }

    // ------------------------------------------------------------------
    // Reject
    // ------------------------------------------------------------------

    @Test
    void reject_movesToRejectedAndMarksDocument() {
        WorkflowInstance instance = onStep(2);

        WorkflowInstance result = actions.reject(instance.getId(), "bob", "over budget");

        assertThat(result.getStatus()).isEqualTo(REJECTED);
        assertThat(result.getCurrentAssignees()).isEmpty();
        assertThat(engine.documents.statusOf("PO-1")).isEqualTo("Rejected");
        assertThat(result.getHistory()).extracting(WorkflowHistoryEntry::getAction)
                .containsExactly("Reject", WorkflowHistoryEntry.STATE_TRANSITION);
        assertThat(result.getHistory().get(0).getComment()).isEqualTo("over budget");
    }

    @Test
    void reject_onRejectedInstance_isInvalidTransition() {
        WorkflowInstance instance = engine.store(TestWorkflows.instance(definition, "PO-1", REJECTED, 2));

        assertThatThrownBy(() -> actions.reject(instance.getId(), "bob", null))
                .isInstanceOf(InvalidTransitionException.class);
        assertThat(instance.getHistory()).isEmpty();
    }

    @Test
    void reject_onStepWithAllowRejectOff_stillRejectsForPermittedActor() {
        step(definition, "Manager Approval").setAllowReject(false);
        WorkflowInstance instance = onStep(2);

        WorkflowInstance result = actions.reject(instance.getId(), "bob", null);

        assertThat(result.getStatus()).isEqualTo(REJECTED);
    }

    @Test
    void approve_byDisabledRoleHolder_isDenied() {
        WorkflowInstance instance = onStep(3);

        assertThatThrownBy(() -> actions.approve(instance.getId(), "erin", null))
                .isInstanceOf(UnauthorizedActionException.class);

        assertThat(instance.getStatus()).isEqualTo(IN_PROGRESS);
        assertThat(instance.getCurrentStep()).isEqualTo(3);
        verify(engine.instances, never()).save(any());
    }

    // ------------------------------------------------------------------
    // Request Changes
    // ------------------------------------------------------------------

    @Test
    void requestChanges_withoutTransitions_followsNextOrder() {
        WorkflowInstance instance = onStep(2);

        WorkflowInstance result = actions.requestChanges(instance.getId(), "bob", "need a second quote");

        assertThat(result.getCurrentStep()).isEqualTo(3);
        assertThat(result.getCurrentAssignees()).containsExactlyInAnyOrder("carol", "dave");
        assertThat(result.getStatus()).isEqualTo(IN_PROGRESS);
    }

    @Test
    void requestChanges_followsTaggedTransition() {
        definition.addTransition(new WorkflowTransition("Finance Approval", "Submission", "Request Changes"));
        WorkflowInstance instance = onStep(3);

        WorkflowInstance result = actions.requestChanges(instance.getId(), "carol", null);

        assertThat(result.getCurrentStep()).isEqualTo(1);
        assertThat(result.getCurrentAssignees()).containsExactly("alice");
    }

    @Test
    void requestChanges_followsUntaggedTransition() {
        definition.addTransition(new WorkflowTransition("Finance Approval", "Manager Approval", null));
        WorkflowInstance instance = onStep(3);

        WorkflowInstance result = actions.requestChanges(instance.getId(), "carol", null);

        assertThat(result.getCurrentStep()).isEqualTo(2);
        assertThat(result.getCurrentAssignees()).containsExactly("bob");
    }

    @Test
    void requestChanges_withNoNextStep_returnsToPreviousStep() {
        definition.getSteps().removeIf(WorkflowStep::isEnd);
        WorkflowInstance instance = onStep(3);

        WorkflowInstance result = actions.requestChanges(instance.getId(), "carol", null);

        assertThat(result.getCurrentStep()).isEqualTo(2);
        assertThat(result.getCurrentAssignees()).containsExactly("bob");
    }

    @Test
    void requestChanges_onFirstStepWithNoNextStep_onlyRecordsHistory() {
        definition.getSteps().removeIf(s -> s.getStepOrder() > 1);
        step(definition, "Submission").addAction(new StepAction(ActionType.REQUEST_CHANGES));
        WorkflowInstance instance = onStep(1);

        WorkflowInstance result = actions.requestChanges(instance.getId(), "alice", "typo");

        assertThat(result.getCurrentStep()).isEqualTo(1);
        assertThat(result.getHistory()).extracting(WorkflowHistoryEntry::getAction).containsExactly("Request Changes");
        verify(engine.workItems, never()).createWorkItem(any());
    }

    // ------------------------------------------------------------------
    // Forward
    // ------------------------------------------------------------------

    @Test
    void forward_toNamedStep() {
        WorkflowInstance instance = onStep(3);

        WorkflowInstance result = actions.forward(instance.getId(), "carol", "Submission", "send back to requester");

        assertThat(result.getCurrentStep()).isEqualTo(1);
        assertThat(result.getHistory().get(0).getStep()).isEqualTo("Finance Approval -> Submission");
    }

    @Test
    void forward_toEndStepByOrder_completes() {
        WorkflowInstance instance = onStep(3);

        WorkflowInstance result = actions.forward(instance.getId(), "carol", "4", null);

        assertThat(result.getStatus()).isEqualTo(COMPLETED);
        assertThat(engine.documents.statusOf("PO-1")).isEqualTo("Approved");
    }

    @Test
    void forward_toUnknownStep_isValidationError() {
        WorkflowInstance instance = onStep(3);

        assertThatThrownBy(() -> actions.forward(instance.getId(), "carol", "Legal Review", null))
                .isInstanceOf(WorkflowValidationException.class)
                .hasMessageContaining("Legal Review");
        assertThat(instance.getHistory()).isEmpty();
    }

    @Test
    void forward_toOrderBeyondIntRange_isValidationError() {
        WorkflowInstance instance = onStep(3);

        assertThatThrownBy(() -> actions.forward(instance.getId(), "carol", "99999999999", null))
                .isInstanceOf(WorkflowValidationException.class)
                .hasMessage("Target step not found: 99999999999");
        assertThat(instance.getCurrentStep()).isEqualTo(3);
    }

    @Test
    void forward_withoutTarget_usesRouting() {
        WorkflowInstance instance = onStep(3);

        WorkflowInstance result = actions.forward(instance.getId(), "carol", null, null);

        assertThat(result.getStatus()).isEqualTo(COMPLETED);
    }

    // ------------------------------------------------------------------
    // Skip
    // ------------------------------------------------------------------

    @Test
    void skip_onStepWithoutAllowSkip_isDeniedEvenForAssignee() {
        WorkflowInstance instance = onStep(3);

        assertThatThrownBy(() -> actions.skip(instance.getId(), "carol", null))
                .isInstanceOf(UnauthorizedActionException.class)
                .hasMessageContaining("cannot be skipped");
        assertThat(instance.getCurrentStep()).isEqualTo(3);
    }

    @Test
    void skip_whenAllowed_advancesLikeApprove() {
        step(definition, "Finance Approval").setAllowSkip(true);
        WorkflowInstance instance = onStep(3);

        WorkflowInstance result = actions.skip(instance.getId(), "dave", "not needed under threshold");

        assertThat(result.getStatus()).isEqualTo(COMPLETED);
        assertThat(result.getHistory()).extracting(WorkflowHistoryEntry::getAction).startsWith("Skip");
    }

    // ------------------------------------------------------------------
    // execute() by name
    // ------------------------------------------------------------------

    @Test
    void execute_acceptsBuiltInLabelsCaseInsensitively() {
        WorkflowInstance instance = onStep(2);

        WorkflowInstance result = actions.execute(instance.getId(), "approve", "bob", null, null);

        assertThat(result.getCurrentStep()).isEqualTo(3);
    }

    @Test
    void execute_acceptsConfiguredActionName() {
        step(definition, "Manager Approval").getActions().clear();
        step(definition, "Manager Approval").addAction(new StepAction("Sign Off", ActionType.APPROVAL));
        WorkflowInstance instance = onStep(2);

        WorkflowInstance result = actions.execute(instance.getId(), "Sign Off", "bob", null, null);

        assertThat(result.getCurrentStep()).isEqualTo(3);
    }

    @Test
    void execute_unknownAction_isValidationError() {
        WorkflowInstance instance = onStep(2);

        assertThatThrownBy(() -> actions.execute(instance.getId(), "Escalate", "bob", null, null))
                .isInstanceOf(WorkflowValidationException.class)
                .hasMessage("Invalid action: Escalate");
    }
}
