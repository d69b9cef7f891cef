package com.docflow.workflow.api;

import com.docflow.workflow.exception.*;
import com.docflow.workflow.instance.PendingAction;
import com.docflow.workflow.instance.WorkflowInstanceService;
import com.docflow.workflow.model.WorkflowDefinition;
import com.docflow.workflow.model.WorkflowInstance;
import com.docflow.workflow.model.WorkflowStatus;
import com.docflow.workflow.support.TestWorkflows;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Slice test for WorkflowInstanceController and the exception advice.
 * The service is a mock; only request binding and status mapping are exercised.
 */
@WebMvcTest(WorkflowInstanceController.class)
class WorkflowInstanceControllerTest {

    static final String USER = WorkflowInstanceController.USER_HEADER;

    @Autowired   MockMvc                 mockMvc;
    @MockitoBean WorkflowInstanceService instanceService;

    private WorkflowInstance instance(WorkflowStatus status, int step) {
        WorkflowDefinition definition = TestWorkflows.purchaseOrderFlow();
        WorkflowInstance instance = TestWorkflows.instance(definition, "PO-1", status, step);
        instance.setCurrentAssignees(Set.of("bob"));
        return instance;
    }

    // ------------------------------------------------------------------
    // POST /workflows/instances
    // ------------------------------------------------------------------

    @Test
    void start_returns201WithInstance() throws Exception {
        WorkflowInstance instance = instance(WorkflowStatus.IN_PROGRESS, 2);
        when(instanceService.startWorkflow("PO-1", null, "alice")).thenReturn(instance);

        mockMvc.perform(post("/workflows/instances")
                        .header(USER, "alice")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"documentId":"PO-1"}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(instance.getId().toString()))
                .andExpect(jsonPath("$.status").value("In Progress"))
                .andExpect(jsonPath("$.workflowName").value("PO Approval"))
                .andExpect(jsonPath("$.currentStepName").value("Manager Approval"))
                .andExpect(jsonPath("$.currentAssignees[0]").value("bob"));
    }

    @Test
    void start_withoutUserHeader_returns400() throws Exception {
        mockMvc.perform(post("/workflows/instances")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"documentId\":\"PO-1\"}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(instanceService);
    }

    @Test
    void start_secondActiveInstance_returns409() throws Exception {
        when(instanceService.startWorkflow(any(), any(), any())).thenThrow(new ActiveInstanceExistsException("PO-1"));

        mockMvc.perform(post("/workflows/instances")
                        .header(USER, "alice")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"documentId\":\"PO-1\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.status").value(409));
    }

    // ------------------------------------------------------------------
    // GET /workflows/instances/{id}
    // ------------------------------------------------------------------

    @Test
    void get_unknownId_returns404() throws Exception {
        UUID id = UUID.randomUUID();
        when(instanceService.get(id)).thenThrow(new WorkflowNotFoundException("Workflow instance", id));

        mockMvc.perform(get("/workflows/instances/{id}", id))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Not Found"));
    }

    // ------------------------------------------------------------------
    // POST /workflows/instances/{id}/actions
    // ------------------------------------------------------------------

    @Test
    void action_passesNameCommentAndTarget() throws Exception {
        WorkflowInstance instance = instance(WorkflowStatus.IN_PROGRESS, 1);
        when(instanceService.executeAction(instance.getId(), "Forward", "carol", "back to you", "Submission"))
                .thenReturn(instance);

        mockMvc.perform(post("/workflows/instances/{id}/actions", instance.getId())
                        .header(USER, "carol")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"action":"Forward","comment":"back to you","targetStep":"Submission"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.currentStep").value(1));
    }

    @Test
    void action_notPermitted_returns403() throws Exception {
        UUID id = UUID.randomUUID();
        when(instanceService.executeAction(eq(id), any(), any(), any(), any()))
                .thenThrow(new UnauthorizedActionException("You are not allowed to perform 'Approve' on step 'Manager Approval'"));

        mockMvc.perform(post("/workflows/instances/{id}/actions", id)
                        .header(USER, "carol")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"action\":\"Approve\"}"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.message").value("You are not allowed to perform 'Approve' on step 'Manager Approval'"));
    }

    @Test
    void action_invalidName_returns400WithProblems() throws Exception {
        UUID id = UUID.randomUUID();
        when(instanceService.executeAction(eq(id), any(), any(), any(), any()))
                .thenThrow(new WorkflowValidationException("Invalid action: Escalate"));

        mockMvc.perform(post("/workflows/instances/{id}/actions", id)
                        .header(USER, "bob")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"action\":\"Escalate\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.problems[0]").value("Invalid action: Escalate"));
    }

    @Test
    void action_onTerminalInstance_returns409() throws Exception {
        UUID id = UUID.randomUUID();
        when(instanceService.executeAction(eq(id), any(), any(), any(), any()))
                .thenThrow(new InvalidTransitionException(WorkflowStatus.REJECTED, WorkflowStatus.REJECTED));

        mockMvc.perform(post("/workflows/instances/{id}/actions", id)
                        .header(USER, "bob")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"action\":\"Reject\"}"))
                .andExpect(status().isConflict());
    }

    @Test
    void action_concurrentUpdate_returns409() throws Exception {
        UUID id = UUID.randomUUID();
        when(instanceService.executeAction(eq(id), any(), any(), any(), any()))
                .thenThrow(new OptimisticLockingFailureException("stale version"));

        mockMvc.perform(post("/workflows/instances/{id}/actions", id)
                        .header(USER, "bob")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"action\":\"Approve\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.message").value("The workflow instance was modified concurrently; reload and retry"));
    }

    @Test
    void action_inconsistentDefinition_returns500() throws Exception {
        UUID id = UUID.randomUUID();
        when(instanceService.executeAction(eq(id), any(), any(), any(), any()))
                .thenThrow(new InconsistentStateException("Current step 9 not found in workflow definition PO Approval"));

        mockMvc.perform(post("/workflows/instances/{id}/actions", id)
                        .header(USER, "bob")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"action\":\"Approve\"}"))
                .andExpect(status().isInternalServerError());
    }

    // ------------------------------------------------------------------
    // Lifecycle endpoints
    // ------------------------------------------------------------------

    @Test
    void cancel_withoutBody_passesNullReason() throws Exception {
        WorkflowInstance instance = instance(WorkflowStatus.CANCELLED, 2);
        when(instanceService.cancel(instance.getId(), "alice", null)).thenReturn(instance);

        mockMvc.perform(post("/workflows/instances/{id}/cancel", instance.getId()).header(USER, "alice"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("Cancelled"));
    }

    @Test
    void hold_withReason() throws Exception {
        WorkflowInstance instance = instance(WorkflowStatus.ON_HOLD, 2);
        when(instanceService.hold(instance.getId(), "alice", "waiting on vendor")).thenReturn(instance);

        mockMvc.perform(post("/workflows/instances/{id}/hold", instance.getId())
                        .header(USER, "alice")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"comment\":\"waiting on vendor\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("On Hold"));
    }

    @Test
    void reassign_passesAssigneeAndComment() throws Exception {
        WorkflowInstance instance = instance(WorkflowStatus.IN_PROGRESS, 2);
        when(instanceService.reassign(instance.getId(), "carol", "bob", null)).thenReturn(instance);

        mockMvc.perform(post("/workflows/instances/{id}/reassign", instance.getId())
                        .header(USER, "bob")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"assignee\":\"carol\"}"))
                .andExpect(status().isOk());

        verify(instanceService).reassign(eq(instance.getId()), eq("carol"), eq("bob"), isNull());
    }

    @Test
    void reminder_sentOrNothingToSend() throws Exception {
        UUID sent = UUID.randomUUID();
        UUID none = UUID.randomUUID();
        when(instanceService.sendReminder(sent)).thenReturn(true);
        when(instanceService.sendReminder(none)).thenReturn(false);

        mockMvc.perform(post("/workflows/instances/{id}/reminder", sent)).andExpect(status().isAccepted());
        mockMvc.perform(post("/workflows/instances/{id}/reminder", none)).andExpect(status().isNoContent());
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    @Test
    void documentStatus_withoutInstance_isNotStarted() throws Exception {
        when(instanceService.statusForDocument("PO-9")).thenReturn(Optional.empty());

        mockMvc.perform(get("/workflows/documents/{documentId}/status", "PO-9"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.documentId").value("PO-9"))
                .andExpect(jsonPath("$.status").value("Not Started"));
    }

    @Test
    void documentStatus_withInstance_returnsLatest() throws Exception {
        when(instanceService.statusForDocument("PO-1")).thenReturn(Optional.of(instance(WorkflowStatus.REJECTED, 2)));

        mockMvc.perform(get("/workflows/documents/{documentId}/status", "PO-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("Rejected"));
    }

    @Test
    void availableActions_forCaller() throws Exception {
        UUID id = UUID.randomUUID();
        when(instanceService.availableActions(id, "bob")).thenReturn(List.of("Approve", "Reject"));

        mockMvc.perform(get("/workflows/instances/{id}/actions", id).header(USER, "bob"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[1]").value("Reject"));
    }

    @Test
    void pending_listsInstancesWaitingOnCaller() throws Exception {
        WorkflowInstance instance = instance(WorkflowStatus.IN_PROGRESS, 2);
        when(instanceService.pendingActions("bob"))
                .thenReturn(List.of(new PendingAction(instance, "Manager Approval", List.of("Approve"))));

        mockMvc.perform(get("/workflows/pending").header(USER, "bob"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].instanceId").value(instance.getId().toString()))
                .andExpect(jsonPath("$[0].currentStep").value("Manager Approval"))
                .andExpect(jsonPath("$[0].actions[0]").value("Approve"));
    }
}
