package com.docflow.workflow.api;

import com.docflow.workflow.definition.ConditionTestResult;
import com.docflow.workflow.definition.WorkflowDefinitionService;
import com.docflow.workflow.exception.WorkflowNotFoundException;
import com.docflow.workflow.exception.WorkflowValidationException;
import com.docflow.workflow.model.*;
import com.docflow.workflow.support.TestWorkflows;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(WorkflowDefinitionController.class)
class WorkflowDefinitionControllerTest {

    @Autowired   MockMvc                   mockMvc;
    @MockitoBean WorkflowDefinitionService definitionService;

    static final String QUICK_SIGN_OFF = """
            {
              "name": "Quick Sign-off",
              "documentType": "Purchase Order",
              "conditions": [
                {"field": "amount", "operator": "LESS_THAN", "value": "500"}
              ],
              "steps": [
                {"stepName": "Sign-off", "stepType": "START", "stepOrder": 1,
                 "assigneeType": "USER", "assigneeValue": "alice",
                 "actions": [{"actionName": "Approve", "actionType": "APPROVAL"}]},
                {"stepName": "Done", "stepType": "END", "stepOrder": 2}
              ],
              "transitions": [
                {"fromStep": "Sign-off", "toStep": "Done", "action": "Approve"}
              ]
            }
            """;

    @Test
    void create_bindsStructureAndReturns201() throws Exception {
        when(definitionService.create(any())).thenAnswer(inv -> inv.getArgument(0));

        mockMvc.perform(post("/workflows/definitions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(QUICK_SIGN_OFF))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.name").value("Quick Sign-off"))
                .andExpect(jsonPath("$.steps[0].allowReject").value(true))
                .andExpect(jsonPath("$.steps[1].assigneeType").value("NONE"))
                .andExpect(jsonPath("$.conditions[0].logicalOperator").value("AND"));

        ArgumentCaptor<WorkflowDefinition> captor = ArgumentCaptor.forClass(WorkflowDefinition.class);
        verify(definitionService).create(captor.capture());
        WorkflowDefinition bound = captor.getValue();
        assertThat(bound.isActive()).isFalse();
        assertThat(bound.stepsInOrder()).extracting(WorkflowStep::getStepName).containsExactly("Sign-off", "Done");
        assertThat(bound.getTransitions()).extracting(WorkflowTransition::getAction).containsExactly("Approve");
    }

    @Test
    void create_invalid_returns400WithEveryProblem() throws Exception {
        when(definitionService.create(any())).thenThrow(new WorkflowValidationException(List.of(
                "Workflow must have exactly one Start step (found 0)",
                "Workflow must have at least one End step")));

        mockMvc.perform(post("/workflows/definitions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Empty\",\"documentType\":\"Purchase Order\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.problems.length()").value(2));
    }

    @Test
    void get_unknown_returns404() throws Exception {
        when(definitionService.get("Nope")).thenThrow(new WorkflowNotFoundException("Workflow definition", "Nope"));

        mockMvc.perform(get("/workflows/definitions/{name}", "Nope"))
                .andExpect(status().isNotFound());
    }

    @Test
    void list_passesFilters() throws Exception {
        when(definitionService.list("Purchase Order", true)).thenReturn(List.of(TestWorkflows.purchaseOrderFlow()));

        mockMvc.perform(get("/workflows/definitions")
                        .param("documentType", "Purchase Order")
                        .param("activeOnly", "true"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].name").value("PO Approval"))
                .andExpect(jsonPath("$[0].steps.length()").value(4));
    }

    @Test
    void update_activeDefinition_returns400() throws Exception {
        when(definitionService.update(eq("PO Approval"), any())).thenThrow(new WorkflowValidationException(
                "Workflow definition PO Approval is active; deactivate it before editing"));

        mockMvc.perform(put("/workflows/definitions/{name}", "PO Approval")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(QUICK_SIGN_OFF))
                .andExpect(status().isBadRequest());
    }

    @Test
    void duplicate_returns201() throws Exception {
        WorkflowDefinition copy = TestWorkflows.purchaseOrderFlow().copyAs("PO Approval (Copy)");
        when(definitionService.duplicate("PO Approval")).thenReturn(copy);

        mockMvc.perform(post("/workflows/definitions/{name}/duplicate", "PO Approval"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.name").value("PO Approval (Copy)"))
                .andExpect(jsonPath("$.active").value(false));
    }

    @Test
    void activate_returnsDefinition() throws Exception {
        when(definitionService.activate("PO Approval")).thenReturn(TestWorkflows.purchaseOrderFlow());

        mockMvc.perform(post("/workflows/definitions/{name}/activate", "PO Approval"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.active").value(true));
    }

    @Test
    void testConditions_returnsPerStepResults() throws Exception {
        Map<String, Boolean> steps = new LinkedHashMap<>();
        steps.put("Submission", true);
        steps.put("Finance Approval", false);
        when(definitionService.testConditions("PO Approval", "PO-1"))
                .thenReturn(new ConditionTestResult("PO Approval", "PO-1", true, steps));

        mockMvc.perform(get("/workflows/definitions/{name}/conditions/test", "PO Approval")
                        .param("documentId", "PO-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.definitionConditionsMet").value(true))
                .andExpect(jsonPath("$.stepResults['Finance Approval']").value(false));
    }
}
