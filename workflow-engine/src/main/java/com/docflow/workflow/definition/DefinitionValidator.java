package com.docflow.workflow.definition;

import com.docflow.workflow.model.AssigneeType;
import com.docflow.workflow.model.WorkflowDefinition;
import com.docflow.workflow.model.WorkflowStep;
import com.docflow.workflow.model.WorkflowTransition;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Structural checks run before a definition is saved.
 *
 * All problems are collected, not just the first one, so an editor can
 * fix a definition in one round trip.
 */
@Component
public class DefinitionValidator {

    public List<String> problems(WorkflowDefinition definition) {
        List<String> problems = new ArrayList<>();

        if (definition.getName() == null || definition.getName().isBlank()) {
            problems.add("Workflow name is required");
        }
        if (definition.getDocumentType() == null || definition.getDocumentType().isBlank()) {
            problems.add("Document type is required");
        }

        List<WorkflowStep> steps = definition.getSteps();
        if (steps.isEmpty()) {
            problems.add("Workflow must have at least one step");
            return problems;
        }

        checkSteps(steps, problems);
        checkTransitions(definition, problems);
        return problems;
    }

    private static void checkSteps(List<WorkflowStep> steps, List<String> problems) {
        Set<Integer> orders = new HashSet<>();
        Set<String>  names  = new HashSet<>();
        int lowest = Integer.MAX_VALUE;
        int starts = 0;
        int ends   = 0;

        for (WorkflowStep step : steps) {
            if (!orders.add(step.getStepOrder())) {
                problems.add("Duplicate step order " + step.getStepOrder());
            }
            lowest = Math.min(lowest, step.getStepOrder());

            if (step.getStepName() == null || step.getStepName().isBlank()) {
                problems.add("Step " + step.getStepOrder() + " has no name");
            } else if (!names.add(step.getStepName())) {
                problems.add("Duplicate step name '" + step.getStepName() + "'");
            }
            if (step.getStepType() == null) {
                problems.add("Step '" + step.getStepName() + "' has no step type");
            } else if (step.isStart()) {
                starts++;
            } else if (step.isEnd()) {
                ends++;
            }

            if (step.getAssigneeType() != null && step.getAssigneeType() != AssigneeType.NONE
                    && (step.getAssigneeValue() == null || step.getAssigneeValue().isBlank())) {
                problems.add("Step '" + step.getStepName() + "' needs an assignee value for assignee type "
                        + step.getAssigneeType());
            }
        }

        if (lowest != 1) {
            problems.add("Step orders must start at 1");
        }
        if (starts != 1) {
            problems.add("Workflow must have exactly one Start step (found " + starts + ")");
        }
        if (ends < 1) {
            problems.add("Workflow must have at least one End step");
        }
    }

    private static void checkTransitions(WorkflowDefinition definition, List<String> problems) {
        Set<String> seen = new HashSet<>();
        for (WorkflowTransition t : definition.getTransitions()) {
            boolean fromKnown = definition.stepByName(t.getFromStep()).isPresent();
            boolean toKnown   = definition.stepByName(t.getToStep()).isPresent();
            if (!fromKnown) {
                problems.add("Transition references unknown step '" + t.getFromStep() + "'");
            }
            if (!toKnown) {
                problems.add("Transition references unknown step '" + t.getToStep() + "'");
            }
            if (fromKnown && toKnown && t.getFromStep().equals(t.getToStep())) {
                problems.add("Transition from '" + t.getFromStep() + "' to itself is not allowed");
            }
            String action = t.getAction() == null ? "" : t.getAction().trim().toLowerCase(Locale.ROOT);
            if (!seen.add(t.getFromStep() + "\u0000" + t.getToStep() + "\u0000" + action)) {
                problems.add("Duplicate transition '" + t.getFromStep() + "' -> '" + t.getToStep() + "'"
                        + (action.isEmpty() ? "" : " on " + t.getAction()));
            }
        }
    }
}
