package com.docflow.workflow.exception;

import java.util.List;

/**
 * A definition (or a request) failed structural validation.
 * Carries every problem found, not just the first.
 */
public class WorkflowValidationException extends WorkflowException {

    private final List<String> problems;

    public WorkflowValidationException(List<String> problems) {
        super(String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public WorkflowValidationException(String problem) {
        this(List.of(problem));
    }

    public List<String> getProblems() { return problems; }
}
