package com.docflow.workflow.definition;

import com.docflow.workflow.exception.WorkflowNotFoundException;
import com.docflow.workflow.exception.WorkflowValidationException;
import com.docflow.workflow.gateway.DocumentGateway;
import com.docflow.workflow.gateway.DocumentSnapshot;
import com.docflow.workflow.model.WorkflowDefinition;
import com.docflow.workflow.model.WorkflowStep;
import com.docflow.workflow.repository.WorkflowDefinitionRepository;
import com.docflow.workflow.routing.RoutingResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Authoring and lookup of workflow definitions.
 *
 * A definition can only be edited while it is inactive. Running instances
 * reference their definition directly, so an active definition is frozen
 * until it is deactivated.
 */
@Service
public class WorkflowDefinitionService {

    private static final Logger log = LoggerFactory.getLogger(WorkflowDefinitionService.class);

    private final WorkflowDefinitionRepository definitions;
    private final DefinitionValidator          validator;
    private final RoutingResolver              routing;
    private final DocumentGateway              documents;

    public WorkflowDefinitionService(WorkflowDefinitionRepository definitions,
                                     DefinitionValidator validator,
                                     RoutingResolver routing,
                                     DocumentGateway documents) {
        this.definitions = definitions;
        this.validator   = validator;
        this.routing     = routing;
        this.documents   = documents;
    }

    // ------------------------------------------------------------------
    // Authoring
    // ------------------------------------------------------------------

    @Transactional
    public WorkflowDefinition create(WorkflowDefinition definition) {
        if (definitions.existsByName(definition.getName())) {
            throw new WorkflowValidationException("Workflow definition " + definition.getName() + " already exists");
        }
        validate(definition);
        WorkflowDefinition saved = definitions.save(definition);
        log.info("Created workflow definition '{}' for document type {}", saved.getName(), saved.getDocumentType());
        return saved;
    }

    /**
     * Replace the content of an inactive definition. The name is kept;
     * activation state is changed only through {@link #activate} and
     * {@link #deactivate}.
     */
    @Transactional
    public WorkflowDefinition update(String name, WorkflowDefinition changes) {
        WorkflowDefinition existing = get(name);
        if (existing.isActive()) {
            throw new WorkflowValidationException(
                    "Workflow definition " + name + " is active; deactivate it before editing");
        }
        existing.setDescription(changes.getDescription());
        existing.setDocumentType(changes.getDocumentType());
        existing.setDefaultForType(changes.isDefaultForType());
        existing.setSteps(changes.getSteps());
        existing.setTransitions(changes.getTransitions());
        existing.setConditions(changes.getConditions());
        existing.setPermissions(changes.getPermissions());
        validate(existing);
        log.info("Updated workflow definition '{}'", name);
        return definitions.save(existing);
    }

    @Transactional
    public WorkflowDefinition activate(String name) {
        WorkflowDefinition definition = get(name);
        definition.setActive(true);
        validate(definition);
        log.info("Activated workflow definition '{}'", name);
        return definitions.save(definition);
    }

    @Transactional
    public WorkflowDefinition deactivate(String name) {
        WorkflowDefinition definition = get(name);
        definition.setActive(false);
        log.info("Deactivated workflow definition '{}'", name);
        return definitions.save(definition);
    }

    /** Deep copy named "&lt;name&gt; (Copy)", inactive and not a default. */
    @Transactional
    public WorkflowDefinition duplicate(String name) {
        WorkflowDefinition source = get(name);
        String copyName = source.getName() + " (Copy)";
        if (definitions.existsByName(copyName)) {
            throw new WorkflowValidationException("Workflow definition " + copyName + " already exists");
        }
        WorkflowDefinition copy = source.copyAs(copyName);
        copy.setActive(false);
        copy.setDefaultForType(false);
        log.info("Duplicated workflow definition '{}' as '{}'", name, copyName);
        return definitions.save(copy);
    }

    // ------------------------------------------------------------------
    // Lookup
    // ------------------------------------------------------------------

    @Transactional(readOnly = true)
    public WorkflowDefinition get(String name) {
        return definitions.findByName(name)
                .orElseThrow(() -> new WorkflowNotFoundException("Workflow definition", name));
    }

    @Transactional(readOnly = true)
    public List<WorkflowDefinition> list(String documentType, boolean activeOnly) {
        return definitions.findAllByOrderByNameAsc().stream()
                .filter(d -> documentType == null || documentType.equals(d.getDocumentType()))
                .filter(d -> !activeOnly || d.isActive())
                .toList();
    }

    @Transactional(readOnly = true)
    public Optional<WorkflowDefinition> defaultFor(String documentType) {
        return definitions.findFirstByDocumentTypeAndDefaultForTypeTrueAndActiveTrue(documentType);
    }

    /** Active definitions of the document's type whose condition group passes, oldest first. */
    @Transactional(readOnly = true)
    public List<WorkflowDefinition> findApplicable(DocumentSnapshot document) {
        return definitions.findByDocumentTypeAndActiveTrueOrderByCreatedAtAsc(document.documentType()).stream()
                .filter(d -> routing.definitionApplies(d, document))
                .toList();
    }

    @Transactional(readOnly = true)
    public List<WorkflowDefinition> findApplicable(String documentId) {
        return findApplicable(document(documentId));
    }

    @Transactional(readOnly = true)
    public ConditionTestResult testConditions(String name, String documentId) {
        WorkflowDefinition definition = get(name);
        DocumentSnapshot document = document(documentId);

        Map<String, Boolean> steps = new LinkedHashMap<>();
        for (WorkflowStep step : definition.stepsInOrder()) {
            steps.put(step.getStepName(), routing.stepConditionsMet(step, document));
        }
        return new ConditionTestResult(definition.getName(), documentId,
                routing.definitionApplies(definition, document), steps);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private DocumentSnapshot document(String documentId) {
        return documents.find(documentId)
                .orElseThrow(() -> new WorkflowNotFoundException("Document", documentId));
    }

    private void validate(WorkflowDefinition definition) {
        List<String> problems = new ArrayList<>(validator.problems(definition));
        if (definition.isDefaultForType()) {
            boolean otherDefault = definitions.findByDocumentTypeAndDefaultForTypeTrue(definition.getDocumentType())
                    .stream()
                    .anyMatch(d -> !d.getName().equals(definition.getName()));
            if (otherDefault) {
                problems.add("Another workflow is already the default for document type "
                        + definition.getDocumentType());
            }
        }
        if (!problems.isEmpty()) {
            throw new WorkflowValidationException(problems);
        }
    }
}
