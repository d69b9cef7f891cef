package com.docflow.workflow.repository;

import com.docflow.workflow.model.WorkflowDefinition;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * CRUD + lookup queries for the workflow_definitions table.
 */
public interface WorkflowDefinitionRepository extends JpaRepository<WorkflowDefinition, UUID> {

    Optional<WorkflowDefinition> findByName(String name);

    boolean existsByName(String name);

    /** Candidates for automatic selection, oldest first so the choice is stable. */
    List<WorkflowDefinition> findByDocumentTypeAndActiveTrueOrderByCreatedAtAsc(String documentType);

    Optional<WorkflowDefinition> findFirstByDocumentTypeAndDefaultForTypeTrueAndActiveTrue(String documentType);

    List<WorkflowDefinition> findByDocumentTypeAndDefaultForTypeTrue(String documentType);

    List<WorkflowDefinition> findAllByOrderByNameAsc();
}
