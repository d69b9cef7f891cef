package com.docflow.workflow.repository;

import com.docflow.workflow.model.WorkflowInstance;
import com.docflow.workflow.model.WorkflowStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * CRUD + locking queries for the workflow_instances table.
 */
public interface WorkflowInstanceRepository extends JpaRepository<WorkflowInstance, UUID> {

    /**
     * Load an instance with SELECT ... FOR UPDATE.
     *
     * Every mutating operation goes through this so that concurrent actions
     * on the same instance are serialised. Must run inside a transaction.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT i FROM WorkflowInstance i WHERE i.id = :id")
    Optional<WorkflowInstance> findByIdForUpdate(@Param("id") UUID id);

    boolean existsByDocumentIdAndStatusIn(String documentId, Collection<WorkflowStatus> statuses);

    /** Latest instance first. */
    List<WorkflowInstance> findByDocumentIdOrderByCreatedAtDesc(String documentId);

    List<WorkflowInstance> findByStatus(WorkflowStatus status);

    List<WorkflowInstance> findByStatusIn(Collection<WorkflowStatus> statuses);
}
