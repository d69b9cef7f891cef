package com.docflow.workflow.repository;

import com.docflow.workflow.model.WorkflowHistoryEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.UUID;

/**
 * Read-side queries over workflow_history. Writes only ever happen through
 * {@code WorkflowInstance.appendHistory}.
 */
public interface WorkflowHistoryRepository extends JpaRepository<WorkflowHistoryEntry, UUID> {

    /** Distinct users who left a non-empty comment on the instance. */
    @Query(value = """
            SELECT DISTINCT h.actor FROM workflow_history h
            WHERE h.instance_id = :instanceId
              AND h.actor IS NOT NULL
              AND h.comment IS NOT NULL AND h.comment <> ''
            """, nativeQuery = true)
    List<String> findCommenters(@Param("instanceId") UUID instanceId);
}
