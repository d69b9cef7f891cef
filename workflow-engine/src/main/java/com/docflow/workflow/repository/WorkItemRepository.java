package com.docflow.workflow.repository;

import com.docflow.workflow.model.WorkItem;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.UUID;

public interface WorkItemRepository extends JpaRepository<WorkItem, UUID> {
}
