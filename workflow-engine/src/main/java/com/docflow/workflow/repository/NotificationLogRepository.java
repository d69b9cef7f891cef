package com.docflow.workflow.repository;

import com.docflow.workflow.model.NotificationLogEntry;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.UUID;

public interface NotificationLogRepository extends JpaRepository<NotificationLogEntry, UUID> {
}
