package com.docflow.workflow.repository;

import com.docflow.workflow.model.DocumentRecord;
import org.springframework.data.jpa.repository.JpaRepository;

public interface DocumentRecordRepository extends JpaRepository<DocumentRecord, String> {
}
