package com.docflow.workflow.gateway;

import com.docflow.workflow.exception.WorkflowNotFoundException;
import com.docflow.workflow.model.DocumentRecord;
import com.docflow.workflow.repository.DocumentRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * {@link DocumentGateway} backed by the local documents table.
 */
@Component
public class JpaDocumentGateway implements DocumentGateway {

    private static final Logger log = LoggerFactory.getLogger(JpaDocumentGateway.class);

    private final DocumentRecordRepository documents;

    public JpaDocumentGateway(DocumentRecordRepository documents) {
        this.documents = documents;
    }

    @Override
    public Optional<DocumentSnapshot> find(String documentId) {
        return documents.findById(documentId).map(JpaDocumentGateway::toSnapshot);
    }

    @Override
    public void updateStatus(String documentId, String status) {
        DocumentRecord record = documents.findById(documentId)
                .orElseThrow(() -> new WorkflowNotFoundException("Document", documentId));
        record.setWorkflowStatus(status);
        documents.save(record);
        log.info("Document {} status -> {}", documentId, status);
    }

    private static DocumentSnapshot toSnapshot(DocumentRecord record) {
        Map<String, Object> fields = new LinkedHashMap<>(record.getFields());
        fields.putIfAbsent("workflow_status", record.getWorkflowStatus());
        fields.values().removeIf(v -> v == null);
        return new DocumentSnapshot(record.getDocumentId(), record.getDocumentType(), record.getTitle(), fields);
    }
}
