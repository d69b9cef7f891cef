package com.docflow.workflow.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Local store of the documents that workflows run against.
 *
 * Field values are kept as strings; the condition evaluator coerces
 * them to numbers where an operator needs one.
 *
 * DB table: documents
 */
@Entity
@Table(name = "documents")
public class DocumentRecord {

    @Id
    @Column(name = "document_id")
    private String documentId;

    @Column(name = "document_type", nullable = false)
    private String documentType;

    @Column
    private String title;

    @Column(name = "workflow_status")
    private String workflowStatus;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "document_fields", joinColumns = @JoinColumn(name = "document_id"))
    @MapKeyColumn(name = "field_name")
    @Column(name = "field_value", columnDefinition = "TEXT")
    private Map<String, String> fields = new LinkedHashMap<>();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    protected DocumentRecord() {}   // required by JPA

    public DocumentRecord(String documentId, String documentType, String title, Map<String, String> fields) {
        this.documentId   = documentId;
        this.documentType = documentType;
        this.title        = title;
        this.fields.putAll(fields);
    }

    public String              getDocumentId()     { return documentId; }
    public String              getDocumentType()   { return documentType; }
    public String              getTitle()          { return title; }
    public String              getWorkflowStatus() { return workflowStatus; }
    public Map<String, String> getFields()         { return fields; }
    public Instant             getUpdatedAt()      { return updatedAt; }

    public void setWorkflowStatus(String workflowStatus) { this.workflowStatus = workflowStatus; }
}
