package com.docflow.workflow.gateway;

import java.util.Optional;

/**
 * Document access the workflow engine needs. Storage of documents is
 * owned elsewhere; the engine only reads fields and writes the workflow
 * status field back.
 */
public interface DocumentGateway {

    Optional<DocumentSnapshot> find(String documentId);

    void updateStatus(String documentId, String status);
}
