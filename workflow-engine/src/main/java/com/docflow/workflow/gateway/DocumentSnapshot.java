package com.docflow.workflow.gateway;

import java.util.Map;

/**
 * Read-only view of a document as the engine sees it: identity, type and
 * the field values conditions and field-based routing read.
 */
public record DocumentSnapshot(String documentId, String documentType, String title, Map<String, Object> fields) {

    public DocumentSnapshot {
        fields = fields == null ? Map.of() : Map.copyOf(fields);
    }

    /** Field value, or null when the document has no such field. */
    public Object field(String name) {
        return name == null ? null : fields.get(name);
    }

    /** Field value as a string; missing fields read as "". */
    public String fieldAsString(String name) {
        Object value = field(name);
        return value == null ? "" : value.toString();
    }
}
