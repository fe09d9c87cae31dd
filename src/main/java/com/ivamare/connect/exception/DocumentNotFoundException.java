package com.ivamare.connect.exception;

/**
 * Raised when a referenced document does not exist.
 */
public class DocumentNotFoundException extends ConnectException {

    private final String entityType;
    private final String entityId;

    public DocumentNotFoundException(String entityType, String entityId) {
        super("Document not found: " + entityType + " " + entityId);
        this.entityType = entityType;
        this.entityId = entityId;
    }

    public String getEntityType() {
        return entityType;
    }

    public String getEntityId() {
        return entityId;
    }
}
