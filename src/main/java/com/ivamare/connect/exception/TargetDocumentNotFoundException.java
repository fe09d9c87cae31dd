package com.ivamare.connect.exception;

import java.util.Map;

/**
 * Raised by an update action when no document matches the correlation filter.
 */
public class TargetDocumentNotFoundException extends ConnectException {

    private final String entityType;
    private final Map<String, Object> filter;

    public TargetDocumentNotFoundException(String entityType, Map<String, Object> filter) {
        super("No " + entityType + " found matching " + filter);
        this.entityType = entityType;
        this.filter = Map.copyOf(filter);
    }

    public String getEntityType() {
        return entityType;
    }

    public Map<String, Object> getFilter() {
        return filter;
    }
}
