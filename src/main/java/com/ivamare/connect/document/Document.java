package com.ivamare.connect.document;

import java.util.Map;

/**
 * Read handle on a host business document.
 */
public interface Document {

    /**
     * Document type, e.g. "Customer".
     */
    String entityType();

    /**
     * Document identifier, unique within its type.
     */
    String id();

    /**
     * Read a field by name.
     *
     * @param field the field name
     * @return the value, or null if absent
     */
    Object get(String field);

    /**
     * All fields as a read-only map, used as the {@code doc} expression binding.
     */
    Map<String, Object> asMap();

    default DocumentRef ref() {
        return new DocumentRef(entityType(), id());
    }
}
