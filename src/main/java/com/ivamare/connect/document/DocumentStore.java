package com.ivamare.connect.document;

import java.util.Map;
import java.util.Optional;

/**
 * Host document layer, supplied by the application.
 *
 * <p>Calls are synchronous. Failures such as missing permissions propagate
 * to the caller and end up as a Failed message log status.
 */
public interface DocumentStore {

    /**
     * Load a document by identity.
     *
     * @param entityType Document type
     * @param id Document id
     * @return the document, or empty if it no longer exists
     */
    Optional<Document> find(String entityType, String id);

    /**
     * Find the first document whose fields equal every filter entry.
     *
     * @param entityType Document type
     * @param filter field equality filter
     * @return the first match, or empty
     */
    Optional<Document> findOne(String entityType, Map<String, Object> filter);

    /**
     * Create a document.
     *
     * @param entityType Document type
     * @param values initial field values
     * @return the created document
     */
    Document create(String entityType, Map<String, Object> values);

    /**
     * Set fields on an existing document and save it.
     *
     * @param entityType Document type
     * @param id Document id
     * @param values fields to set
     * @return the updated document
     * @throws com.ivamare.connect.exception.DocumentNotFoundException if the document does not exist
     */
    Document update(String entityType, String id, Map<String, Object> values);
}
