package com.ivamare.connect.document;

import com.ivamare.connect.exception.ValidationException;

/**
 * Identity of a document, carried by deferred jobs instead of the document itself.
 *
 * @param entityType Document type
 * @param id Document id
 */
public record DocumentRef(String entityType, String id) {

    public DocumentRef {
        if (entityType == null || entityType.isBlank()) {
            throw new ValidationException("entityType", "is required");
        }
        if (id == null || id.isBlank()) {
            throw new ValidationException("id", "is required");
        }
    }

    @Override
    public String toString() {
        return entityType + " " + id;
    }
}
