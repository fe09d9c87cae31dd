package com.ivamare.connect.mapping;

import com.ivamare.connect.exception.ValidationException;
import com.ivamare.connect.model.FieldType;

/**
 * Resolves one payload field from a document.
 *
 * @param targetField Payload field name
 * @param type Target primitive type
 * @param nullable Whether a resolution or coercion failure yields null instead of aborting
 * @param defaultValue Applied when the resolved value is null or empty (nullable)
 * @param source Raw value source
 */
public record FieldMapping(
    String targetField,
    FieldType type,
    boolean nullable,
    String defaultValue,
    MappingSource source
) {
    public FieldMapping {
        if (targetField == null || targetField.isBlank()) {
            throw new ValidationException("targetField", "is required");
        }
        if (type == null) {
            throw new ValidationException("type", "is required for " + targetField);
        }
        if (source == null) {
            throw new ValidationException("source", "is required for " + targetField);
        }
    }

    /**
     * Non-nullable mapping of a document field without default.
     */
    public static FieldMapping field(String targetField, FieldType type, String sourceField) {
        return new FieldMapping(targetField, type, false, null, new MappingSource.FieldSource(sourceField));
    }
}
