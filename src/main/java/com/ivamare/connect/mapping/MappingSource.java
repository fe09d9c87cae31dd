package com.ivamare.connect.mapping;

import com.ivamare.connect.exception.ValidationException;

/**
 * Where a mapped field takes its raw value from. Exactly one variant per mapping.
 */
public sealed interface MappingSource
        permits MappingSource.FieldSource, MappingSource.ExpressionSource,
                MappingSource.StaticSource, MappingSource.MethodSource {

    /**
     * Direct read of a document field.
     */
    record FieldSource(String field) implements MappingSource {
        public FieldSource {
            requireNonBlank("field", field);
        }
    }

    /**
     * Sandboxed expression over the document, bound as {@code doc}.
     */
    record ExpressionSource(String expression) implements MappingSource {
        public ExpressionSource {
            requireNonBlank("expression", expression);
        }
    }

    /**
     * Literal value.
     */
    record StaticSource(String value) implements MappingSource {}

    /**
     * Named pure function from the {@link MethodRegistry}, invoked with the document.
     */
    record MethodSource(String methodName) implements MappingSource {
        public MethodSource {
            requireNonBlank("methodName", methodName);
        }
    }

    private static void requireNonBlank(String name, String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(name, "is required");
        }
    }
}
