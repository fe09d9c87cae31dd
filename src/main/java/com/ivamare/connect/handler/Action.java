package com.ivamare.connect.handler;

import com.ivamare.connect.exception.ValidationException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One step of an event handler.
 *
 * <p>Each variant is dispatched as a background job on its own queue.
 */
public sealed interface Action {

    boolean enabled();

    /**
     * Queue for the dispatched job; null means the default queue.
     */
    String queue();

    /**
     * Short label for logs.
     */
    String describe();

    /**
     * Run a named job with {@code context = {payload, envelope}}.
     */
    record SyncJobAction(String jobName, String queue, boolean enabled) implements Action {
        public SyncJobAction {
            requireText("jobName", jobName);
        }

        public static SyncJobAction of(String jobName) {
            return new SyncJobAction(jobName, null, true);
        }

        @Override
        public String describe() {
            return "sync job " + jobName;
        }
    }

    /**
     * Call a named job method with {@code payload} and {@code envelope} arguments.
     */
    record MethodCallAction(String methodName, String queue, boolean enabled) implements Action {
        public MethodCallAction {
            requireText("methodName", methodName);
        }

        public static MethodCallAction of(String methodName) {
            return new MethodCallAction(methodName, null, true);
        }

        @Override
        public String describe() {
            return "method call " + methodName;
        }
    }

    /**
     * Create a document from payload values.
     *
     * @param entityType Target document type
     * @param fieldMappings Target field to dotted payload path
     */
    record CreateDocumentAction(
        String entityType,
        Map<String, String> fieldMappings,
        String queue,
        boolean enabled
    ) implements Action {
        public CreateDocumentAction {
            requireText("entityType", entityType);
            fieldMappings = copy(fieldMappings);
        }

        @Override
        public String describe() {
            return "create " + entityType;
        }
    }

    /**
     * Update the document whose {@code correlationField} equals the payload value of that field.
     *
     * @param entityType Target document type
     * @param fieldMappings Target field to dotted payload path
     * @param correlationField Field used to look up the target (nullable, reported when missing)
     */
    record UpdateDocumentAction(
        String entityType,
        Map<String, String> fieldMappings,
        String correlationField,
        String queue,
        boolean enabled
    ) implements Action {
        public UpdateDocumentAction {
            requireText("entityType", entityType);
            fieldMappings = copy(fieldMappings);
        }

        @Override
        public String describe() {
            return "update " + entityType;
        }
    }

    private static void requireText(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field, "is required");
        }
    }

    private static Map<String, String> copy(Map<String, String> mappings) {
        return mappings == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(mappings));
    }
}
