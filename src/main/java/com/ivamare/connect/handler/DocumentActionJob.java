package com.ivamare.connect.handler;

import com.ivamare.connect.document.Document;
import com.ivamare.connect.document.DocumentStore;
import com.ivamare.connect.exception.CorrelationFieldMissingException;
import com.ivamare.connect.exception.TargetDocumentNotFoundException;
import com.ivamare.connect.exception.ValidationException;
import com.ivamare.connect.job.ConnectJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Background job running create and update document actions.
 */
public class DocumentActionJob {

    public static final String JOB_NAME = "document-action";

    static final String CREATE = "create";
    static final String UPDATE = "update";

    private static final Logger log = LoggerFactory.getLogger(DocumentActionJob.class);

    private final DocumentStore documentStore;

    public DocumentActionJob(DocumentStore documentStore) {
        this.documentStore = documentStore;
    }

    public static Map<String, Object> createArgs(String entityType, Map<String, String> fieldMappings,
                                                 Map<String, Object> payload) {
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("actionType", CREATE);
        args.put("entityType", entityType);
        args.put("fieldMappings", fieldMappings);
        args.put("payload", payload);
        return args;
    }

    public static Map<String, Object> updateArgs(String entityType, Map<String, String> fieldMappings,
                                                 String correlationField, Map<String, Object> payload) {
        Map<String, Object> args = createArgs(entityType, fieldMappings, payload);
        args.put("actionType", UPDATE);
        args.put("correlationField", correlationField);
        return args;
    }

    @ConnectJob(JOB_NAME)
    @SuppressWarnings("unchecked")
    public void run(Map<String, Object> args) {
        String actionType = (String) args.get("actionType");
        String entityType = (String) args.get("entityType");
        Map<String, String> fieldMappings = (Map<String, String>) args.getOrDefault("fieldMappings", Map.of());
        Map<String, Object> payload = (Map<String, Object>) args.getOrDefault("payload", Map.of());

        Map<String, Object> values = new LinkedHashMap<>();
        fieldMappings.forEach((target, path) -> values.put(target, DocumentPaths.resolve(payload, path)));

        if (CREATE.equals(actionType)) {
            Document created = documentStore.create(entityType, values);
            log.info("Document created {}", created.ref());
        } else if (UPDATE.equals(actionType)) {
            update(entityType, (String) args.get("correlationField"), values, payload);
        } else {
            throw new ValidationException("actionType", "unknown document action " + actionType);
        }
    }

    private void update(String entityType, String correlationField, Map<String, Object> values,
                        Map<String, Object> payload) {
        if (correlationField == null || correlationField.isBlank()) {
            throw new CorrelationFieldMissingException("No correlation field configured for update of " + entityType);
        }

        Object correlationValue = payload.get(correlationField);
        if (correlationValue == null || "".equals(correlationValue)) {
            throw new CorrelationFieldMissingException(
                "Correlation field " + correlationField + " not found in payload for update of " + entityType);
        }

        Map<String, Object> filter = Map.of(correlationField, correlationValue);
        Document target = documentStore.findOne(entityType, filter)
            .orElseThrow(() -> new TargetDocumentNotFoundException(entityType, filter));

        documentStore.update(entityType, target.id(), values);
        log.info("Document updated {}", target.ref());
    }
}
