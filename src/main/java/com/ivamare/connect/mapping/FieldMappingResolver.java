package com.ivamare.connect.mapping;

import com.ivamare.connect.document.Document;
import com.ivamare.connect.exception.CoercionException;
import com.ivamare.connect.expression.Evaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds a typed payload from a document and an ordered list of field mappings.
 *
 * <p>A failure on a nullable mapping yields null for that field. A failure on a
 * non-nullable mapping aborts the whole build, so partial payloads are never returned.
 */
public class FieldMappingResolver {

    private static final Logger log = LoggerFactory.getLogger(FieldMappingResolver.class);

    private final Evaluator evaluator;
    private final MethodRegistry methodRegistry;

    public FieldMappingResolver(Evaluator evaluator, MethodRegistry methodRegistry) {
        this.evaluator = evaluator;
        this.methodRegistry = methodRegistry;
    }

    /**
     * Resolve every mapping against the document.
     *
     * @param doc the source document
     * @param mappings mappings in payload field order
     * @return payload keyed by target field, values may be null
     * @throws RuntimeException the first failure of a non-nullable mapping
     */
    public Map<String, Object> buildPayload(Document doc, List<FieldMapping> mappings) {
        Map<String, Object> payload = new LinkedHashMap<>();

        for (FieldMapping mapping : mappings) {
            try {
                payload.put(mapping.targetField(), resolve(doc, mapping));
            } catch (RuntimeException e) {
                if (!mapping.nullable()) {
                    log.error("Field mapping resolution failed for {} on {}: {}",
                        mapping.targetField(), doc.ref(), e.getMessage());
                    throw e;
                }
                log.warn("Field mapping resolution failed for nullable {} on {}, using null: {}",
                    mapping.targetField(), doc.ref(), e.getMessage());
                payload.put(mapping.targetField(), null);
            }
        }

        return payload;
    }

    private Object resolve(Document doc, FieldMapping mapping) {
        Object value = resolveSource(doc, mapping);

        if (isEmpty(value) && mapping.defaultValue() != null) {
            value = mapping.defaultValue();
        }

        if (value == null) {
            if (mapping.nullable()) {
                return null;
            }
            throw new CoercionException(mapping.targetField(),
                "value is absent but field is not nullable (type=" + mapping.type().getValue() + ")");
        }

        return ValueCoercer.coerce(mapping.targetField(), mapping.type(), value);
    }

    private Object resolveSource(Document doc, FieldMapping mapping) {
        MappingSource source = mapping.source();
        if (source instanceof MappingSource.FieldSource field) {
            return doc.get(field.field());
        }
        if (source instanceof MappingSource.ExpressionSource expression) {
            return evaluator.evaluate(expression.expression(), Map.of("doc", doc.asMap()));
        }
        if (source instanceof MappingSource.StaticSource literal) {
            return literal.value();
        }
        if (source instanceof MappingSource.MethodSource method) {
            MappingMethod function = methodRegistry.getOrThrow(method.methodName());
            try {
                return function.apply(doc);
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new CoercionException(mapping.targetField(),
                    "method " + method.methodName() + " failed: " + e.getMessage(), e);
            }
        }
        throw new IllegalStateException("Unhandled mapping source: " + source);
    }

    private static boolean isEmpty(Object value) {
        return value == null || (value instanceof CharSequence text && text.length() == 0);
    }
}
