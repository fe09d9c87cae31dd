package com.ivamare.connect.document;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@link Document} over a plain field map.
 */
public class MapDocument implements Document {

    private final String entityType;
    private final String id;
    private final Map<String, Object> fields;

    public MapDocument(String entityType, String id, Map<String, Object> fields) {
        this.entityType = entityType;
        this.id = id;
        this.fields = new LinkedHashMap<>(fields != null ? fields : Map.of());
    }

    @Override
    public String entityType() {
        return entityType;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public Object get(String field) {
        return fields.get(field);
    }

    @Override
    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(fields);
    }

    public void set(String field, Object value) {
        fields.put(field, value);
    }

    @Override
    public String toString() {
        return "MapDocument[" + entityType + " " + id + "]";
    }
}
