package com.ivamare.connect.handler;

import java.util.Map;

/**
 * Dotted path lookup in nested maps, e.g. {@code client.name}.
 */
public final class DocumentPaths {

    private DocumentPaths() {
        // Utility class - no instantiation
    }

    /**
     * Resolve a dotted path.
     *
     * @return the value, or null when any segment is missing or not a map
     */
    public static Object resolve(Map<String, ?> data, String path) {
        Object current = data;
        for (String part : path.split("\\.")) {
            if (!(current instanceof Map<?, ?> map)) {
                return null;
            }
            current = map.get(part);
        }
        return current;
    }
}
