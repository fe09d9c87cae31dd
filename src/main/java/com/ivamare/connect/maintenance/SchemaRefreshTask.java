package com.ivamare.connect.maintenance;

import com.ivamare.connect.schema.SchemaResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Periodic pre-warm of the schema cache from the registry.
 */
public class SchemaRefreshTask {

    private static final Logger log = LoggerFactory.getLogger(SchemaRefreshTask.class);

    private final SchemaResolver schemaResolver;

    public SchemaRefreshTask(SchemaResolver schemaResolver) {
        this.schemaResolver = schemaResolver;
    }

    /**
     * @return number of schemas refreshed
     */
    public int run() {
        try {
            return schemaResolver.refreshAll();
        } catch (RuntimeException e) {
            log.error("Schema refresh failed: {}", e.getMessage(), e);
            return 0;
        }
    }
}
