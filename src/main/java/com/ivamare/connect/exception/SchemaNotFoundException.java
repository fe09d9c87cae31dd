package com.ivamare.connect.exception;

/**
 * Raised when a schema misses in every resolution tier.
 */
public class SchemaNotFoundException extends ConnectException {

    private final String schemaName;

    public SchemaNotFoundException(String schemaName) {
        super("Schema not found: " + schemaName);
        this.schemaName = schemaName;
    }

    public SchemaNotFoundException(String schemaName, Throwable cause) {
        super("Schema not found: " + schemaName, cause);
        this.schemaName = schemaName;
    }

    public String getSchemaName() {
        return schemaName;
    }
}
