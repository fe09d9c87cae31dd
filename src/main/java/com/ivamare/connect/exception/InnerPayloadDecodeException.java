package com.ivamare.connect.exception;

/**
 * Raised when the inner payload bytes cannot be decoded against their named schema.
 *
 * <p>Terminal for the consumed message: it is dead-lettered and its offset is committed.
 */
public class InnerPayloadDecodeException extends ConnectException {

    private final String schemaName;

    public InnerPayloadDecodeException(String schemaName, Throwable cause) {
        super("Failed to decode inner payload with schema " + schemaName + ": " + cause.getMessage(), cause);
        this.schemaName = schemaName;
    }

    public String getSchemaName() {
        return schemaName;
    }
}
