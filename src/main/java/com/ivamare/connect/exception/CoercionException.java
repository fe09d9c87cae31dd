package com.ivamare.connect.exception;

/**
 * Raised when a resolved value cannot satisfy the declared field type.
 */
public class CoercionException extends ConnectException {

    private final String targetField;

    public CoercionException(String targetField, String message) {
        super("Field '" + targetField + "': " + message);
        this.targetField = targetField;
    }

    public CoercionException(String targetField, String message, Throwable cause) {
        super("Field '" + targetField + "': " + message, cause);
        this.targetField = targetField;
    }

    public String getTargetField() {
        return targetField;
    }
}
