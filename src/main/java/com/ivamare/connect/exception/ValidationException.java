package com.ivamare.connect.exception;

/**
 * Raised for malformed configuration or arguments (rules, mappings, handlers, empty key inputs).
 *
 * <p>Fatal to the rule, handler or action it concerns only.
 */
public class ValidationException extends ConnectException {

    private final String field;

    public ValidationException(String message) {
        this(null, message);
    }

    public ValidationException(String field, String message) {
        super(field != null ? field + ": " + message : message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
