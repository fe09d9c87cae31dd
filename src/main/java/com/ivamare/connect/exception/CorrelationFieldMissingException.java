package com.ivamare.connect.exception;

/**
 * Raised by an update action whose correlation field is unconfigured or absent from the payload.
 */
public class CorrelationFieldMissingException extends ConnectException {

    public CorrelationFieldMissingException(String message) {
        super(message);
    }
}
