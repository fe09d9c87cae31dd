package com.ivamare.connect.exception;

/**
 * Base exception for all Connect bridge errors.
 */
public class ConnectException extends RuntimeException {

    public ConnectException(String message) {
        super(message);
    }

    public ConnectException(String message, Throwable cause) {
        super(message, cause);
    }
}
