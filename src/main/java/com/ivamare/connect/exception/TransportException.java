package com.ivamare.connect.exception;

/**
 * Broker or schema registry network failure. Retryable.
 */
public class TransportException extends ConnectException {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
