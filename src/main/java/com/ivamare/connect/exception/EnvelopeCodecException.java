package com.ivamare.connect.exception;

/**
 * Raised when the outer envelope cannot be encoded or decoded.
 */
public class EnvelopeCodecException extends ConnectException {

    public EnvelopeCodecException(String message) {
        super(message);
    }

    public EnvelopeCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
