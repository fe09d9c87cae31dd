package com.ivamare.connect.exception;

import org.apache.kafka.common.errors.RetriableException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.util.concurrent.TimeoutException;

/**
 * Classifies broker and registry exceptions to determine if they are transient (retryable).
 *
 * <p>Transient exceptions typically indicate temporary conditions that may resolve
 * themselves, such as:
 * <ul>
 *   <li>Kafka retriable errors (leader not available, not enough replicas, request timeouts)</li>
 *   <li>Connection refused or reset</li>
 *   <li>Socket and delivery timeouts</li>
 *   <li>Schema registry 5xx responses</li>
 * </ul>
 *
 * <p>The producer pipeline uses this to tag failures in the message log and
 * the job scheduler uses it to decide whether a failed job is worth retrying.
 */
public final class TransportExceptionClassifier {

    private TransportExceptionClassifier() {
        // Utility class - no instantiation
    }

    /**
     * Message patterns that indicate transient network conditions.
     * These are checked case-insensitively against exception messages.
     */
    private static final String[] TRANSIENT_MESSAGE_PATTERNS = {
        "connection refused",
        "connection reset",
        "connection timed out",
        "socket timeout",
        "read timed out",
        "connect timed out",
        "broken pipe",
        "network is unreachable",
        "host is unreachable",
        "no route to host",
        "broker not available",
        "leader not available",
        "not enough replicas",
        "failed to update metadata",
        "disconnected"
    };

    /**
     * Determine if the exception is transient and should trigger a retry.
     *
     * <p>Checks the exception hierarchy for:
     * <ol>
     *   <li>Our own {@link TransportException}</li>
     *   <li>Kafka {@link RetriableException} subtypes</li>
     *   <li>Spring REST client I/O and 5xx failures</li>
     *   <li>JDK timeout and I/O exceptions</li>
     *   <li>Known transient message patterns</li>
     *   <li>Wrapped cause exceptions (recursive)</li>
     * </ol>
     *
     * @param ex the exception to classify
     * @return true if the exception is transient and should be retried
     */
    public static boolean isTransient(Throwable ex) {
        return !"Unknown".equals(getTransientReason(ex));
    }

    /**
     * Get a brief description of why the exception was classified as transient.
     * Useful for logging.
     *
     * @param ex the exception to describe
     * @return a brief description of the transient condition, or "Unknown" if not transient
     */
    public static String getTransientReason(Throwable ex) {
        if (ex == null) {
            return "Unknown";
        }

        if (ex instanceof TransportException) {
            return "TransportException";
        }
        if (ex instanceof RetriableException) {
            return "Kafka " + ex.getClass().getSimpleName();
        }
        if (ex instanceof ResourceAccessException) {
            return "Registry ResourceAccessException";
        }
        if (ex instanceof HttpServerErrorException serverError) {
            return "Registry HTTP " + serverError.getStatusCode().value();
        }
        if (ex instanceof TimeoutException) {
            return "TimeoutException";
        }
        // Check subclasses before IOException to keep the reason specific
        if (ex instanceof SocketTimeoutException) {
            return "SocketTimeoutException";
        }
        if (ex instanceof java.net.ConnectException) {
            return "java.net.ConnectException";
        }
        if (ex instanceof IOException) {
            return "IOException";
        }

        String message = ex.getMessage();
        if (message != null) {
            String lowerMessage = message.toLowerCase();
            for (String pattern : TRANSIENT_MESSAGE_PATTERNS) {
                if (lowerMessage.contains(pattern)) {
                    return "Message pattern: " + pattern;
                }
            }
        }

        Throwable cause = ex.getCause();
        if (cause != null && cause != ex) {
            return getTransientReason(cause);
        }

        return "Unknown";
    }
}
