package com.ivamare.connect.exception;

import java.io.PrintWriter;
import java.io.StringWriter;

/**
 * Formats throwables for the message log.
 */
public final class ErrorTraces {

    private ErrorTraces() {
        // Utility class - no instantiation
    }

    /**
     * Full stack trace as text.
     */
    public static String stackTrace(Throwable t) {
        StringWriter writer = new StringWriter();
        t.printStackTrace(new PrintWriter(writer));
        return writer.toString();
    }

    /**
     * Message of the throwable, falling back to its class name.
     */
    public static String message(Throwable t) {
        return t.getMessage() != null ? t.getMessage() : t.getClass().getName();
    }
}
