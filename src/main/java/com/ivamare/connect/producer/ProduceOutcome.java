package com.ivamare.connect.producer;

/**
 * Result of a production attempt.
 */
public enum ProduceOutcome {
    /** The message was acknowledged by the broker. */
    DELIVERED,
    /** A completed entry already exists for the key; nothing was sent. */
    DUPLICATE_SUPPRESSED
}
