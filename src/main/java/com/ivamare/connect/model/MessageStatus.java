package com.ivamare.connect.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Status of a message log entry.
 *
 * <p>An entry is created {@link #PENDING} and receives exactly one terminal status.
 */
public enum MessageStatus {
    /** Attempt in progress */
    PENDING("Pending"),

    /** Produced message acknowledged by the broker */
    DELIVERED("Delivered"),

    /** Consumed message dispatched to its handler */
    PROCESSED("Processed"),

    /** Attempt failed, may be retried under a new entry */
    FAILED("Failed"),

    /** Consumed message that can never be processed */
    DEAD_LETTER("Dead Letter"),

    /** No handler, or the handler guard was falsy */
    SKIPPED("Skipped");

    private static final Set<MessageStatus> COMPLETED = EnumSet.of(DELIVERED, PROCESSED, SKIPPED);

    private final String value;

    MessageStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return this != PENDING;
    }

    /**
     * Whether a prior entry in this status suppresses a new attempt with the same key.
     */
    public boolean isCompleted() {
        return COMPLETED.contains(this);
    }

    /**
     * Statuses that count as "already done" for the dedup check.
     */
    public static Set<MessageStatus> completedStatuses() {
        return COMPLETED;
    }

    public static MessageStatus fromValue(String value) {
        for (MessageStatus status : values()) {
            if (status.value.equals(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown MessageStatus: " + value);
    }
}
