package com.ivamare.connect.consumer;

/**
 * What happened to one consumed message.
 */
public enum ProcessOutcome {
    DUPLICATE,
    PROCESSED,
    SKIPPED,
    FAILED,
    DEAD_LETTER
}
