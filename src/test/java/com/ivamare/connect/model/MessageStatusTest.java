package com.ivamare.connect.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MessageStatus")
class MessageStatusTest {

    @Test
    @DisplayName("should treat Delivered, Processed and Skipped as completed")
    void shouldDefineCompletedStatuses() {
        assertEquals(Set.of(MessageStatus.DELIVERED, MessageStatus.PROCESSED, MessageStatus.SKIPPED),
            MessageStatus.completedStatuses());
        assertFalse(MessageStatus.FAILED.isCompleted());
        assertFalse(MessageStatus.DEAD_LETTER.isCompleted());
    }

    @Test
    @DisplayName("should treat every status but Pending as terminal")
    void shouldDefineTerminalStatuses() {
        assertFalse(MessageStatus.PENDING.isTerminal());
        assertTrue(MessageStatus.FAILED.isTerminal());
        assertTrue(MessageStatus.DEAD_LETTER.isTerminal());
    }

    @Test
    @DisplayName("should parse stored values")
    void shouldParseValues() {
        assertEquals(MessageStatus.DEAD_LETTER, MessageStatus.fromValue("Dead Letter"));
        assertThrows(IllegalArgumentException.class, () -> MessageStatus.fromValue("DEAD_LETTER"));
    }
}
