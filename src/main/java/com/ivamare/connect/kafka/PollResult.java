package com.ivamare.connect.kafka;

/**
 * Outcome of one broker poll.
 */
public sealed interface PollResult
        permits PollResult.Message, PollResult.EndOfPartition, PollResult.Error, PollResult.Empty {

    /**
     * A message to process.
     */
    record Message(ConsumedMessage message) implements PollResult {}

    /**
     * The consumer reached the end of a partition. Not an error.
     */
    record EndOfPartition(String topic, int partition, long offset) implements PollResult {}

    /**
     * The transport reported an error; nothing was consumed.
     */
    record Error(String message, Throwable cause) implements PollResult {}

    /**
     * Nothing arrived within the poll timeout.
     */
    record Empty() implements PollResult {}

    static PollResult empty() {
        return new Empty();
    }
}
