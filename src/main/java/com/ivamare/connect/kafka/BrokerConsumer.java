package com.ivamare.connect.kafka;

import java.time.Duration;
import java.util.List;

/**
 * Port for reading messages from the broker. Not thread safe: one loop owns an instance.
 */
public interface BrokerConsumer extends AutoCloseable {

    void subscribe(List<String> topics);

    /**
     * Wait up to the timeout for the next message.
     */
    PollResult poll(Duration timeout);

    /**
     * Synchronously commit the offset following a processed message.
     *
     * @throws com.ivamare.connect.exception.TransportException if the commit fails
     */
    void commit(ConsumedMessage message);

    @Override
    void close();
}
