package com.ivamare.connect.kafka;

import java.util.Map;

/**
 * Port for writing messages to the broker.
 */
public interface BrokerProducer extends AutoCloseable {

    /**
     * Write a message and block until the broker acknowledges it.
     *
     * @param topic target topic
     * @param key message key
     * @param value message bytes
     * @param headers message headers, may be empty
     * @return where the message landed
     * @throws com.ivamare.connect.exception.TransportException if the write fails or times out
     */
    DeliveryResult produce(String topic, String key, byte[] value, Map<String, byte[]> headers);

    @Override
    void close();
}
