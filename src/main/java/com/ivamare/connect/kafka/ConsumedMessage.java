package com.ivamare.connect.kafka;

import java.util.Map;

/**
 * A message read from the broker.
 *
 * @param topic Source topic
 * @param partition Source partition
 * @param offset Offset within the partition
 * @param key Message key (nullable)
 * @param value Raw value bytes (nullable for tombstones)
 * @param headers Message headers
 */
public record ConsumedMessage(
    String topic,
    int partition,
    long offset,
    String key,
    byte[] value,
    Map<String, byte[]> headers
) {
    public ConsumedMessage {
        headers = headers != null ? Map.copyOf(headers) : Map.of();
    }

    @Override
    public String toString() {
        return "ConsumedMessage[" + topic + "/" + partition + "@" + offset + "]";
    }
}
