package com.ivamare.connect.kafka;

/**
 * Broker acknowledgment of a produced message.
 *
 * @param topic Topic written to
 * @param partition Partition assigned
 * @param offset Offset assigned
 */
public record DeliveryResult(String topic, int partition, long offset) {}
