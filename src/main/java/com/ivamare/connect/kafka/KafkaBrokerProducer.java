package com.ivamare.connect.kafka;

import com.ivamare.connect.exception.TransportException;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link BrokerProducer} over a Kafka {@link Producer}. Thread safe.
 */
public class KafkaBrokerProducer implements BrokerProducer {

    private static final Logger log = LoggerFactory.getLogger(KafkaBrokerProducer.class);

    private final Producer<String, byte[]> producer;
    private final Duration deliveryTimeout;

    public KafkaBrokerProducer(Producer<String, byte[]> producer, Duration deliveryTimeout) {
        this.producer = producer;
        this.deliveryTimeout = deliveryTimeout;
    }

    @Override
    public DeliveryResult produce(String topic, String key, byte[] value, Map<String, byte[]> headers) {
        ProducerRecord<String, byte[]> record = new ProducerRecord<>(topic, key, value);
        if (headers != null) {
            headers.forEach((name, headerValue) -> record.headers().add(name, headerValue));
        }

        try {
            RecordMetadata metadata = producer.send(record).get(deliveryTimeout.toMillis(), TimeUnit.MILLISECONDS);
            log.debug("Delivered to {}/{}@{}", metadata.topic(), metadata.partition(), metadata.offset());
            return new DeliveryResult(metadata.topic(), metadata.partition(), metadata.offset());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("Interrupted while producing to " + topic, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new TransportException("Delivery to " + topic + " failed: " + cause.getMessage(), cause);
        } catch (TimeoutException e) {
            throw new TransportException("Delivery to " + topic + " timed out after " + deliveryTimeout, e);
        } catch (org.apache.kafka.common.KafkaException e) {
            throw new TransportException("Producer error for " + topic + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        producer.close(Duration.ofSeconds(10));
    }
}
