package com.ivamare.connect.kafka;

import com.ivamare.connect.exception.TransportException;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRebalanceListener;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.header.Header;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link BrokerConsumer} over a Kafka {@link Consumer}.
 *
 * <p>Records of one Kafka poll are buffered and handed out one at a time. Buffered
 * records of revoked partitions are dropped on rebalance, so they are redelivered to
 * the new owner instead of being processed here with an uncommittable offset.
 */
public class KafkaBrokerConsumer implements BrokerConsumer {

    private static final Logger log = LoggerFactory.getLogger(KafkaBrokerConsumer.class);

    private final Consumer<String, byte[]> consumer;
    private final Deque<ConsumerRecord<String, byte[]>> buffer = new ArrayDeque<>();

    public KafkaBrokerConsumer(Consumer<String, byte[]> consumer) {
        this.consumer = consumer;
    }

    @Override
    public void subscribe(List<String> topics) {
        consumer.subscribe(topics, new ConsumerRebalanceListener() {
            @Override
            public void onPartitionsRevoked(Collection<TopicPartition> partitions) {
                buffer.removeIf(r -> partitions.contains(new TopicPartition(r.topic(), r.partition())));
                log.info("Partitions revoked: {}", partitions);
            }

            @Override
            public void onPartitionsAssigned(Collection<TopicPartition> partitions) {
                log.info("Partitions assigned: {}", partitions);
            }
        });
        log.info("Subscribed to {}", topics);
    }

    @Override
    public PollResult poll(Duration timeout) {
        if (buffer.isEmpty()) {
            try {
                ConsumerRecords<String, byte[]> records = consumer.poll(timeout);
                records.forEach(buffer::add);
            } catch (KafkaException e) {
                return new PollResult.Error(e.getMessage(), e);
            }
        }

        ConsumerRecord<String, byte[]> record = buffer.poll();
        if (record == null) {
            return PollResult.empty();
        }

        Map<String, byte[]> headers = new LinkedHashMap<>();
        for (Header header : record.headers()) {
            headers.put(header.key(), header.value());
        }
        return new PollResult.Message(new ConsumedMessage(
            record.topic(), record.partition(), record.offset(), record.key(), record.value(), headers));
    }

    @Override
    public void commit(ConsumedMessage message) {
        try {
            consumer.commitSync(Map.of(
                new TopicPartition(message.topic(), message.partition()),
                new OffsetAndMetadata(message.offset() + 1)
            ));
        } catch (KafkaException e) {
            throw new TransportException("Offset commit failed for " + message + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        buffer.clear();
        consumer.close(Duration.ofSeconds(10));
        log.info("Consumer closed");
    }
}
