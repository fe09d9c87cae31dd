package com.ivamare.connect.consumer;

import com.ivamare.connect.kafka.BrokerConsumer;
import com.ivamare.connect.kafka.ConsumedMessage;
import com.ivamare.connect.kafka.PollResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Single-threaded poll loop over the inbound topics.
 *
 * <p>Each message is processed to completion and its offset committed before the next poll.
 * The {@code running} flag is checked between polls, so stopping takes at most one poll timeout.
 */
public class ConsumerLoop {

    private static final Logger log = LoggerFactory.getLogger(ConsumerLoop.class);

    private final BrokerConsumer consumer;
    private final MessageProcessor processor;
    private final List<String> topics;
    private final Duration pollTimeout;
    private final int maxMessages;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong processedCount = new AtomicLong();
    private final AtomicInteger consecutiveErrors = new AtomicInteger();
    private volatile Instant lastPollAt;
    private volatile Thread thread;

    /**
     * @param maxMessages stop after this many messages; 0 means unlimited
     */
    public ConsumerLoop(BrokerConsumer consumer, MessageProcessor processor, List<String> topics,
                        Duration pollTimeout, int maxMessages) {
        this.consumer = consumer;
        this.processor = processor;
        this.topics = List.copyOf(topics);
        this.pollTimeout = pollTimeout;
        this.maxMessages = maxMessages;
    }

    /**
     * Start the loop on its own thread.
     */
    public synchronized void start() {
        if (running.get()) {
            log.warn("Consumer loop already running");
            return;
        }
        running.set(true);
        Thread loopThread = new Thread(this::runLoop, "connect-consumer");
        loopThread.setDaemon(true);
        thread = loopThread;
        loopThread.start();
    }

    /**
     * Run the loop on the calling thread until stopped or the message limit is reached.
     */
    public void run() {
        if (running.getAndSet(true)) {
            log.warn("Consumer loop already running");
            return;
        }
        runLoop();
    }

    /**
     * Signal the loop to stop and wait for it to close the consumer.
     */
    public void stop(Duration timeout) {
        running.set(false);
        Thread loopThread = thread;
        if (loopThread != null && loopThread != Thread.currentThread()) {
            try {
                loopThread.join(timeout.toMillis());
                if (loopThread.isAlive()) {
                    log.warn("Consumer loop did not stop within {}", timeout);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public long processedCount() {
        return processedCount.get();
    }

    public int consecutiveErrors() {
        return consecutiveErrors.get();
    }

    public Instant lastPollAt() {
        return lastPollAt;
    }

    public List<String> topics() {
        return topics;
    }

    private void runLoop() {
        log.info("Starting consumer loop topics={} maxMessages={}", topics, maxMessages);
        try {
            consumer.subscribe(topics);
            while (running.get()) {
                if (maxMessages > 0 && processedCount.get() >= maxMessages) {
                    log.info("Reached max messages ({}), stopping", maxMessages);
                    break;
                }
                pollOnce();
            }
        } catch (RuntimeException e) {
            log.error("Consumer loop terminated: {}", e.getMessage(), e);
        } finally {
            running.set(false);
            closeConsumer();
            log.info("Consumer loop stopped after {} messages", processedCount.get());
        }
    }

    private void pollOnce() {
        PollResult result = consumer.poll(pollTimeout);
        lastPollAt = Instant.now();

        if (result instanceof PollResult.Message message) {
            handle(message.message());
        } else if (result instanceof PollResult.Error error) {
            int errors = consecutiveErrors.incrementAndGet();
            log.warn("Consumer poll error (count={}): {}", errors, error.message());
        } else if (result instanceof PollResult.EndOfPartition eof) {
            log.debug("Reached end of {}/{} at offset {}", eof.topic(), eof.partition(), eof.offset());
        }
    }

    private void handle(ConsumedMessage message) {
        ProcessOutcome outcome = processor.process(message);
        log.debug("Processed {} -> {}", message, outcome);
        try {
            consumer.commit(message);
            consecutiveErrors.set(0);
        } catch (RuntimeException e) {
            int errors = consecutiveErrors.incrementAndGet();
            log.error("Offset commit failed for {} (count={}): {}", message, errors, e.getMessage());
        }
        processedCount.incrementAndGet();
    }

    private void closeConsumer() {
        try {
            consumer.close();
        } catch (RuntimeException e) {
            log.warn("Error closing consumer: {}", e.getMessage());
        }
    }
}
