package com.ivamare.connect;

import com.ivamare.connect.consumer.ConsumerLoop;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;

import jakarta.annotation.PreDestroy;
import java.time.Duration;

/**
 * Auto-start configuration for the consumer loop.
 *
 * <p>Enable with:
 * <pre>
 * connect:
 *   consumer:
 *     auto-start: true
 * </pre>
 */
@AutoConfiguration(after = ConnectAutoConfiguration.class)
@ConditionalOnProperty(prefix = "connect.consumer", name = "auto-start", havingValue = "true")
@ConditionalOnBean(ConsumerLoop.class)
public class ConsumerAutoStartConfiguration {

    private static final Logger log = LoggerFactory.getLogger(ConsumerAutoStartConfiguration.class);

    private final ConsumerLoop consumerLoop;
    private final ConnectProperties properties;

    public ConsumerAutoStartConfiguration(ConsumerLoop consumerLoop, ConnectProperties properties) {
        this.consumerLoop = consumerLoop;
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void startConsumer() {
        log.info("Auto-starting consumer for topics {}", consumerLoop.topics());
        consumerLoop.start();
    }

    @PreDestroy
    public void stopConsumer() {
        if (!consumerLoop.isRunning()) {
            return;
        }
        log.info("Stopping consumer...");
        consumerLoop.stop(properties.getConsumer().getPollTimeout().plus(Duration.ofSeconds(5)));
        log.info("Consumer stopped");
    }
}
