package com.ivamare.connect.health;

import com.ivamare.connect.consumer.ConsumerLoop;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

/**
 * Health indicator for the consumer loop.
 *
 * <p>Down when the loop is stopped or has hit five consecutive errors.
 */
public class ConsumerHealthIndicator implements HealthIndicator {

    static final int ERROR_THRESHOLD = 5;

    private final ConsumerLoop consumerLoop;

    public ConsumerHealthIndicator(ConsumerLoop consumerLoop) {
        this.consumerLoop = consumerLoop;
    }

    @Override
    public Health health() {
        if (consumerLoop == null) {
            return Health.unknown()
                .withDetail("message", "No consumer configured")
                .build();
        }

        ConsumerStatus status = new ConsumerStatus(
            consumerLoop.isRunning(),
            consumerLoop.processedCount(),
            consumerLoop.consecutiveErrors()
        );

        boolean healthy = status.running() && status.consecutiveErrors() < ERROR_THRESHOLD;
        Health.Builder builder = healthy ? Health.up() : Health.down();

        builder
            .withDetail("topics", consumerLoop.topics())
            .withDetail("consumer", status);
        if (consumerLoop.lastPollAt() != null) {
            builder.withDetail("lastPollAt", consumerLoop.lastPollAt().toString());
        }
        return builder.build();
    }

    record ConsumerStatus(boolean running, long processed, int consecutiveErrors) {}
}
