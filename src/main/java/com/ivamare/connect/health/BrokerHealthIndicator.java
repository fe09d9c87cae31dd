package com.ivamare.connect.health;

import com.ivamare.connect.kafka.BrokerProbe;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

import java.time.Duration;

/**
 * Health indicator for broker reachability.
 */
public class BrokerHealthIndicator implements HealthIndicator {

    private final BrokerProbe probe;
    private final String bootstrapServers;
    private final Duration timeout;

    public BrokerHealthIndicator(BrokerProbe probe, String bootstrapServers, Duration timeout) {
        this.probe = probe;
        this.bootstrapServers = bootstrapServers;
        this.timeout = timeout;
    }

    @Override
    public Health health() {
        try {
            int brokers = probe.availableBrokers(timeout);
            Health.Builder builder = brokers > 0 ? Health.up() : Health.down();
            return builder
                .withDetail("bootstrapServers", bootstrapServers)
                .withDetail("brokers", brokers)
                .build();
        } catch (Exception e) {
            return Health.down()
                .withDetail("bootstrapServers", bootstrapServers)
                .withDetail("error", e.getMessage())
                .build();
        }
    }
}
