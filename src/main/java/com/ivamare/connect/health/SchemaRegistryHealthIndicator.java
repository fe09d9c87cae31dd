package com.ivamare.connect.health;

import com.ivamare.connect.registry.SchemaRegistryClient;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

import java.util.List;

/**
 * Health indicator for schema registry reachability, checked by listing subjects.
 */
public class SchemaRegistryHealthIndicator implements HealthIndicator {

    private final SchemaRegistryClient registryClient;
    private final String url;

    public SchemaRegistryHealthIndicator(SchemaRegistryClient registryClient, String url) {
        this.registryClient = registryClient;
        this.url = url;
    }

    @Override
    public Health health() {
        try {
            List<String> subjects = registryClient.getSubjects();
            return Health.up()
                .withDetail("url", url)
                .withDetail("subjects", subjects.size())
                .build();
        } catch (Exception e) {
            return Health.down()
                .withDetail("url", url)
                .withDetail("error", e.getMessage())
                .build();
        }
    }
}
