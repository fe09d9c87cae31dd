package com.ivamare.connect.health;

import com.ivamare.connect.exception.TransportException;
import com.ivamare.connect.registry.SchemaRegistryClient;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("SchemaRegistryHealthIndicator")
class SchemaRegistryHealthIndicatorTest {

    private final SchemaRegistryClient client = mock(SchemaRegistryClient.class);
    private final SchemaRegistryHealthIndicator indicator =
        new SchemaRegistryHealthIndicator(client, "http://registry:8081");

    @Test
    @DisplayName("should return UP with the subject count")
    void shouldReturnUp() {
        when(client.getSubjects()).thenReturn(List.of("MessageV1-value", "CreateClientV1-value"));

        Health health = indicator.health();

        assertEquals(Status.UP, health.getStatus());
        assertEquals(2, health.getDetails().get("subjects"));
        assertEquals("http://registry:8081", health.getDetails().get("url"));
    }

    @Test
    @DisplayName("should return DOWN when the registry is unreachable")
    void shouldReturnDown() {
        when(client.getSubjects()).thenThrow(new TransportException("Connection refused"));

        Health health = indicator.health();

        assertEquals(Status.DOWN, health.getStatus());
        assertEquals("Connection refused", health.getDetails().get("error"));
    }
}
