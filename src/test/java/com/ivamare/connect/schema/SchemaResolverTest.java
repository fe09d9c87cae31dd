package com.ivamare.connect.schema;

import com.github.benmanes.caffeine.cache.Ticker;
import com.ivamare.connect.exception.SchemaNotFoundException;
import com.ivamare.connect.exception.TransportException;
import com.ivamare.connect.registry.RegisteredSchema;
import com.ivamare.connect.registry.SchemaRegistryClient;
import org.apache.avro.Schema;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("SchemaResolver")
class SchemaResolverTest {

    static final String CREATE_CLIENT = """
        {"type": "record", "name": "CreateClientCommand", "namespace": "com.example",
         "fields": [{"name": "clientId", "type": "string"}]}
        """;

    @Mock
    private SchemaStore store;

    @Mock
    private SchemaRegistryClient registryClient;

    private final AtomicLong nanos = new AtomicLong();
    private CaffeineSchemaTier cache;
    private SchemaResolver resolver;

    @BeforeEach
    void setUp() {
        Ticker ticker = nanos::get;
        cache = new CaffeineSchemaTier(Duration.ofMinutes(5), 100, ticker);
        resolver = new SchemaResolver(List.of(cache, new StoreSchemaTier(store), new RegistrySchemaTier(registryClient)));
    }

    @Nested
    @DisplayName("resolve")
    class Resolve {

        @Test
        @DisplayName("should warm the cache and store from the registry, then hit the cache")
        void shouldWarmFasterTiers() {
            when(store.findLatest("CreateClientCommand")).thenReturn(Optional.empty());
            when(registryClient.getLatest("CreateClientCommand"))
                .thenReturn(Optional.of(new RegisteredSchema("CreateClientCommand", 11, 2, CREATE_CLIENT)));

            Schema first = resolver.resolve("CreateClientCommand");
            Schema second = resolver.resolve("CreateClientCommand");

            assertEquals("com.example.CreateClientCommand", first.getFullName());
            assertEquals(first, second);
            verify(registryClient, times(1)).getLatest("CreateClientCommand");
            verify(store, times(1)).findLatest("CreateClientCommand");
            verify(store).saveLatest(argThat(entry ->
                entry.version() == 2 && entry.registryId() == 11 && entry.schemaType() == SchemaType.COMMAND));
            assertEquals(1, cache.size());
        }

        @Test
        @DisplayName("should serve from the store without calling the registry")
        void shouldServeFromStore() {
            when(store.findLatest("CreateClientCommand"))
                .thenReturn(Optional.of(SchemaEntry.latest("CreateClientCommand", 1, CREATE_CLIENT, 5)));

            SchemaEntry entry = resolver.resolveEntry("CreateClientCommand");

            assertEquals(1, entry.version());
            verifyNoInteractions(registryClient);
            assertTrue(cache.get("CreateClientCommand").isPresent());
        }

        @Test
        @DisplayName("should go back to slower tiers once the cache entry expires")
        void shouldExpireCacheEntries() {
            when(store.findLatest("CreateClientCommand"))
                .thenReturn(Optional.of(SchemaEntry.latest("CreateClientCommand", 1, CREATE_CLIENT, 5)));

            resolver.resolve("CreateClientCommand");
            nanos.addAndGet(Duration.ofMinutes(6).toNanos());
            resolver.resolve("CreateClientCommand");

            verify(store, times(2)).findLatest("CreateClientCommand");
        }

        @Test
        @DisplayName("should fall through a failing tier")
        void shouldFallThroughFailingTier() {
            when(store.findLatest("CreateClientCommand")).thenThrow(new IllegalStateException("db down"));
            when(registryClient.getLatest("CreateClientCommand"))
                .thenReturn(Optional.of(new RegisteredSchema("CreateClientCommand", 11, 2, CREATE_CLIENT)));

            assertNotNull(resolver.resolve("CreateClientCommand"));
        }

        @Test
        @DisplayName("should not fail when the store write-back fails")
        void shouldTolerateWriteBackFailure() {
            when(store.findLatest("CreateClientCommand")).thenReturn(Optional.empty());
            when(registryClient.getLatest("CreateClientCommand"))
                .thenReturn(Optional.of(new RegisteredSchema("CreateClientCommand", 11, 2, CREATE_CLIENT)));
            when(store.saveLatest(any())).thenThrow(new IllegalStateException("read-only"));

            assertNotNull(resolver.resolve("CreateClientCommand"));
            assertTrue(cache.get("CreateClientCommand").isPresent());
        }

        @Test
        @DisplayName("should throw SchemaNotFoundException when every tier misses")
        void shouldThrowWhenAllTiersMiss() {
            when(store.findLatest("Unknown")).thenReturn(Optional.empty());
            when(registryClient.getLatest("Unknown")).thenReturn(Optional.empty());

            SchemaNotFoundException ex = assertThrows(SchemaNotFoundException.class, () -> resolver.resolve("Unknown"));

            assertEquals("Unknown", ex.getSchemaName());
        }

        @Test
        @DisplayName("should keep the last tier error as the cause")
        void shouldKeepLastErrorAsCause() {
            when(store.findLatest("CreateClientCommand")).thenReturn(Optional.empty());
            when(registryClient.getLatest("CreateClientCommand")).thenThrow(new TransportException("unreachable"));

            SchemaNotFoundException ex = assertThrows(SchemaNotFoundException.class,
                () -> resolver.resolve("CreateClientCommand"));

            assertInstanceOf(TransportException.class, ex.getCause());
        }

        @Test
        @DisplayName("should reject an unparseable schema body")
        void shouldRejectUnparseableBody() {
            when(store.findLatest("Broken"))
                .thenReturn(Optional.of(SchemaEntry.latest("Broken", 1, "{\"type\": \"record\"}", null)));

            assertThrows(SchemaNotFoundException.class, () -> resolver.resolve("Broken"));
        }
    }

    @Nested
    @DisplayName("invalidation and refresh")
    class Invalidation {

        @Test
        @DisplayName("invalidate should drop only the cached entry")
        void invalidateShouldDropCacheOnly() {
            cache.put(SchemaEntry.latest("CreateClientCommand", 1, CREATE_CLIENT, 5));

            resolver.invalidate("CreateClientCommand");

            assertTrue(cache.get("CreateClientCommand").isEmpty());
            verifyNoInteractions(store, registryClient);
        }

        @Test
        @DisplayName("refreshAll should re-fetch every known schema into the cache")
        void refreshAllShouldRefetch() {
            when(store.findLatestNames()).thenReturn(List.of("CreateClientCommand", "Gone"));
            when(registryClient.getLatest("CreateClientCommand"))
                .thenReturn(Optional.of(new RegisteredSchema("CreateClientCommand", 12, 3, CREATE_CLIENT)));
            when(registryClient.getLatest("Gone")).thenReturn(Optional.empty());

            int refreshed = resolver.refreshAll();

            assertEquals(1, refreshed);
            assertEquals(3, cache.get("CreateClientCommand").orElseThrow().version());
        }

        @Test
        @DisplayName("refreshAll should continue past a failing schema")
        void refreshAllShouldContinuePastFailures() {
            when(store.findLatestNames()).thenReturn(List.of("A", "CreateClientCommand"));
            when(registryClient.getLatest("A")).thenThrow(new TransportException("timeout"));
            when(registryClient.getLatest("CreateClientCommand"))
                .thenReturn(Optional.of(new RegisteredSchema("CreateClientCommand", 12, 3, CREATE_CLIENT)));

            assertEquals(1, resolver.refreshAll());
        }
    }
}
