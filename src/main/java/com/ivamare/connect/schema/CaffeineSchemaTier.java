package com.ivamare.connect.schema;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;

/**
 * Tier 1: in-memory schema cache with a time-to-live.
 */
public class CaffeineSchemaTier implements SchemaTier {

    private static final Logger log = LoggerFactory.getLogger(CaffeineSchemaTier.class);

    private final Cache<String, SchemaEntry> cache;

    public CaffeineSchemaTier(Duration ttl, long maximumSize) {
        this(ttl, maximumSize, Ticker.systemTicker());
    }

    public CaffeineSchemaTier(Duration ttl, long maximumSize, Ticker ticker) {
        this.cache = Caffeine.newBuilder()
            .maximumSize(maximumSize)
            .expireAfterWrite(ttl)
            .ticker(ticker)
            .recordStats()
            .removalListener((key, value, cause) ->
                log.debug("Schema cache eviction: key={}, cause={}", key, cause))
            .build();
    }

    @Override
    public String name() {
        return "cache";
    }

    @Override
    public Optional<SchemaEntry> get(String schemaName) {
        return Optional.ofNullable(cache.getIfPresent(schemaName));
    }

    @Override
    public void put(SchemaEntry entry) {
        cache.put(entry.name(), entry);
    }

    @Override
    public void invalidate(String schemaName) {
        cache.invalidate(schemaName);
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
    }

    @Override
    public Set<String> knownNames() {
        return Set.copyOf(cache.asMap().keySet());
    }

    public long size() {
        return cache.estimatedSize();
    }
}
