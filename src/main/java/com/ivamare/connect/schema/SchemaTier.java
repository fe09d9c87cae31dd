package com.ivamare.connect.schema;

import java.util.Optional;
import java.util.Set;

/**
 * One level of the chained schema lookup.
 *
 * <p>Tiers are consulted fastest first. On a hit, the {@link SchemaResolver} writes
 * the entry back into every faster tier.
 */
public interface SchemaTier {

    /**
     * Short name for logs.
     */
    String name();

    Optional<SchemaEntry> get(String schemaName);

    void put(SchemaEntry entry);

    /**
     * Drop a cached entry. Durable and authoritative tiers ignore this.
     */
    default void invalidate(String schemaName) {
    }

    default void invalidateAll() {
    }

    /**
     * Schema names this tier knows to be latest, used by the refresh sweep.
     */
    default Set<String> knownNames() {
        return Set.of();
    }
}
