package com.ivamare.connect.schema;

import com.ivamare.connect.exception.SchemaNotFoundException;
import org.apache.avro.Schema;
import org.apache.avro.SchemaParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Resolves schemas by name through an ordered chain of tiers.
 *
 * <p>Tiers are consulted fastest first: in-memory cache, persistent store, registry.
 * A hit in a slower tier is written back into every faster tier. A failing write-back
 * is logged and does not fail the resolution.
 *
 * <p>Invalidation hooks:
 * <ul>
 *   <li>{@link #invalidate(String)} and {@link #invalidateAll()} drop cached entries only;
 *       the store stays the durable record and the registry stays authoritative</li>
 *   <li>{@link #refreshAll()} re-fetches every known schema from the registry into the cache</li>
 * </ul>
 */
public class SchemaResolver {

    private static final Logger log = LoggerFactory.getLogger(SchemaResolver.class);

    private final List<SchemaTier> tiers;

    public SchemaResolver(List<SchemaTier> tiers) {
        if (tiers.isEmpty()) {
            throw new IllegalArgumentException("At least one schema tier is required");
        }
        this.tiers = List.copyOf(tiers);
    }

    /**
     * Resolve and parse a schema.
     *
     * @param name schema name
     * @return the parsed Avro schema
     * @throws SchemaNotFoundException if every tier misses
     */
    public Schema resolve(String name) {
        return parse(resolveEntry(name));
    }

    /**
     * Resolve a schema entry without parsing it.
     *
     * @param name schema name
     * @return the entry from the fastest tier that has it
     * @throws SchemaNotFoundException if every tier misses
     */
    public SchemaEntry resolveEntry(String name) {
        RuntimeException lastError = null;

        for (int i = 0; i < tiers.size(); i++) {
            SchemaTier tier = tiers.get(i);
            Optional<SchemaEntry> hit;
            try {
                hit = tier.get(name);
            } catch (RuntimeException e) {
                log.error("Schema lookup in tier {} failed for {}: {}", tier.name(), name, e.getMessage());
                lastError = e;
                continue;
            }

            if (hit.isPresent()) {
                SchemaEntry entry = hit.get();
                log.debug("Schema {} resolved from tier {}", name, tier.name());
                parse(entry);
                writeBack(entry, i);
                return entry;
            }
        }

        throw lastError != null
            ? new SchemaNotFoundException(name, lastError)
            : new SchemaNotFoundException(name);
    }

    /**
     * Drop one schema from the cache.
     */
    public void invalidate(String name) {
        tiers.forEach(tier -> tier.invalidate(name));
        log.debug("Invalidated schema cache for {}", name);
    }

    /**
     * Drop every schema from the cache.
     */
    public void invalidateAll() {
        tiers.forEach(SchemaTier::invalidateAll);
        log.info("Invalidated schema cache");
    }

    /**
     * Re-fetch every known latest schema from the authoritative tier into the fastest tier.
     *
     * <p>Each schema is refreshed independently; failures are logged and skipped.
     *
     * @return number of schemas refreshed
     */
    public int refreshAll() {
        SchemaTier fastest = tiers.get(0);
        SchemaTier authoritative = tiers.get(tiers.size() - 1);

        Set<String> names = new TreeSet<>();
        for (SchemaTier tier : tiers) {
            try {
                names.addAll(tier.knownNames());
            } catch (RuntimeException e) {
                log.error("Listing schemas in tier {} failed: {}", tier.name(), e.getMessage());
            }
        }

        int refreshed = 0;
        for (String name : names) {
            try {
                Optional<SchemaEntry> entry = authoritative.get(name);
                if (entry.isPresent()) {
                    parse(entry.get());
                    fastest.put(entry.get());
                    refreshed++;
                } else {
                    log.warn("Schema {} no longer present in tier {}", name, authoritative.name());
                }
            } catch (RuntimeException e) {
                log.error("Schema refresh failed for {}: {}", name, e.getMessage(), e);
            }
        }

        log.info("Schema cache refresh complete: refreshed={}/{}", refreshed, names.size());
        return refreshed;
    }

    private void writeBack(SchemaEntry entry, int hitIndex) {
        for (int j = hitIndex - 1; j >= 0; j--) {
            SchemaTier tier = tiers.get(j);
            try {
                tier.put(entry);
            } catch (RuntimeException e) {
                log.error("Failed to write schema {} to tier {}: {}", entry.name(), tier.name(), e.getMessage(), e);
            }
        }
    }

    private static Schema parse(SchemaEntry entry) {
        try {
            return new Schema.Parser().parse(entry.schemaJson());
        } catch (SchemaParseException e) {
            throw new SchemaNotFoundException(entry.name(), e);
        }
    }
}
