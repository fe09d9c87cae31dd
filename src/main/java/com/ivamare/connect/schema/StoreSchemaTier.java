package com.ivamare.connect.schema;

import java.util.Optional;
import java.util.Set;

/**
 * Tier 2: the persistent {@link SchemaStore}.
 */
public class StoreSchemaTier implements SchemaTier {

    private final SchemaStore store;

    public StoreSchemaTier(SchemaStore store) {
        this.store = store;
    }

    @Override
    public String name() {
        return "store";
    }

    @Override
    public Optional<SchemaEntry> get(String schemaName) {
        return store.findLatest(schemaName);
    }

    @Override
    public void put(SchemaEntry entry) {
        store.saveLatest(entry);
    }

    @Override
    public Set<String> knownNames() {
        return Set.copyOf(store.findLatestNames());
    }
}
