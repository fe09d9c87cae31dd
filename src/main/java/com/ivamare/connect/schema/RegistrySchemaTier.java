package com.ivamare.connect.schema;

import com.ivamare.connect.registry.SchemaRegistryClient;

import java.util.Optional;

/**
 * Tier 3: the authoritative schema registry, looked up by subject = schema name. Read-only.
 */
public class RegistrySchemaTier implements SchemaTier {

    private final SchemaRegistryClient registryClient;

    public RegistrySchemaTier(SchemaRegistryClient registryClient) {
        this.registryClient = registryClient;
    }

    @Override
    public String name() {
        return "registry";
    }

    @Override
    public Optional<SchemaEntry> get(String schemaName) {
        return registryClient.getLatest(schemaName)
            .map(registered -> SchemaEntry.latest(
                schemaName, registered.version(), registered.schema(), registered.id()));
    }

    @Override
    public void put(SchemaEntry entry) {
        // The registry is authoritative; nothing is written back to it
    }
}
