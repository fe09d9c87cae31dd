package com.ivamare.connect.schema;

import java.time.Instant;

/**
 * A versioned Avro schema body.
 *
 * @param name Schema (and registry subject) name
 * @param version Version number, 0 lets the store assign the next one
 * @param schemaJson Avro schema JSON
 * @param schemaType Role derived from the name
 * @param registryId Registry schema id (nullable)
 * @param latest Whether this is the latest version of its name
 * @param fetchedAt When the body was fetched from the registry
 */
public record SchemaEntry(
    String name,
    int version,
    String schemaJson,
    SchemaType schemaType,
    Integer registryId,
    boolean latest,
    Instant fetchedAt
) {
    /**
     * Creates a latest entry for a body fetched just now.
     */
    public static SchemaEntry latest(String name, int version, String schemaJson, Integer registryId) {
        return new SchemaEntry(name, version, schemaJson, SchemaType.fromSchemaName(name),
            registryId, true, Instant.now());
    }
}
