package com.ivamare.connect.registry;

/**
 * A schema version as returned by the registry.
 *
 * @param subject Subject name
 * @param id Global schema id
 * @param version Version within the subject
 * @param schema Schema string
 */
public record RegisteredSchema(String subject, int id, int version, String schema) {}
