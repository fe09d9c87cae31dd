package com.ivamare.connect.registry;

import java.util.List;
import java.util.Optional;

/**
 * Port to the authoritative schema registry.
 *
 * <p>Network failures surface as {@link com.ivamare.connect.exception.TransportException}.
 */
public interface SchemaRegistryClient {

    /**
     * Fetch the latest version registered under a subject.
     *
     * @param subject subject name
     * @return the latest version, or empty if the subject does not exist
     */
    Optional<RegisteredSchema> getLatest(String subject);

    /**
     * Register a schema under a subject. Registering an identical schema again returns its existing id.
     *
     * @return the global schema id
     */
    int register(String subject, String schema);

    /**
     * Fetch a schema string by global id.
     *
     * @throws com.ivamare.connect.exception.SchemaNotFoundException if the id is unknown
     */
    String getById(int id);

    /**
     * List all subjects. Also used as the registry reachability probe.
     */
    List<String> getSubjects();
}
