package com.ivamare.connect.schema;

import java.util.List;
import java.util.Optional;

/**
 * Persistent schema store, the durable record of fetched schemas.
 *
 * <p>At most one entry per name is flagged latest.
 */
public interface SchemaStore {

    /**
     * Find the latest version of a schema.
     */
    Optional<SchemaEntry> findLatest(String name);

    /**
     * Save an entry as the new latest version of its name, clearing the flag on its siblings.
     *
     * @param entry the entry; a version of 0 assigns the next free version
     * @return the saved entry
     * @throws com.ivamare.connect.exception.ValidationException if the JSON body is not an object with a "type"
     */
    SchemaEntry saveLatest(SchemaEntry entry);

    /**
     * Names that have a latest version.
     */
    List<String> findLatestNames();
}
