package com.ivamare.connect.schema;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.connect.exception.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * JDBC implementation of SchemaStore.
 *
 * <p>Clearing the previous latest flag and writing the new latest version run in one transaction.
 */
public class JdbcSchemaStore implements SchemaStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcSchemaStore.class);

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final ObjectMapper objectMapper;

    private static final RowMapper<SchemaEntry> SCHEMA_MAPPER = (rs, rowNum) -> {
        Timestamp fetchedAt = rs.getTimestamp("fetched_at");
        int registryId = rs.getInt("registry_id");
        return new SchemaEntry(
            rs.getString("schema_name"),
            rs.getInt("schema_version"),
            rs.getString("schema_json"),
            SchemaType.fromValue(rs.getString("schema_type")),
            rs.wasNull() ? null : registryId,
            rs.getBoolean("is_latest"),
            fetchedAt != null ? fetchedAt.toInstant() : null
        );
    };

    public JdbcSchemaStore(JdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate,
                           ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<SchemaEntry> findLatest(String name) {
        List<SchemaEntry> results = jdbcTemplate.query("""
            SELECT schema_name, schema_version, schema_json, schema_type, registry_id, is_latest, fetched_at
            FROM connect.avro_schema
            WHERE schema_name = ? AND is_latest = TRUE
            """,
            SCHEMA_MAPPER,
            name
        );
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public SchemaEntry saveLatest(SchemaEntry entry) {
        validateSchemaJson(entry);

        SchemaEntry saved = transactionTemplate.execute(status -> {
            int version = entry.version() > 0 ? entry.version() : nextVersion(entry.name());
            Instant fetchedAt = entry.fetchedAt() != null ? entry.fetchedAt() : Instant.now();

            jdbcTemplate.update(
                "UPDATE connect.avro_schema SET is_latest = FALSE WHERE schema_name = ? AND is_latest = TRUE",
                entry.name()
            );

            int updated = jdbcTemplate.update("""
                UPDATE connect.avro_schema
                SET schema_json = ?, schema_type = ?, registry_id = ?, is_latest = TRUE, fetched_at = ?
                WHERE schema_name = ? AND schema_version = ?
                """,
                entry.schemaJson(), entry.schemaType().getValue(), entry.registryId(),
                Timestamp.from(fetchedAt), entry.name(), version
            );

            if (updated == 0) {
                jdbcTemplate.update("""
                    INSERT INTO connect.avro_schema
                        (schema_name, schema_version, schema_json, schema_type, registry_id, is_latest, fetched_at)
                    VALUES (?, ?, ?, ?, ?, TRUE, ?)
                    """,
                    entry.name(), version, entry.schemaJson(), entry.schemaType().getValue(),
                    entry.registryId(), Timestamp.from(fetchedAt)
                );
            }

            return new SchemaEntry(entry.name(), version, entry.schemaJson(), entry.schemaType(),
                entry.registryId(), true, fetchedAt);
        });

        log.info("Schema saved to store: name={}, version={}", entry.name(), saved.version());
        return saved;
    }

    @Override
    public List<String> findLatestNames() {
        return jdbcTemplate.queryForList(
            "SELECT schema_name FROM connect.avro_schema WHERE is_latest = TRUE ORDER BY schema_name",
            String.class
        );
    }

    private int nextVersion(String name) {
        Integer max = jdbcTemplate.queryForObject(
            "SELECT MAX(schema_version) FROM connect.avro_schema WHERE schema_name = ?",
            Integer.class,
            name
        );
        return max != null ? max + 1 : 1;
    }

    private void validateSchemaJson(SchemaEntry entry) {
        JsonNode node;
        try {
            node = objectMapper.readTree(entry.schemaJson());
        } catch (JsonProcessingException e) {
            throw new ValidationException("schemaJson", "invalid JSON for schema " + entry.name() + ": " + e.getOriginalMessage());
        }
        if (node == null || !node.isObject() || !node.has("type")) {
            throw new ValidationException("schemaJson", "schema " + entry.name() + " must be a JSON object with a 'type' field");
        }
    }
}
