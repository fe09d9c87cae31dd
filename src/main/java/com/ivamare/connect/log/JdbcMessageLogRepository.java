package com.ivamare.connect.log;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.connect.model.MessageDirection;
import com.ivamare.connect.model.MessageLogEntry;
import com.ivamare.connect.model.MessageStatus;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * JDBC implementation of MessageLogRepository.
 */
public class JdbcMessageLogRepository implements MessageLogRepository {

    private static final String SELECT_COLUMNS = """
        SELECT id, direction, status, idempotency_key, message_key, message_type, topic,
               partition_no, offset_no, tenant_id, source_entity_type, source_entity_id,
               rule_name, handler_name, payload_json, error_message, error_trace,
               retry_count, correlated_log_id, created_at, processed_at
        FROM connect.message_log
        """;

    private static final Pattern JSON_NUMBER = Pattern.compile("-?(0|[1-9]\\d*)(\\.\\d+)?([eE][+-]?\\d+)?");

    private static final String PURGEABLE_STATUSES = "('Delivered', 'Processed', 'Skipped', 'Dead Letter')";

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final RowMapper<MessageLogEntry> entryMapper = JdbcMessageLogRepository::mapEntry;

    public JdbcMessageLogRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public MessageLogEntry create(MessageLogEntry entry) {
        Long id = jdbcTemplate.queryForObject("""
            INSERT INTO connect.message_log (
                direction, status, idempotency_key, message_key, message_type, topic,
                partition_no, offset_no, tenant_id, source_entity_type, source_entity_id,
                rule_name, handler_name, payload_json, retry_count, created_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            RETURNING id
            """,
            Long.class,
            entry.direction().getValue(),
            entry.status().getValue(),
            entry.idempotencyKey(),
            entry.messageKey(),
            entry.messageType(),
            entry.topic(),
            entry.partition(),
            entry.offset(),
            entry.tenantId(),
            entry.sourceEntityType(),
            entry.sourceEntityId(),
            entry.ruleName(),
            entry.handlerName(),
            entry.payloadJson(),
            entry.retryCount(),
            Timestamp.from(entry.createdAt() != null ? entry.createdAt() : Instant.now())
        );
        return entry.withId(id);
    }

    @Override
    public Optional<MessageLogEntry> findById(long id) {
        List<MessageLogEntry> results = jdbcTemplate.query(SELECT_COLUMNS + " WHERE id = ?", entryMapper, id);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<MessageLogEntry> findByIdempotencyKey(String idempotencyKey) {
        return jdbcTemplate.query(
            SELECT_COLUMNS + " WHERE idempotency_key = ? ORDER BY created_at DESC, id DESC",
            entryMapper,
            idempotencyKey
        );
    }

    @Override
    public boolean existsWithStatus(String idempotencyKey, Set<MessageStatus> statuses) {
        if (statuses.isEmpty()) {
            return false;
        }
        String placeholders = statuses.stream().map(s -> "?").collect(Collectors.joining(", "));
        Object[] args = new Object[statuses.size() + 1];
        args[0] = idempotencyKey;
        int i = 1;
        for (MessageStatus status : statuses) {
            args[i++] = status.getValue();
        }
        Boolean exists = jdbcTemplate.queryForObject(
            "SELECT EXISTS (SELECT 1 FROM connect.message_log WHERE idempotency_key = ? AND status IN ("
                + placeholders + "))",
            Boolean.class,
            args
        );
        return Boolean.TRUE.equals(exists);
    }

    @Override
    public boolean markDelivered(long id, int partition, long offset, Instant processedAt) {
        return jdbcTemplate.update("""
            UPDATE connect.message_log
            SET status = 'Delivered', partition_no = ?, offset_no = ?, processed_at = ?
            WHERE id = ? AND status = 'Pending'
            """,
            partition, offset, Timestamp.from(processedAt), id
        ) > 0;
    }

    @Override
    public boolean markProcessed(long id, Instant processedAt) {
        return jdbcTemplate.update(
            "UPDATE connect.message_log SET status = 'Processed', processed_at = ? WHERE id = ? AND status = 'Pending'",
            Timestamp.from(processedAt), id
        ) > 0;
    }

    @Override
    public boolean markSkipped(long id, String reason) {
        return jdbcTemplate.update(
            "UPDATE connect.message_log SET status = 'Skipped', error_message = ? WHERE id = ? AND status = 'Pending'",
            reason, id
        ) > 0;
    }

    @Override
    public boolean markFailed(long id, String errorMessage, String errorTrace) {
        return jdbcTemplate.update("""
            UPDATE connect.message_log
            SET status = 'Failed', error_message = ?, error_trace = ?, retry_count = retry_count + 1
            WHERE id = ? AND status = 'Pending'
            """,
            errorMessage, errorTrace, id
        ) > 0;
    }

    @Override
    public boolean markDeadLetter(long id, String errorMessage, String errorTrace) {
        return jdbcTemplate.update("""
            UPDATE connect.message_log
            SET status = 'Dead Letter', error_message = ?, error_trace = ?
            WHERE id = ? AND status = 'Pending'
            """,
            errorMessage, errorTrace, id
        ) > 0;
    }

    @Override
    public void updateHandlerName(long id, String handlerName) {
        jdbcTemplate.update("UPDATE connect.message_log SET handler_name = ? WHERE id = ?", handlerName, id);
    }

    @Override
    public void updatePayloadJson(long id, String payloadJson) {
        jdbcTemplate.update("UPDATE connect.message_log SET payload_json = ? WHERE id = ?", payloadJson, id);
    }

    @Override
    public boolean incrementRetryCount(long id) {
        return jdbcTemplate.update(
            "UPDATE connect.message_log SET retry_count = retry_count + 1 WHERE id = ? AND status = 'Pending'",
            id
        ) > 0;
    }

    @Override
    public int deleteTerminalOlderThan(Instant cutoff) {
        return jdbcTemplate.update(
            "DELETE FROM connect.message_log WHERE created_at < ? AND status IN " + PURGEABLE_STATUSES,
            Timestamp.from(cutoff)
        );
    }

    @Override
    public List<MessageLogEntry> findStalePending(Instant cutoff) {
        return jdbcTemplate.query(
            SELECT_COLUMNS + " WHERE status = 'Pending' AND created_at < ? ORDER BY created_at ASC",
            entryMapper,
            Timestamp.from(cutoff)
        );
    }

    @Override
    public void updateCorrelatedLog(long id, long correlatedLogId) {
        jdbcTemplate.update("UPDATE connect.message_log SET correlated_log_id = ? WHERE id = ?", correlatedLogId, id);
    }

    /**
     * {@inheritDoc}
     *
     * <p>The value matches as a JSON string ({@code "externalId":"42"}). A value that reads as a
     * JSON number also matches its numeric form ({@code "externalId":42}) as Jackson writes it, so
     * {@code "42"} does not find {@code 42.0}.
     */
    @Override
    public Optional<MessageLogEntry> findLatestByPayloadField(MessageDirection direction, String field, String value) {
        List<String> patterns = payloadPatterns(field, value);
        String filter = patterns.stream()
            .map(pattern -> "payload_json LIKE ?")
            .collect(Collectors.joining(" OR ", "(", ")"));

        List<Object> args = new ArrayList<>();
        args.add(direction.getValue());
        args.addAll(patterns);

        List<MessageLogEntry> results = jdbcTemplate.query(
            SELECT_COLUMNS + " WHERE direction = ? AND " + filter + " ORDER BY created_at DESC, id DESC LIMIT 1",
            entryMapper,
            args.toArray()
        );
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<StatusCount> countByDirectionAndStatus(Instant since) {
        return jdbcTemplate.query("""
            SELECT direction, status, COUNT(*) AS cnt
            FROM connect.message_log
            WHERE created_at >= ?
            GROUP BY direction, status
            ORDER BY direction, status
            """,
            (rs, rowNum) -> new StatusCount(
                MessageDirection.fromValue(rs.getString("direction")),
                MessageStatus.fromValue(rs.getString("status")),
                rs.getLong("cnt")
            ),
            Timestamp.from(since)
        );
    }

    /**
     * The {@code "field":"value"} fragment as Jackson writes it into payload snapshots.
     */
    private String jsonPair(String field, String value) {
        return jsonString(field) + ":" + jsonString(value);
    }

    private List<String> payloadPatterns(String field, String value) {
        List<String> patterns = new ArrayList<>();
        patterns.add("%" + escapeLike(jsonPair(field, value)) + "%");
        if (value != null && JSON_NUMBER.matcher(value).matches()) {
            String numeric = escapeLike(jsonString(field) + ":" + value);
            patterns.add("%" + numeric + ",%");
            patterns.add("%" + numeric + "}%");
        }
        return patterns;
    }

    private String jsonString(String text) {
        try {
            return objectMapper.writeValueAsString(text);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode correlation filter", e);
        }
    }

    private static String escapeLike(String text) {
        return text.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }

    private static MessageLogEntry mapEntry(ResultSet rs, int rowNum) throws SQLException {
        int partition = rs.getInt("partition_no");
        Integer partitionValue = rs.wasNull() ? null : partition;
        long offset = rs.getLong("offset_no");
        Long offsetValue = rs.wasNull() ? null : offset;
        long correlated = rs.getLong("correlated_log_id");
        Long correlatedValue = rs.wasNull() ? null : correlated;
        Timestamp processedAt = rs.getTimestamp("processed_at");

        return new MessageLogEntry(
            rs.getLong("id"),
            MessageDirection.fromValue(rs.getString("direction")),
            MessageStatus.fromValue(rs.getString("status")),
            rs.getString("idempotency_key"),
            rs.getString("message_key"),
            rs.getString("message_type"),
            rs.getString("topic"),
            partitionValue,
            offsetValue,
            rs.getString("tenant_id"),
            rs.getString("source_entity_type"),
            rs.getString("source_entity_id"),
            rs.getString("rule_name"),
            rs.getString("handler_name"),
            rs.getString("payload_json"),
            rs.getString("error_message"),
            rs.getString("error_trace"),
            rs.getInt("retry_count"),
            correlatedValue,
            rs.getTimestamp("created_at").toInstant(),
            processedAt != null ? processedAt.toInstant() : null
        );
    }
}
