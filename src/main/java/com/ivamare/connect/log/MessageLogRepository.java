package com.ivamare.connect.log;

import com.ivamare.connect.model.MessageDirection;
import com.ivamare.connect.model.MessageLogEntry;
import com.ivamare.connect.model.MessageStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Storage for message log entries, also serving as the idempotency store.
 *
 * <p>Every status transition only applies to an entry that is still {@code PENDING};
 * the {@code mark*} methods return false when the entry already reached a terminal status.
 */
public interface MessageLogRepository {

    /**
     * Insert a new entry.
     *
     * @return the entry with its assigned id
     */
    MessageLogEntry create(MessageLogEntry entry);

    Optional<MessageLogEntry> findById(long id);

    /**
     * Entries with a key, newest first.
     */
    List<MessageLogEntry> findByIdempotencyKey(String idempotencyKey);

    /**
     * Whether any entry with the key is in one of the statuses.
     */
    boolean existsWithStatus(String idempotencyKey, Set<MessageStatus> statuses);

    /**
     * Whether a Delivered, Processed or Skipped entry exists for the key.
     */
    default boolean isCompleted(String idempotencyKey) {
        return existsWithStatus(idempotencyKey, MessageStatus.completedStatuses());
    }

    boolean markDelivered(long id, int partition, long offset, Instant processedAt);

    boolean markProcessed(long id, Instant processedAt);

    boolean markSkipped(long id, String reason);

    /**
     * Mark failed and increment the retry count.
     */
    boolean markFailed(long id, String errorMessage, String errorTrace);

    boolean markDeadLetter(long id, String errorMessage, String errorTrace);

    void updateHandlerName(long id, String handlerName);

    void updatePayloadJson(long id, String payloadJson);

    /**
     * Bump the retry count of a still pending entry.
     */
    boolean incrementRetryCount(long id);

    /**
     * Delete Delivered, Processed, Skipped and Dead Letter entries created before the cutoff.
     * Failed entries are kept for investigation.
     *
     * @return number of deleted entries
     */
    int deleteTerminalOlderThan(Instant cutoff);

    /**
     * Pending entries created before the cutoff.
     */
    List<MessageLogEntry> findStalePending(Instant cutoff);

    void updateCorrelatedLog(long id, long correlatedLogId);

    /**
     * Newest entry of a direction whose payload snapshot has {@code field == value}.
     */
    Optional<MessageLogEntry> findLatestByPayloadField(MessageDirection direction, String field, String value);

    /**
     * Entry counts per direction and status for entries created since the given time.
     */
    List<StatusCount> countByDirectionAndStatus(Instant since);
}
