package com.ivamare.connect.model;

import java.time.Instant;

/**
 * Audit record of one production or consumption attempt.
 *
 * <p>Doubles as the idempotency store: a completed entry for a key suppresses later attempts.
 *
 * @param id Surrogate id (null before insert)
 * @param direction Produced or consumed
 * @param status Current status
 * @param idempotencyKey Dedup key of the attempt
 * @param messageKey Broker message key for produced entries, envelope key for consumed ones (nullable)
 * @param messageType Command type (produced) or business event type (consumed)
 * @param topic Broker topic
 * @param partition Partition (nullable until delivered)
 * @param offset Offset (nullable until delivered)
 * @param tenantId Tenant id (nullable)
 * @param sourceEntityType Source document type of a produced message (nullable)
 * @param sourceEntityId Source document id of a produced message (nullable)
 * @param ruleName Emission rule name (nullable)
 * @param handlerName Event handler name (nullable)
 * @param payloadJson Payload snapshot, written only when enabled (nullable)
 * @param errorMessage Last error or skip reason (nullable)
 * @param errorTrace Stack trace of the last error (nullable)
 * @param retryCount Number of failed or re-enqueued attempts
 * @param correlatedLogId Back-reference to the correlated entry (nullable)
 * @param createdAt Creation timestamp
 * @param processedAt Time the entry reached Delivered or Processed (nullable)
 */
public record MessageLogEntry(
    Long id,
    MessageDirection direction,
    MessageStatus status,
    String idempotencyKey,
    String messageKey,
    String messageType,
    String topic,
    Integer partition,
    Long offset,
    String tenantId,
    String sourceEntityType,
    String sourceEntityId,
    String ruleName,
    String handlerName,
    String payloadJson,
    String errorMessage,
    String errorTrace,
    int retryCount,
    Long correlatedLogId,
    Instant createdAt,
    Instant processedAt
) {
    /**
     * Creates a pending entry for a produced command.
     */
    public static MessageLogEntry produced(
            String idempotencyKey,
            String commandType,
            String topic,
            String tenantId,
            String sourceEntityType,
            String sourceEntityId,
            String ruleName) {
        return new MessageLogEntry(
            null, MessageDirection.PRODUCED, MessageStatus.PENDING,
            idempotencyKey, idempotencyKey, commandType, topic,
            null, null, tenantId,
            sourceEntityType, sourceEntityId, ruleName, null,
            null, null, null, 0, null,
            Instant.now(), null
        );
    }

    /**
     * Creates a pending entry for a consumed event.
     */
    public static MessageLogEntry consumed(
            String idempotencyKey,
            String envelopeKey,
            String eventType,
            String topic,
            int partition,
            long offset,
            String tenantId) {
        return new MessageLogEntry(
            null, MessageDirection.CONSUMED, MessageStatus.PENDING,
            idempotencyKey, envelopeKey, eventType, topic,
            partition, offset, tenantId,
            null, null, null, null,
            null, null, null, 0, null,
            Instant.now(), null
        );
    }

    /**
     * Returns a copy carrying the id assigned on insert.
     */
    public MessageLogEntry withId(long newId) {
        return new MessageLogEntry(
            newId, direction, status, idempotencyKey, messageKey, messageType, topic,
            partition, offset, tenantId, sourceEntityType, sourceEntityId, ruleName, handlerName,
            payloadJson, errorMessage, errorTrace, retryCount, correlatedLogId, createdAt, processedAt
        );
    }
}
