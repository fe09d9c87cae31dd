package com.ivamare.connect.idempotency;

import com.ivamare.connect.exception.ValidationException;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.UUID;

/**
 * Deterministic dedup keys for produced and consumed messages.
 *
 * <p>Both keys are the SHA-256 hex digest of the colon-joined identity tuple, so the
 * same logical trigger always maps to the same 64-character key.
 */
public final class IdempotencyKeys {

    private IdempotencyKeys() {
        // Utility class - no instantiation
    }

    /**
     * Key of one outbound production: a document event handled by one rule.
     */
    public static String producerKey(
            String entityType,
            String entityId,
            String event,
            String commandType,
            String ruleName) {
        requireNonBlank("entityType", entityType);
        requireNonBlank("entityId", entityId);
        requireNonBlank("event", event);
        requireNonBlank("commandType", commandType);
        requireNonBlank("ruleName", ruleName);
        return sha256Hex(String.join(":", entityType, entityId, event, commandType, ruleName));
    }

    /**
     * Key of one physical inbound message, independent of its content.
     */
    public static String consumerKey(String topic, int partition, long offset) {
        requireNonBlank("topic", topic);
        if (partition < 0) {
            throw new ValidationException("partition", "must not be negative");
        }
        if (offset < 0) {
            throw new ValidationException("offset", "must not be negative");
        }
        return sha256Hex(topic + ":" + partition + ":" + offset);
    }

    /**
     * Fresh random key for manual re-trigger paths, never suppressed as a duplicate.
     */
    public static String manualKey() {
        return UUID.randomUUID().toString();
    }

    private static void requireNonBlank(String name, String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(name, "is required");
        }
    }

    private static String sha256Hex(String raw) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(raw.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
