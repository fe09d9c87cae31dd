package com.ivamare.connect.idempotency;

import com.ivamare.connect.exception.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("IdempotencyKeys")
class IdempotencyKeysTest {

    private static final String HEX_64 = "[0-9a-f]{64}";

    @Nested
    @DisplayName("producerKey")
    class ProducerKey {

        @Test
        @DisplayName("should produce a 64 character lowercase hex digest")
        void shouldProduceHexDigest() {
            String key = IdempotencyKeys.producerKey("Customer", "CUST-0001", "after_insert", "CreateClient", "customer-created");

            assertTrue(key.matches(HEX_64), key);
        }

        @Test
        @DisplayName("should be deterministic for the same inputs")
        void shouldBeDeterministic() {
            String first = IdempotencyKeys.producerKey("Customer", "CUST-0001", "after_insert", "CreateClient", "customer-created");
            String second = IdempotencyKeys.producerKey("Customer", "CUST-0001", "after_insert", "CreateClient", "customer-created");

            assertEquals(first, second);
        }

        @Test
        @DisplayName("should differ when any component differs")
        void shouldDifferPerComponent() {
            String base = IdempotencyKeys.producerKey("Customer", "CUST-0001", "after_insert", "CreateClient", "r1");

            assertNotEquals(base, IdempotencyKeys.producerKey("Customer", "CUST-0002", "after_insert", "CreateClient", "r1"));
            assertNotEquals(base, IdempotencyKeys.producerKey("Customer", "CUST-0001", "on_update", "CreateClient", "r1"));
            assertNotEquals(base, IdempotencyKeys.producerKey("Customer", "CUST-0001", "after_insert", "UpdateClient", "r1"));
            assertNotEquals(base, IdempotencyKeys.producerKey("Customer", "CUST-0001", "after_insert", "CreateClient", "r2"));
        }

        @Test
        @DisplayName("should reject blank components")
        void shouldRejectBlankComponents() {
            ValidationException ex = assertThrows(ValidationException.class, () ->
                IdempotencyKeys.producerKey("Customer", " ", "after_insert", "CreateClient", "r1"));

            assertEquals("entityId", ex.getField());
        }
    }

    @Nested
    @DisplayName("consumerKey")
    class ConsumerKey {

        @Test
        @DisplayName("should identify one physical message")
        void shouldIdentifyPhysicalMessage() {
            String key = IdempotencyKeys.consumerKey("crm.events", 0, 42L);

            assertTrue(key.matches(HEX_64));
            assertEquals(key, IdempotencyKeys.consumerKey("crm.events", 0, 42L));
            assertNotEquals(key, IdempotencyKeys.consumerKey("crm.events", 0, 43L));
            assertNotEquals(key, IdempotencyKeys.consumerKey("crm.events", 1, 42L));
        }

        @Test
        @DisplayName("should reject negative partition and offset")
        void shouldRejectNegativeCoordinates() {
            assertThrows(ValidationException.class, () -> IdempotencyKeys.consumerKey("t", -1, 0L));
            assertThrows(ValidationException.class, () -> IdempotencyKeys.consumerKey("t", 0, -1L));
            assertThrows(ValidationException.class, () -> IdempotencyKeys.consumerKey("", 0, 0L));
        }
    }

    @Test
    @DisplayName("manualKey should be fresh on every call")
    void manualKeyShouldBeFresh() {
        assertNotEquals(IdempotencyKeys.manualKey(), IdempotencyKeys.manualKey());
    }
}
