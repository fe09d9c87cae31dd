package com.ivamare.connect.codec;

import com.ivamare.connect.exception.EnvelopeCodecException;
import com.ivamare.connect.exception.InnerPayloadDecodeException;
import org.apache.avro.Schema;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("InnerPayloadCodec")
class InnerPayloadCodecTest {

    private static final Schema CLIENT_SCHEMA = new Schema.Parser().parse("""
        {
          "type": "record",
          "name": "CreateClientCommand",
          "namespace": "com.example",
          "fields": [
            {"name": "clientId", "type": "string"},
            {"name": "externalRef", "type": "long"},
            {"name": "active", "type": "boolean"},
            {"name": "email", "type": ["null", "string"], "default": null},
            {"name": "tier", "type": {"type": "enum", "name": "Tier", "symbols": ["BASIC", "GOLD"]}},
            {"name": "tags", "type": {"type": "array", "items": "string"}},
            {"name": "photo", "type": ["null", "bytes"], "default": null}
          ]
        }
        """);

    private static final Schema NUMERIC_SCHEMA = new Schema.Parser().parse("""
        {
          "type": "record",
          "name": "AssignLoanCommand",
          "namespace": "com.example",
          "fields": [
            {"name": "clientId", "type": "int"},
            {"name": "officeId", "type": ["null", "int"], "default": null},
            {"name": "amount", "type": ["null", "double"], "default": null}
          ]
        }
        """);

    private final InnerPayloadCodec codec = new InnerPayloadCodec();

    @Test
    @DisplayName("should preserve large longs, nullable unions and enums")
    void shouldPreserveValues() {
        Map<String, Object> payload = new HashMap<>();
        payload.put("clientId", "CUST-0001");
        payload.put("externalRef", 1L << 40);
        payload.put("active", true);
        payload.put("email", null);
        payload.put("tier", "GOLD");
        payload.put("tags", List.of("vip", "eu"));
        payload.put("photo", "png".getBytes(StandardCharsets.UTF_8));

        Map<String, Object> decoded = codec.decode(CLIENT_SCHEMA, codec.encode(CLIENT_SCHEMA, payload));

        assertEquals("CUST-0001", decoded.get("clientId"));
        assertEquals(1099511627776L, decoded.get("externalRef"));
        assertEquals(true, decoded.get("active"));
        assertNull(decoded.get("email"));
        assertEquals("GOLD", decoded.get("tier"));
        assertEquals(List.of("vip", "eu"), decoded.get("tags"));
        assertArrayEquals("png".getBytes(StandardCharsets.UTF_8), (byte[]) decoded.get("photo"));
    }

    @Test
    @DisplayName("should pick the string branch of a nullable union")
    void shouldPickStringBranch() {
        Map<String, Object> payload = new HashMap<>(Map.of(
            "clientId", "C2", "externalRef", 1, "active", false, "email", "a@b.c",
            "tier", "BASIC", "tags", List.of()));

        Map<String, Object> decoded = codec.decode(CLIENT_SCHEMA, codec.encode(CLIENT_SCHEMA, payload));

        assertEquals("a@b.c", decoded.get("email"));
        assertEquals(1L, decoded.get("externalRef"));
        assertNull(decoded.get("photo"));
    }

    @Test
    @DisplayName("should refuse a null for a non-nullable field")
    void shouldRefuseNullForRequiredField() {
        Map<String, Object> payload = new HashMap<>();
        payload.put("clientId", null);

        assertThrows(EnvelopeCodecException.class, () -> codec.encode(CLIENT_SCHEMA, payload));
    }

    @Test
    @DisplayName("should raise InnerPayloadDecodeException on truncated bytes")
    void shouldRaiseOnTruncatedBytes() {
        InnerPayloadDecodeException ex = assertThrows(InnerPayloadDecodeException.class,
            () -> codec.decode(CLIENT_SCHEMA, new byte[] {2}));

        assertEquals("com.example.CreateClientCommand", ex.getSchemaName());
    }

    @Test
    @DisplayName("should accept a long that fits an int field")
    void shouldAcceptInRangeLongForIntField() {
        Map<String, Object> payload = new HashMap<>();
        payload.put("clientId", 42L);
        payload.put("officeId", 7);
        payload.put("amount", 10L);

        Map<String, Object> decoded = codec.decode(NUMERIC_SCHEMA, codec.encode(NUMERIC_SCHEMA, payload));

        assertEquals(42, decoded.get("clientId"));
        assertEquals(7, decoded.get("officeId"));
        assertEquals(10.0d, decoded.get("amount"));
    }

    @Test
    @DisplayName("should refuse a long above int range for an int field")
    void shouldRefuseOverRangeLongForIntField() {
        Map<String, Object> payload = new HashMap<>();
        payload.put("clientId", (1L << 40) + 42);

        EnvelopeCodecException ex = assertThrows(EnvelopeCodecException.class,
            () -> codec.encode(NUMERIC_SCHEMA, payload));

        assertTrue(ex.getMessage().contains("does not fit an int"));
    }

    @Test
    @DisplayName("should refuse a fractional double for an int field")
    void shouldRefuseFractionalDoubleForIntField() {
        Map<String, Object> payload = new HashMap<>();
        payload.put("clientId", 3.9d);

        assertThrows(EnvelopeCodecException.class, () -> codec.encode(NUMERIC_SCHEMA, payload));
    }

    @Test
    @DisplayName("should refuse a double for a nullable int union")
    void shouldRefuseDoubleForNullableIntUnion() {
        Map<String, Object> payload = new HashMap<>();
        payload.put("clientId", 42);
        payload.put("officeId", 3.9d);

        EnvelopeCodecException ex = assertThrows(EnvelopeCodecException.class,
            () -> codec.encode(NUMERIC_SCHEMA, payload));

        assertTrue(ex.getMessage().contains("No branch of union"));
    }
}
