package com.ivamare.connect.model;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The fixed outer message (MessageV1) wrapping an independently schemed inner payload.
 *
 * @param id Message id (always 0 for commands we emit)
 * @param source Emitting system name
 * @param type Command or business event type
 * @param category Command or event category
 * @param createdAt ISO-8601 local date-time
 * @param businessDate ISO-8601 date
 * @param tenantId Tenant id
 * @param idempotencyKey Producer idempotency key
 * @param dataschema Name of the inner payload schema
 * @param data Inner payload, schemaless Avro binary
 */
public record Envelope(
    int id,
    String source,
    String type,
    String category,
    String createdAt,
    String businessDate,
    String tenantId,
    String idempotencyKey,
    String dataschema,
    byte[] data
) {
    public Envelope {
        data = data != null ? data : new byte[0];
    }

    /**
     * Envelope fields without the binary payload, for job contexts and expression bindings.
     */
    public Map<String, Object> withoutData() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("id", id);
        map.put("source", source);
        map.put("type", type);
        map.put("category", category);
        map.put("createdAt", createdAt);
        map.put("businessDate", businessDate);
        map.put("tenantId", tenantId);
        map.put("idempotencyKey", idempotencyKey);
        map.put("dataschema", dataschema);
        return map;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Envelope other)) return false;
        return id == other.id
            && Objects.equals(source, other.source)
            && Objects.equals(type, other.type)
            && Objects.equals(category, other.category)
            && Objects.equals(createdAt, other.createdAt)
            && Objects.equals(businessDate, other.businessDate)
            && Objects.equals(tenantId, other.tenantId)
            && Objects.equals(idempotencyKey, other.idempotencyKey)
            && Objects.equals(dataschema, other.dataschema)
            && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(id, source, type, category, createdAt, businessDate,
            tenantId, idempotencyKey, dataschema);
        return 31 * result + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "Envelope[type=" + type + ", category=" + category + ", tenantId=" + tenantId
            + ", dataschema=" + dataschema + ", idempotencyKey=" + idempotencyKey
            + ", data=" + data.length + " bytes]";
    }
}
