package com.ivamare.connect.codec;

import com.ivamare.connect.exception.EnvelopeCodecException;
import com.ivamare.connect.exception.InnerPayloadDecodeException;
import org.apache.avro.AvroRuntimeException;
import org.apache.avro.Schema;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericDatumReader;
import org.apache.avro.generic.GenericDatumWriter;
import org.apache.avro.generic.GenericEnumSymbol;
import org.apache.avro.generic.GenericFixed;
import org.apache.avro.generic.GenericRecord;
import org.apache.avro.generic.IndexedRecord;
import org.apache.avro.io.BinaryDecoder;
import org.apache.avro.io.BinaryEncoder;
import org.apache.avro.io.DecoderFactory;
import org.apache.avro.io.EncoderFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Schemaless Avro binary codec for inner payloads.
 *
 * <p>The bytes carry no header: the schema travels by name in the envelope's
 * {@code dataschema} field. Payloads are plain maps on both sides; strings decode
 * to {@link String}, bytes and fixed to {@code byte[]}, enums to their symbol name.
 */
public class InnerPayloadCodec {

    /**
     * Encode a payload against a schema.
     *
     * @throws EnvelopeCodecException if the payload does not fit the schema
     */
    public byte[] encode(Schema schema, Map<String, Object> payload) {
        try {
            Object datum = toAvro(schema, payload);
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            BinaryEncoder encoder = EncoderFactory.get().binaryEncoder(out, null);
            new GenericDatumWriter<>(schema).write(datum, encoder);
            encoder.flush();
            return out.toByteArray();
        } catch (IOException | RuntimeException e) {
            throw new EnvelopeCodecException(
                "Failed to encode inner payload with schema " + schema.getFullName() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Decode payload bytes against a schema.
     *
     * @throws InnerPayloadDecodeException if the bytes do not decode
     */
    @SuppressWarnings("unchecked")
    public Map<String, Object> decode(Schema schema, byte[] data) {
        try {
            BinaryDecoder decoder = DecoderFactory.get().binaryDecoder(data, null);
            Object datum = new GenericDatumReader<>(schema).read(null, decoder);
            Object plain = fromAvro(datum);
            if (!(plain instanceof Map)) {
                throw new AvroRuntimeException("Schema " + schema.getFullName() + " is not a record schema");
            }
            return (Map<String, Object>) plain;
        } catch (IOException | RuntimeException e) {
            throw new InnerPayloadDecodeException(schema.getFullName(), e);
        }
    }

    private Object toAvro(Schema schema, Object value) {
        switch (schema.getType()) {
            case NULL:
                return null;
            case UNION:
                return toAvro(selectBranch(schema, value), value);
            case RECORD:
                return toRecord(schema, value);
            case ARRAY:
                return toArray(schema, value);
            case MAP:
                return toMap(schema, value);
            case ENUM:
                return new GenericData.EnumSymbol(schema, String.valueOf(value));
            case FIXED:
                return new GenericData.Fixed(schema, toBytes(value).array());
            case BYTES:
                return toBytes(value);
            case STRING:
                return requireNonNull(schema, value).toString();
            case INT:
                return toInt(requireNumber(schema, value));
            case LONG:
                return toLong(requireNumber(schema, value));
            case FLOAT:
                return toFloat(requireNumber(schema, value));
            case DOUBLE:
                return toDouble(requireNumber(schema, value));
            case BOOLEAN:
                return requireNonNull(schema, value);
            default:
                throw new AvroRuntimeException("Unsupported schema type " + schema.getType());
        }
    }

    private Object toRecord(Schema schema, Object value) {
        if (value instanceof IndexedRecord) {
            return value;
        }
        if (!(value instanceof Map<?, ?> map)) {
            throw new AvroRuntimeException("Expected a map for record " + schema.getFullName() + " but got " + describe(value));
        }
        GenericData.Record record = new GenericData.Record(schema);
        for (Schema.Field field : schema.getFields()) {
            if (!map.containsKey(field.name()) && field.hasDefaultValue()) {
                record.put(field.pos(), GenericData.get().getDefaultValue(field));
            } else {
                record.put(field.pos(), toAvro(field.schema(), map.get(field.name())));
            }
        }
        return record;
    }

    private Object toArray(Schema schema, Object value) {
        if (!(value instanceof Collection<?> items)) {
            throw new AvroRuntimeException("Expected a collection for array but got " + describe(value));
        }
        List<Object> converted = new ArrayList<>(items.size());
        for (Object item : items) {
            converted.add(toAvro(schema.getElementType(), item));
        }
        return new GenericData.Array<>(schema, converted);
    }

    private Object toMap(Schema schema, Object value) {
        if (!(value instanceof Map<?, ?> entries)) {
            throw new AvroRuntimeException("Expected a map but got " + describe(value));
        }
        Map<String, Object> converted = new LinkedHashMap<>();
        entries.forEach((k, v) -> converted.put(String.valueOf(k), toAvro(schema.getValueType(), v)));
        return converted;
    }

    private static ByteBuffer toBytes(Object value) {
        if (value instanceof byte[] bytes) {
            return ByteBuffer.wrap(bytes);
        }
        if (value instanceof ByteBuffer buffer) {
            return buffer;
        }
        if (value instanceof CharSequence text) {
            return ByteBuffer.wrap(text.toString().getBytes(StandardCharsets.UTF_8));
        }
        throw new AvroRuntimeException("Expected bytes but got " + describe(value));
    }

    private static Number requireNumber(Schema schema, Object value) {
        if (!(requireNonNull(schema, value) instanceof Number number)) {
            throw new AvroRuntimeException("Expected a number for " + schema.getType().getName() + " but got " + describe(value));
        }
        return number;
    }

    private static int toInt(Number number) {
        if (isIntLike(number)) {
            return number.intValue();
        }
        try {
            return number instanceof Long ? Math.toIntExact(number.longValue()) : exactDecimal(number).intValueExact();
        } catch (ArithmeticException e) {
            throw new AvroRuntimeException("Value " + number + " does not fit an int", e);
        }
    }

    private static long toLong(Number number) {
        if (isIntLike(number) || number instanceof Long) {
            return number.longValue();
        }
        try {
            return exactDecimal(number).longValueExact();
        } catch (ArithmeticException e) {
            throw new AvroRuntimeException("Value " + number + " does not fit a long", e);
        }
    }

    private static float toFloat(Number number) {
        if (number instanceof Float || isIntLike(number) || number instanceof Long) {
            return number.floatValue();
        }
        throw new AvroRuntimeException("Value " + number + " of type " + describe(number) + " would narrow to float");
    }

    private static double toDouble(Number number) {
        if (number instanceof Double || number instanceof Float || isIntLike(number) || number instanceof Long) {
            return number.doubleValue();
        }
        throw new AvroRuntimeException("Value " + number + " of type " + describe(number) + " would narrow to double");
    }

    private static boolean isIntLike(Number number) {
        return number instanceof Integer || number instanceof Short || number instanceof Byte;
    }

    private static BigDecimal exactDecimal(Number number) {
        try {
            return new BigDecimal(number.toString());
        } catch (NumberFormatException e) {
            throw new ArithmeticException("Value " + number + " is not a finite number");
        }
    }

    private static Object requireNonNull(Schema schema, Object value) {
        if (value == null) {
            throw new AvroRuntimeException("Null value for non-nullable " + schema.getType().getName());
        }
        return value;
    }

    /**
     * Pick the union branch for a plain value: an exact type match first, then a widening one.
     * Numbers never narrow into a branch.
     */
    private static Schema selectBranch(Schema union, Object value) {
        for (Schema branch : union.getTypes()) {
            if (matchesExactly(branch, value)) {
                return branch;
            }
        }
        for (Schema branch : union.getTypes()) {
            if (matchesLoosely(branch, value)) {
                return branch;
            }
        }
        throw new AvroRuntimeException("No branch of union " + union + " accepts " + describe(value));
    }

    private static boolean matchesExactly(Schema branch, Object value) {
        return switch (branch.getType()) {
            case NULL -> value == null;
            case STRING -> value instanceof CharSequence;
            case INT -> value instanceof Integer || value instanceof Short || value instanceof Byte;
            case LONG -> value instanceof Long;
            case FLOAT -> value instanceof Float;
            case DOUBLE -> value instanceof Double;
            case BOOLEAN -> value instanceof Boolean;
            case BYTES -> value instanceof byte[] || value instanceof ByteBuffer;
            case RECORD -> value instanceof IndexedRecord record && record.getSchema().equals(branch);
            case ENUM -> value instanceof GenericEnumSymbol<?>;
            case FIXED -> value instanceof GenericFixed;
            case ARRAY -> value instanceof Collection<?>;
            case MAP -> false;
            default -> false;
        };
    }

    private static boolean matchesLoosely(Schema branch, Object value) {
        return switch (branch.getType()) {
            case LONG -> value instanceof Number number && isIntLike(number);
            case FLOAT -> value instanceof Number number && (isIntLike(number) || number instanceof Long);
            case DOUBLE -> value instanceof Number number
                && (isIntLike(number) || number instanceof Long || number instanceof Float);
            case ENUM -> value instanceof CharSequence text && branch.hasEnumSymbol(text.toString());
            case FIXED -> value instanceof byte[] bytes && bytes.length == branch.getFixedSize();
            case RECORD, MAP -> value instanceof Map<?, ?>;
            default -> false;
        };
    }

    private Object fromAvro(Object datum) {
        if (datum instanceof GenericRecord record) {
            Map<String, Object> map = new LinkedHashMap<>();
            for (Schema.Field field : record.getSchema().getFields()) {
                map.put(field.name(), fromAvro(record.get(field.pos())));
            }
            return map;
        }
        if (datum instanceof CharSequence text) {
            return text.toString();
        }
        if (datum instanceof ByteBuffer buffer) {
            ByteBuffer copy = buffer.duplicate();
            byte[] bytes = new byte[copy.remaining()];
            copy.get(bytes);
            return bytes;
        }
        if (datum instanceof GenericFixed fixed) {
            return fixed.bytes().clone();
        }
        if (datum instanceof GenericEnumSymbol<?> symbol) {
            return symbol.toString();
        }
        if (datum instanceof Collection<?> items) {
            List<Object> list = new ArrayList<>(items.size());
            items.forEach(item -> list.add(fromAvro(item)));
            return list;
        }
        if (datum instanceof Map<?, ?> entries) {
            Map<String, Object> map = new LinkedHashMap<>();
            entries.forEach((k, v) -> map.put(k.toString(), fromAvro(v)));
            return map;
        }
        return datum;
    }

    private static String describe(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }
}
