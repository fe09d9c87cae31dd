package com.ivamare.connect.codec;

import com.ivamare.connect.exception.ConnectException;
import com.ivamare.connect.exception.EnvelopeCodecException;
import com.ivamare.connect.exception.SchemaNotFoundException;
import com.ivamare.connect.model.Envelope;
import com.ivamare.connect.registry.SchemaRegistryClient;
import org.apache.avro.Schema;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericDatumReader;
import org.apache.avro.generic.GenericDatumWriter;
import org.apache.avro.generic.GenericRecord;
import org.apache.avro.io.BinaryDecoder;
import org.apache.avro.io.BinaryEncoder;
import org.apache.avro.io.DecoderFactory;
import org.apache.avro.io.EncoderFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Codec for the MessageV1 envelope in the registry wire format.
 *
 * <p>Layout: {@code [0x00][4-byte big-endian schema id][Avro binary]}. The schema id is
 * obtained from the registry under the subject chosen by the {@link SubjectNameStrategy},
 * registering the envelope schema first when auto-registration is on. On decode, the
 * writer schema is fetched by id and resolved against the MessageV1 reader schema.
 *
 * <p>The {@code data} field carries the inner payload bytes untouched.
 */
public class EnvelopeCodec {

    private static final Logger log = LoggerFactory.getLogger(EnvelopeCodec.class);

    private static final byte MAGIC_BYTE = 0x0;
    private static final int HEADER_SIZE = 5;

    public static final Schema MESSAGE_V1 = new Schema.Parser().parse("""
        {
          "type": "record",
          "name": "MessageV1",
          "namespace": "org.apache.fineract.avro",
          "fields": [
            {"name": "id", "type": "int"},
            {"name": "source", "type": "string"},
            {"name": "type", "type": "string"},
            {"name": "category", "type": "string"},
            {"name": "createdAt", "type": "string"},
            {"name": "businessDate", "type": "string"},
            {"name": "tenantId", "type": "string"},
            {"name": "idempotencyKey", "type": "string"},
            {"name": "dataschema", "type": "string"},
            {"name": "data", "type": "bytes"}
          ]
        }
        """);

    private final SchemaRegistryClient registryClient;
    private final SubjectNameStrategy subjectNameStrategy;
    private final boolean autoRegister;

    private final Map<String, Integer> subjectIds = new ConcurrentHashMap<>();
    private final Map<Integer, Schema> writerSchemas = new ConcurrentHashMap<>();

    public EnvelopeCodec(SchemaRegistryClient registryClient, SubjectNameStrategy subjectNameStrategy,
                         boolean autoRegister) {
        this.registryClient = registryClient;
        this.subjectNameStrategy = subjectNameStrategy;
        this.autoRegister = autoRegister;
    }

    /**
     * Encode an envelope for a topic.
     *
     * @throws EnvelopeCodecException if the envelope cannot be written
     * @throws com.ivamare.connect.exception.TransportException if the registry is unreachable
     */
    public byte[] encode(Envelope envelope, String topic) {
        int schemaId = schemaIdFor(subjectNameStrategy.subjectFor(topic, MESSAGE_V1));

        GenericRecord record = new GenericData.Record(MESSAGE_V1);
        record.put("id", envelope.id());
        record.put("source", envelope.source());
        record.put("type", envelope.type());
        record.put("category", envelope.category());
        record.put("createdAt", envelope.createdAt());
        record.put("businessDate", envelope.businessDate());
        record.put("tenantId", envelope.tenantId());
        record.put("idempotencyKey", envelope.idempotencyKey());
        record.put("dataschema", envelope.dataschema());
        record.put("data", ByteBuffer.wrap(envelope.data()));

        try {
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            out.write(MAGIC_BYTE);
            out.write(ByteBuffer.allocate(4).putInt(schemaId).array());
            BinaryEncoder encoder = EncoderFactory.get().binaryEncoder(out, null);
            new GenericDatumWriter<GenericRecord>(MESSAGE_V1).write(record, encoder);
            encoder.flush();
            return out.toByteArray();
        } catch (IOException | RuntimeException e) {
            throw new EnvelopeCodecException("Failed to encode envelope for topic " + topic + ": " + e.getMessage(), e);
        }
    }

    /**
     * Decode an envelope read from a topic.
     *
     * @throws EnvelopeCodecException if the bytes are not a valid envelope
     * @throws com.ivamare.connect.exception.TransportException if the registry is unreachable
     */
    public Envelope decode(byte[] bytes, String topic) {
        if (bytes == null || bytes.length < HEADER_SIZE) {
            throw new EnvelopeCodecException("Envelope from " + topic + " is too short for the wire format");
        }
        if (bytes[0] != MAGIC_BYTE) {
            throw new EnvelopeCodecException("Unknown magic byte " + bytes[0] + " in envelope from " + topic);
        }

        int schemaId = ByteBuffer.wrap(bytes, 1, 4).getInt();
        Schema writerSchema = writerSchema(schemaId);

        try {
            BinaryDecoder decoder = DecoderFactory.get().binaryDecoder(bytes, HEADER_SIZE, bytes.length - HEADER_SIZE, null);
            GenericRecord record = new GenericDatumReader<GenericRecord>(writerSchema, MESSAGE_V1).read(null, decoder);
            return new Envelope(
                (Integer) record.get("id"),
                string(record, "source"),
                string(record, "type"),
                string(record, "category"),
                string(record, "createdAt"),
                string(record, "businessDate"),
                string(record, "tenantId"),
                string(record, "idempotencyKey"),
                string(record, "dataschema"),
                bytes((ByteBuffer) record.get("data"))
            );
        } catch (IOException | RuntimeException e) {
            throw new EnvelopeCodecException("Failed to decode envelope from " + topic + ": " + e.getMessage(), e);
        }
    }

    private int schemaIdFor(String subject) {
        return subjectIds.computeIfAbsent(subject, s -> {
            if (autoRegister) {
                return registryClient.register(s, MESSAGE_V1.toString());
            }
            int id = registryClient.getLatest(s)
                .orElseThrow(() -> new SchemaNotFoundException(s))
                .id();
            log.debug("Envelope subject {} resolved to schema id {}", s, id);
            return id;
        });
    }

    private Schema writerSchema(int schemaId) {
        try {
            return writerSchemas.computeIfAbsent(schemaId,
                id -> new Schema.Parser().parse(registryClient.getById(id)));
        } catch (ConnectException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new EnvelopeCodecException("Invalid writer schema " + schemaId + ": " + e.getMessage(), e);
        }
    }

    private static String string(GenericRecord record, String field) {
        Object value = record.get(field);
        return value != null ? value.toString() : null;
    }

    private static byte[] bytes(ByteBuffer buffer) {
        if (buffer == null) {
            return new byte[0];
        }
        ByteBuffer copy = buffer.duplicate();
        byte[] result = new byte[copy.remaining()];
        copy.get(result);
        return result;
    }
}
