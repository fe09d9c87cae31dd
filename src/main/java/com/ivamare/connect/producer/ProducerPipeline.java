package com.ivamare.connect.producer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.connect.ConnectProperties;
import com.ivamare.connect.codec.EnvelopeCodec;
import com.ivamare.connect.codec.InnerPayloadCodec;
import com.ivamare.connect.document.Document;
import com.ivamare.connect.document.DocumentRef;
import com.ivamare.connect.document.DocumentStore;
import com.ivamare.connect.exception.DocumentNotFoundException;
import com.ivamare.connect.exception.ErrorTraces;
import com.ivamare.connect.kafka.BrokerProducer;
import com.ivamare.connect.kafka.DeliveryResult;
import com.ivamare.connect.log.MessageLogRepository;
import com.ivamare.connect.mapping.FieldMappingResolver;
import com.ivamare.connect.model.Envelope;
import com.ivamare.connect.model.MessageLogEntry;
import com.ivamare.connect.rule.EmissionRule;
import com.ivamare.connect.rule.RuleRegistry;
import com.ivamare.connect.schema.SchemaResolver;
import org.apache.avro.Schema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Map;

/**
 * Produces one command message for a document and rule.
 *
 * <p>Steps: dedup check, pending log entry, payload build, schema resolution, inner encode,
 * envelope encode, send, and finally Delivered. Any failure after the pending entry exists
 * marks it Failed and is rethrown so the job scheduler can retry.
 *
 * <p>A key with a Delivered, Processed or Skipped entry is never sent again.
 */
public class ProducerPipeline {

    private static final Logger log = LoggerFactory.getLogger(ProducerPipeline.class);

    private final RuleRegistry ruleRegistry;
    private final DocumentStore documentStore;
    private final FieldMappingResolver mappingResolver;
    private final SchemaResolver schemaResolver;
    private final InnerPayloadCodec innerCodec;
    private final EnvelopeCodec envelopeCodec;
    private final BrokerProducer brokerProducer;
    private final MessageLogRepository messageLog;
    private final ConnectProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ProducerPipeline(
            RuleRegistry ruleRegistry,
            DocumentStore documentStore,
            FieldMappingResolver mappingResolver,
            SchemaResolver schemaResolver,
            InnerPayloadCodec innerCodec,
            EnvelopeCodec envelopeCodec,
            BrokerProducer brokerProducer,
            MessageLogRepository messageLog,
            ConnectProperties properties,
            ObjectMapper objectMapper,
            Clock clock) {
        this.ruleRegistry = ruleRegistry;
        this.documentStore = documentStore;
        this.mappingResolver = mappingResolver;
        this.schemaResolver = schemaResolver;
        this.innerCodec = innerCodec;
        this.envelopeCodec = envelopeCodec;
        this.brokerProducer = brokerProducer;
        this.messageLog = messageLog;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Produce the message for a document under a rule.
     *
     * @param ref the source document
     * @param ruleName the emission rule
     * @param idempotencyKey key of this production
     * @return whether the message was sent or suppressed as a duplicate
     * @throws DocumentNotFoundException if the document no longer exists
     * @throws com.ivamare.connect.exception.ConnectException if any step fails
     */
    public ProduceOutcome produce(DocumentRef ref, String ruleName, String idempotencyKey) {
        EmissionRule rule = ruleRegistry.getOrThrow(ruleName);
        String topic = rule.topicOverride() != null ? rule.topicOverride() : properties.getCommandTopic();
        String tenantId = rule.tenantOverride() != null ? rule.tenantOverride() : properties.getDefaultTenantId();

        if (messageLog.isCompleted(idempotencyKey)) {
            log.info("Skipping duplicate production key={} rule={}", idempotencyKey, ruleName);
            return ProduceOutcome.DUPLICATE_SUPPRESSED;
        }

        Document document = documentStore.find(ref.entityType(), ref.id())
            .orElseThrow(() -> new DocumentNotFoundException(ref.entityType(), ref.id()));

        MessageLogEntry entry = messageLog.create(MessageLogEntry.produced(
            idempotencyKey, rule.commandType(), topic, tenantId, ref.entityType(), ref.id(), ruleName));

        try {
            Map<String, Object> payload = mappingResolver.buildPayload(document, rule.mappings());
            Schema innerSchema = schemaResolver.resolve(rule.schemaName());
            byte[] innerBytes = innerCodec.encode(innerSchema, payload);

            Envelope envelope = new Envelope(
                0,
                properties.getSourceName(),
                rule.commandType(),
                rule.commandCategory(),
                LocalDateTime.now(clock).format(DateTimeFormatter.ISO_LOCAL_DATE_TIME),
                LocalDate.now(clock).format(DateTimeFormatter.ISO_LOCAL_DATE),
                tenantId,
                idempotencyKey,
                rule.schemaName(),
                innerBytes
            );
            byte[] value = envelopeCodec.encode(envelope, topic);

            DeliveryResult delivery = brokerProducer.produce(topic, idempotencyKey, value, Map.of());
            messageLog.markDelivered(entry.id(), delivery.partition(), delivery.offset(), clock.instant());

            if (properties.isLogPayloadOnSuccess()) {
                messageLog.updatePayloadJson(entry.id(), toJson(payload));
            }

            log.info("Message produced topic={} command={} key={} partition={} offset={}",
                topic, rule.commandType(), idempotencyKey, delivery.partition(), delivery.offset());
            return ProduceOutcome.DELIVERED;

        } catch (RuntimeException e) {
            log.error("Production failed rule={} document={} key={}: {}",
                ruleName, ref, idempotencyKey, e.getMessage());
            messageLog.markFailed(entry.id(), ErrorTraces.message(e), ErrorTraces.stackTrace(e));
            throw e;
        }
    }

    private String toJson(Map<String, Object> payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            log.warn("Could not snapshot payload: {}", e.getMessage());
            return null;
        }
    }
}
