package com.ivamare.connect.consumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.connect.ConnectProperties;
import com.ivamare.connect.codec.EnvelopeCodec;
import com.ivamare.connect.codec.InnerPayloadCodec;
import com.ivamare.connect.correlation.CorrelationService;
import com.ivamare.connect.exception.ErrorTraces;
import com.ivamare.connect.expression.Evaluator;
import com.ivamare.connect.handler.ActionDispatcher;
import com.ivamare.connect.handler.EventHandler;
import com.ivamare.connect.handler.EventHandlerRegistry;
import com.ivamare.connect.idempotency.IdempotencyKeys;
import com.ivamare.connect.kafka.ConsumedMessage;
import com.ivamare.connect.log.MessageLogRepository;
import com.ivamare.connect.model.Envelope;
import com.ivamare.connect.model.MessageLogEntry;
import com.ivamare.connect.schema.SchemaResolver;
import org.apache.avro.Schema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Processes one consumed message end to end.
 *
 * <p>Status outcomes:
 * <ul>
 *   <li>a completed entry for the physical key: no audit write, no dispatch</li>
 *   <li>inner payload that cannot be resolved or decoded: Dead Letter</li>
 *   <li>no enabled handler, or a falsy guard: Skipped</li>
 *   <li>a guard that fails to evaluate: Failed</li>
 *   <li>actions dispatched: Processed</li>
 *   <li>anything else thrown: best-effort Dead Letter</li>
 * </ul>
 * Never throws; the caller commits the offset whatever the outcome.
 */
public class MessageProcessor {

    private static final Logger log = LoggerFactory.getLogger(MessageProcessor.class);

    private static final String UNKNOWN_EVENT = "UNKNOWN";

    private final EnvelopeCodec envelopeCodec;
    private final InnerPayloadCodec innerCodec;
    private final SchemaResolver schemaResolver;
    private final EventHandlerRegistry handlerRegistry;
    private final ActionDispatcher actionDispatcher;
    private final Evaluator evaluator;
    private final MessageLogRepository messageLog;
    private final CorrelationService correlationService;
    private final ConnectProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public MessageProcessor(
            EnvelopeCodec envelopeCodec,
            InnerPayloadCodec innerCodec,
            SchemaResolver schemaResolver,
            EventHandlerRegistry handlerRegistry,
            ActionDispatcher actionDispatcher,
            Evaluator evaluator,
            MessageLogRepository messageLog,
            CorrelationService correlationService,
            ConnectProperties properties,
            ObjectMapper objectMapper,
            Clock clock) {
        this.envelopeCodec = envelopeCodec;
        this.innerCodec = innerCodec;
        this.schemaResolver = schemaResolver;
        this.handlerRegistry = handlerRegistry;
        this.actionDispatcher = actionDispatcher;
        this.evaluator = evaluator;
        this.messageLog = messageLog;
        this.correlationService = correlationService;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public ProcessOutcome process(ConsumedMessage message) {
        String key = null;
        MessageLogEntry entry = null;
        try {
            key = IdempotencyKeys.consumerKey(message.topic(), message.partition(), message.offset());
            if (messageLog.isCompleted(key)) {
                log.info("Consumer skipping duplicate {}", message);
                return ProcessOutcome.DUPLICATE;
            }

            Envelope envelope = envelopeCodec.decode(message.value(), message.topic());
            entry = messageLog.create(MessageLogEntry.consumed(
                key, envelope.idempotencyKey(), envelope.type(),
                message.topic(), message.partition(), message.offset(), envelope.tenantId()));

            return handle(message, envelope, entry);

        } catch (RuntimeException e) {
            log.error("Consumer message processing error {}: {}", message, e.getMessage(), e);
            recordDeadLetter(message, key, entry, e);
            return ProcessOutcome.DEAD_LETTER;
        }
    }

    private ProcessOutcome handle(ConsumedMessage message, Envelope envelope, MessageLogEntry entry) {
        Map<String, Object> payload = new HashMap<>();
        if (envelope.data().length > 0 && envelope.dataschema() != null && !envelope.dataschema().isBlank()) {
            try {
                Schema schema = schemaResolver.resolve(envelope.dataschema());
                payload = innerCodec.decode(schema, envelope.data());
            } catch (RuntimeException e) {
                log.error("Inner payload deserialization failed for {} ({}): {}",
                    message, envelope.dataschema(), e.getMessage());
                messageLog.markDeadLetter(entry.id(), "Deserialization failed: " + ErrorTraces.message(e),
                    ErrorTraces.stackTrace(e));
                return ProcessOutcome.DEAD_LETTER;
            }
        }

        if (properties.isLogPayloadOnSuccess()) {
            messageLog.updatePayloadJson(entry.id(), toJson(payload));
        }

        Optional<EventHandler> found = handlerRegistry.findHandler(envelope.type());
        if (found.isEmpty()) {
            messageLog.markSkipped(entry.id(), "No handler for event type: " + envelope.type());
            log.info("No handler for event type {} ({})", envelope.type(), message);
            return ProcessOutcome.SKIPPED;
        }

        EventHandler handler = found.get();
        messageLog.updateHandlerName(entry.id(), handler.name());
        Map<String, Object> strippedEnvelope = envelope.withoutData();

        if (handler.hasCondition()) {
            Map<String, Object> bindings = Map.of("payload", payload, "envelope", strippedEnvelope);
            try {
                if (!evaluator.test(handler.condition(), bindings)) {
                    messageLog.markSkipped(entry.id(), "Handler condition returned falsy");
                    return ProcessOutcome.SKIPPED;
                }
            } catch (RuntimeException e) {
                log.error("Condition of handler {} failed for {}: {}", handler.name(), message, e.getMessage());
                messageLog.markFailed(entry.id(), "Handler condition eval failed: " + ErrorTraces.message(e),
                    ErrorTraces.stackTrace(e));
                return ProcessOutcome.FAILED;
            }
        }

        actionDispatcher.dispatch(handler, payload, strippedEnvelope);
        messageLog.markProcessed(entry.id(), clock.instant());
        log.info("Message consumed topic={} event={} handler={}", message.topic(), envelope.type(), handler.name());

        requestCorrelation(payload);
        return ProcessOutcome.PROCESSED;
    }

    private void requestCorrelation(Map<String, Object> payload) {
        if (!properties.getCorrelation().isEnabled()) {
            return;
        }
        Object businessKey = payload.get(correlationService.getBusinessKeyField());
        if (businessKey != null) {
            correlationService.correlateAsync(String.valueOf(businessKey));
        }
    }

    private void recordDeadLetter(ConsumedMessage message, String key, MessageLogEntry entry, RuntimeException cause) {
        try {
            MessageLogEntry target = entry;
            if (target == null) {
                String entryKey = key != null ? key : "invalid:" + message.topic() + ":" + message.partition()
                    + ":" + message.offset();
                target = messageLog.create(MessageLogEntry.consumed(
                    entryKey, null, UNKNOWN_EVENT, message.topic(), message.partition(), message.offset(), null));
            }
            messageLog.markDeadLetter(target.id(), ErrorTraces.message(cause), ErrorTraces.stackTrace(cause));
        } catch (RuntimeException e) {
            log.error("Could not record dead letter for {}: {}", message, e.getMessage());
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
