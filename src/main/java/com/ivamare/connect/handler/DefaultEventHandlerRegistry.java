package com.ivamare.connect.handler;

import com.ivamare.connect.exception.ValidationException;
import com.ivamare.connect.expression.Evaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory EventHandlerRegistry.
 *
 * <p>When several enabled handlers match one event type, the first by name wins.
 */
public class DefaultEventHandlerRegistry implements EventHandlerRegistry {

    private static final Logger log = LoggerFactory.getLogger(DefaultEventHandlerRegistry.class);

    private final Evaluator evaluator;
    private final Map<String, EventHandler> handlers = new ConcurrentHashMap<>();

    public DefaultEventHandlerRegistry(Evaluator evaluator) {
        this.evaluator = evaluator;
    }

    @Override
    public void register(EventHandler handler) {
        if (handler.hasCondition()) {
            evaluator.validate(handler.condition());
        }
        for (Action action : handler.actions()) {
            if (action instanceof Action.UpdateDocumentAction update
                    && (update.correlationField() == null || update.correlationField().isBlank())) {
                log.warn("Handler {} updates {} without a correlation field; the action will fail",
                    handler.name(), update.entityType());
            }
            if (action instanceof Action.CreateDocumentAction create && create.fieldMappings().isEmpty()) {
                throw new ValidationException("fieldMappings",
                    "handler " + handler.name() + " creates " + create.entityType() + " without field mappings");
            }
        }

        EventHandler previous = handlers.put(handler.name(), handler);
        log.info("{} event handler {} for {} ({} actions)", previous == null ? "Registered" : "Replaced",
            handler.name(), handler.eventType(), handler.actions().size());
    }

    @Override
    public void remove(String handlerName) {
        if (handlers.remove(handlerName) != null) {
            log.info("Removed event handler {}", handlerName);
        }
    }

    @Override
    public Optional<EventHandler> findHandler(String eventType) {
        return handlers.values().stream()
            .filter(EventHandler::enabled)
            .filter(h -> h.eventType().equals(eventType))
            .min(Comparator.comparing(EventHandler::name));
    }

    @Override
    public List<EventHandler> all() {
        return List.copyOf(handlers.values());
    }
}
