package com.ivamare.connect.handler;

import java.util.List;
import java.util.Optional;

/**
 * Registry of inbound event handlers.
 */
public interface EventHandlerRegistry {

    /**
     * Register or replace a handler after validating it.
     *
     * @throws com.ivamare.connect.exception.ValidationException if the handler is malformed
     */
    void register(EventHandler handler);

    void remove(String handlerName);

    /**
     * The enabled handler for an event type, if any.
     */
    Optional<EventHandler> findHandler(String eventType);

    List<EventHandler> all();
}
