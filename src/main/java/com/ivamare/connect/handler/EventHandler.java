package com.ivamare.connect.handler;

import com.ivamare.connect.exception.ValidationException;

import java.util.List;

/**
 * Inbound trigger linking a business event type to actions.
 *
 * @param name Unique handler name
 * @param eventType Business event type matched exactly
 * @param condition Optional guard over {@code payload} and {@code envelope}
 * @param actions Actions dispatched in order
 * @param enabled Whether the handler is considered at all
 */
public record EventHandler(
    String name,
    String eventType,
    String condition,
    List<Action> actions,
    boolean enabled
) {
    public EventHandler {
        if (name == null || name.isBlank()) {
            throw new ValidationException("name", "is required");
        }
        if (eventType == null || eventType.isBlank()) {
            throw new ValidationException("eventType", "is required for handler " + name);
        }
        actions = actions == null ? List.of() : List.copyOf(actions);
    }

    public static EventHandler of(String name, String eventType, Action... actions) {
        return new EventHandler(name, eventType, null, List.of(actions), true);
    }

    public EventHandler withCondition(String condition) {
        return new EventHandler(name, eventType, condition, actions, enabled);
    }

    public boolean hasCondition() {
        return condition != null && !condition.isBlank();
    }
}
