package com.ivamare.connect.model;

import java.util.Optional;

/**
 * Document lifecycle events an emission rule can trigger on.
 */
public enum DocumentEvent {
    AFTER_INSERT("after_insert"),
    ON_UPDATE("on_update"),
    ON_SUBMIT("on_submit"),
    ON_CANCEL("on_cancel"),
    ON_TRASH("on_trash");

    private final String value;

    DocumentEvent(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Map a host hook name to an event, if it is one we react to.
     *
     * @param hookName the host's lifecycle hook name
     * @return the matching event, empty for hooks the bridge ignores
     */
    public static Optional<DocumentEvent> fromHookName(String hookName) {
        for (DocumentEvent event : values()) {
            if (event.value.equals(hookName)) {
                return Optional.of(event);
            }
        }
        return Optional.empty();
    }

    public static DocumentEvent fromValue(String value) {
        return fromHookName(value)
            .orElseThrow(() -> new IllegalArgumentException("Unknown DocumentEvent: " + value));
    }
}
