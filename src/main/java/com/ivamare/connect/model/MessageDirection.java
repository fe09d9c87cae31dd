package com.ivamare.connect.model;

/**
 * Direction of a logged message relative to this application.
 */
public enum MessageDirection {
    /** Command written to the broker by the producer pipeline */
    PRODUCED("Produced"),

    /** Business event read from the broker by the consumer loop */
    CONSUMED("Consumed");

    private final String value;

    MessageDirection(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static MessageDirection fromValue(String value) {
        for (MessageDirection direction : values()) {
            if (direction.value.equals(value)) {
                return direction;
            }
        }
        throw new IllegalArgumentException("Unknown MessageDirection: " + value);
    }
}
