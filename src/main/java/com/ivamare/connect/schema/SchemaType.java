package com.ivamare.connect.schema;

/**
 * Role of a stored schema, derived from its name.
 */
public enum SchemaType {
    COMMAND("command"),
    ENVELOPE("envelope"),
    EVENT("event");

    private final String value;

    SchemaType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * MessageV1 schemas are envelopes, BusinessEvent schemas are events, everything else is a command.
     */
    public static SchemaType fromSchemaName(String schemaName) {
        if (schemaName.contains("MessageV1")) {
            return ENVELOPE;
        }
        if (schemaName.contains("BusinessEvent")) {
            return EVENT;
        }
        return COMMAND;
    }

    public static SchemaType fromValue(String value) {
        for (SchemaType type : values()) {
            if (type.value.equals(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown SchemaType: " + value);
    }
}
