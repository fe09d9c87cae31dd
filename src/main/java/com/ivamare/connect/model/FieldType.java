package com.ivamare.connect.model;

/**
 * Primitive target type of a mapped payload field.
 */
public enum FieldType {
    STRING("string"),
    INT("int"),
    LONG("long"),
    BOOLEAN("boolean"),
    BYTES("bytes");

    private final String value;

    FieldType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static FieldType fromValue(String value) {
        for (FieldType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown FieldType: " + value);
    }
}
