package com.ivamare.connect.codec;

import org.apache.avro.Schema;

/**
 * How the registry subject of a message value schema is derived.
 */
public enum SubjectNameStrategy {
    /** {@code <topic>-value} */
    TOPIC_NAME,

    /** Fully qualified record name, e.g. {@code org.apache.fineract.avro.MessageV1} */
    RECORD_NAME,

    /** {@code <topic>-<fully qualified record name>} */
    TOPIC_RECORD_NAME;

    public String subjectFor(String topic, Schema recordSchema) {
        return switch (this) {
            case TOPIC_NAME -> topic + "-value";
            case RECORD_NAME -> recordSchema.getFullName();
            case TOPIC_RECORD_NAME -> topic + "-" + recordSchema.getFullName();
        };
    }
}
