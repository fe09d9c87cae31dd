package com.ivamare.connect.rule;

import com.ivamare.connect.exception.ValidationException;
import com.ivamare.connect.mapping.FieldMapping;
import com.ivamare.connect.model.DocumentEvent;

import java.util.ArrayList;
import java.util.List;

/**
 * Outbound trigger linking a document lifecycle event to a command message.
 *
 * @param name Unique rule name
 * @param entityType Source document type
 * @param event Triggering lifecycle event
 * @param condition Optional guard expression over {@code doc}
 * @param mappings Ordered payload field mappings, at least one
 * @param commandType Envelope {@code type}
 * @param commandCategory Envelope {@code category}
 * @param schemaName Inner payload schema name
 * @param topicOverride Topic used instead of the default command topic (nullable)
 * @param tenantOverride Tenant used instead of the default tenant (nullable)
 * @param priority Lower runs first
 * @param enabled Whether the rule is considered at all
 */
public record EmissionRule(
    String name,
    String entityType,
    DocumentEvent event,
    String condition,
    List<FieldMapping> mappings,
    String commandType,
    String commandCategory,
    String schemaName,
    String topicOverride,
    String tenantOverride,
    int priority,
    boolean enabled
) {
    public EmissionRule {
        requireText("name", name);
        requireText("entityType", entityType);
        requireText("commandType", commandType);
        requireText("schemaName", schemaName);
        if (event == null) {
            throw new ValidationException("event", "is required for rule " + name);
        }
        if (mappings == null || mappings.isEmpty()) {
            throw new ValidationException("mappings", "rule " + name + " needs at least one field mapping");
        }
        mappings = List.copyOf(mappings);
        if (commandCategory == null || commandCategory.isBlank()) {
            commandCategory = "command";
        }
    }

    public boolean hasCondition() {
        return condition != null && !condition.isBlank();
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    private static void requireText(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field, "is required");
        }
    }

    /**
     * Builder for rules defined in code.
     */
    public static final class Builder {

        private final String name;
        private String entityType;
        private DocumentEvent event;
        private String condition;
        private final List<FieldMapping> mappings = new ArrayList<>();
        private String commandType;
        private String commandCategory;
        private String schemaName;
        private String topicOverride;
        private String tenantOverride;
        private int priority = 10;
        private boolean enabled = true;

        private Builder(String name) {
            this.name = name;
        }

        public Builder on(String entityType, DocumentEvent event) {
            this.entityType = entityType;
            this.event = event;
            return this;
        }

        public Builder condition(String condition) {
            this.condition = condition;
            return this;
        }

        public Builder mapping(FieldMapping mapping) {
            this.mappings.add(mapping);
            return this;
        }

        public Builder command(String commandType, String schemaName) {
            this.commandType = commandType;
            this.schemaName = schemaName;
            return this;
        }

        public Builder category(String commandCategory) {
            this.commandCategory = commandCategory;
            return this;
        }

        public Builder topic(String topicOverride) {
            this.topicOverride = topicOverride;
            return this;
        }

        public Builder tenant(String tenantOverride) {
            this.tenantOverride = tenantOverride;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public EmissionRule build() {
            return new EmissionRule(name, entityType, event, condition, mappings, commandType,
                commandCategory, schemaName, topicOverride, tenantOverride, priority, enabled);
        }
    }
}
