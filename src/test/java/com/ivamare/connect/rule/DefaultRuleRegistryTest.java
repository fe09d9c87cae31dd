package com.ivamare.connect.rule;

import com.ivamare.connect.exception.ValidationException;
import com.ivamare.connect.expression.SpelEvaluator;
import com.ivamare.connect.mapping.FieldMapping;
import com.ivamare.connect.mapping.MappingSource;
import com.ivamare.connect.model.DocumentEvent;
import com.ivamare.connect.model.FieldType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DefaultRuleRegistry")
class DefaultRuleRegistryTest {

    private DefaultRuleRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new DefaultRuleRegistry(new SpelEvaluator());
    }

    private static EmissionRule.Builder rule(String name) {
        return EmissionRule.builder(name)
            .on("Customer", DocumentEvent.ON_UPDATE)
            .mapping(FieldMapping.field("clientId", FieldType.STRING, "name"))
            .command("UpdateClientCommand", "UpdateClientCommand");
    }

    @Test
    @DisplayName("should register, replace and remove rules by name")
    void shouldManageRules() {
        registry.register(rule("r1").build());
        registry.register(rule("r1").priority(3).build());

        assertEquals(1, registry.all().size());
        assertEquals(3, registry.getOrThrow("r1").priority());

        registry.remove("r1");

        assertTrue(registry.get("r1").isEmpty());
        assertThrows(ValidationException.class, () -> registry.getOrThrow("r1"));
    }

    @Test
    @DisplayName("should reject a malformed condition")
    void shouldRejectMalformedCondition() {
        assertThrows(ValidationException.class, () ->
            registry.register(rule("bad").condition("doc.status ==").build()));
        assertTrue(registry.all().isEmpty());
    }

    @Test
    @DisplayName("should reject a malformed expression mapping")
    void shouldRejectMalformedExpressionMapping() {
        EmissionRule bad = rule("bad")
            .mapping(new FieldMapping("x", FieldType.STRING, false, null, new MappingSource.ExpressionSource("doc.(")))
            .build();

        assertThrows(ValidationException.class, () -> registry.register(bad));
    }

    @Test
    @DisplayName("rules should require at least one mapping and default the category")
    void rulesShouldValidateFields() {
        assertThrows(ValidationException.class, () ->
            new EmissionRule("r", "Customer", DocumentEvent.ON_UPDATE, null, List.of(), "T", null, "S", null, null, 10, true));

        EmissionRule rule = rule("r").build();

        assertEquals("command", rule.commandCategory());
        assertFalse(rule.hasCondition());
    }
}
