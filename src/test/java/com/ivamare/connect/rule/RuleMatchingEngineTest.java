package com.ivamare.connect.rule;

import com.ivamare.connect.document.MapDocument;
import com.ivamare.connect.expression.SpelEvaluator;
import com.ivamare.connect.mapping.FieldMapping;
import com.ivamare.connect.model.DocumentEvent;
import com.ivamare.connect.model.FieldType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RuleMatchingEngine")
class RuleMatchingEngineTest {

    private DefaultRuleRegistry registry;
    private RuleMatchingEngine engine;

    @BeforeEach
    void setUp() {
        SpelEvaluator evaluator = new SpelEvaluator();
        registry = new DefaultRuleRegistry(evaluator);
        engine = new RuleMatchingEngine(registry, evaluator);
    }

    private static EmissionRule.Builder rule(String name) {
        return EmissionRule.builder(name)
            .on("Customer", DocumentEvent.AFTER_INSERT)
            .mapping(FieldMapping.field("clientId", FieldType.STRING, "name"))
            .command("CreateClientCommand", "CreateClientCommand");
    }

    @Nested
    @DisplayName("matchRules")
    class MatchRules {

        @Test
        @DisplayName("should order by priority, then name")
        void shouldOrderByPriorityThenName() {
            registry.register(rule("zeta").priority(5).build());
            registry.register(rule("beta").priority(10).build());
            registry.register(rule("alpha").priority(10).build());
            registry.register(rule("first").priority(1).build());

            List<EmissionRule> matched = engine.matchRules("Customer", DocumentEvent.AFTER_INSERT);

            assertThat(matched).extracting(EmissionRule::name).containsExactly("first", "zeta", "alpha", "beta");
        }

        @Test
        @DisplayName("should ignore disabled rules and other events")
        void shouldIgnoreDisabledAndOtherEvents() {
            registry.register(rule("enabled").build());
            registry.register(rule("disabled").enabled(false).build());
            registry.register(rule("update").on("Customer", DocumentEvent.ON_UPDATE).build());

            assertThat(engine.matchRules("Customer", DocumentEvent.AFTER_INSERT))
                .extracting(EmissionRule::name).containsExactly("enabled");
            assertThat(engine.matchRules("Supplier", DocumentEvent.AFTER_INSERT)).isEmpty();
        }
    }

    @Nested
    @DisplayName("selectRules")
    class SelectRules {

        @Test
        @DisplayName("should keep only rules whose guard passes")
        void shouldApplyGuards() {
            registry.register(rule("active-only").condition("doc.status == 'Active'").build());
            registry.register(rule("big-credit").condition("doc.credit_limit > 10000").build());
            registry.register(rule("always").build());

            MapDocument doc = new MapDocument("Customer", "CUST-0001", Map.of("status", "Active", "credit_limit", 500));

            assertThat(engine.selectRules(doc, DocumentEvent.AFTER_INSERT))
                .extracting(EmissionRule::name).containsExactly("active-only", "always");
        }

        @Test
        @DisplayName("should treat a failing guard as false")
        void shouldTreatFailingGuardAsFalse() {
            EmissionRule broken = rule("broken").condition("doc.missing_field > 1").build();
            MapDocument doc = new MapDocument("Customer", "CUST-0001", Map.of());

            assertThat(engine.passesGuard(broken, doc)).isFalse();
        }
    }

    @Test
    @DisplayName("hasRulesFor should reflect enabled rules only")
    void hasRulesForShouldReflectEnabledRules() {
        registry.register(rule("disabled").enabled(false).build());

        assertThat(engine.hasRulesFor("Customer")).isFalse();

        registry.register(rule("enabled").build());

        assertThat(engine.hasRulesFor("Customer")).isTrue();
    }
}
