package com.ivamare.connect.rule;

import com.ivamare.connect.exception.ValidationException;
import com.ivamare.connect.expression.Evaluator;
import com.ivamare.connect.mapping.MappingSource;
import com.ivamare.connect.model.DocumentEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory RuleRegistry.
 *
 * <p>Conditions and expression mappings are parsed at registration, so a malformed rule
 * is rejected before it can match anything.
 */
public class DefaultRuleRegistry implements RuleRegistry {

    private static final Logger log = LoggerFactory.getLogger(DefaultRuleRegistry.class);

    private final Evaluator evaluator;
    private final Map<String, EmissionRule> rules = new ConcurrentHashMap<>();

    public DefaultRuleRegistry(Evaluator evaluator) {
        this.evaluator = evaluator;
    }

    @Override
    public void register(EmissionRule rule) {
        if (rule.hasCondition()) {
            evaluator.validate(rule.condition());
        }
        rule.mappings().forEach(mapping -> {
            if (mapping.source() instanceof MappingSource.ExpressionSource expression) {
                evaluator.validate(expression.expression());
            }
        });

        EmissionRule previous = rules.put(rule.name(), rule);
        log.info("{} emission rule {} ({} {} -> {})", previous == null ? "Registered" : "Replaced",
            rule.name(), rule.entityType(), rule.event().getValue(), rule.commandType());
    }

    @Override
    public void remove(String ruleName) {
        if (rules.remove(ruleName) != null) {
            log.info("Removed emission rule {}", ruleName);
        }
    }

    @Override
    public Optional<EmissionRule> get(String ruleName) {
        return Optional.ofNullable(rules.get(ruleName));
    }

    @Override
    public EmissionRule getOrThrow(String ruleName) {
        return get(ruleName).orElseThrow(() -> new ValidationException("ruleName", "unknown rule " + ruleName));
    }

    @Override
    public List<EmissionRule> findEnabled(String entityType, DocumentEvent event) {
        return rules.values().stream()
            .filter(EmissionRule::enabled)
            .filter(rule -> rule.entityType().equals(entityType) && rule.event() == event)
            .toList();
    }

    @Override
    public Set<String> activeEntityTypes() {
        return rules.values().stream()
            .filter(EmissionRule::enabled)
            .map(EmissionRule::entityType)
            .collect(Collectors.toUnmodifiableSet());
    }

    @Override
    public List<EmissionRule> all() {
        return List.copyOf(rules.values());
    }
}
