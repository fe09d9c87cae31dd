package com.ivamare.connect.rule;

import com.ivamare.connect.document.Document;
import com.ivamare.connect.expression.Evaluator;
import com.ivamare.connect.model.DocumentEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Selects the emission rules that fire for a document event.
 */
public class RuleMatchingEngine {

    private static final Logger log = LoggerFactory.getLogger(RuleMatchingEngine.class);

    private static final Comparator<EmissionRule> RULE_ORDER =
        Comparator.comparingInt(EmissionRule::priority).thenComparing(EmissionRule::name);

    private final RuleRegistry ruleRegistry;
    private final Evaluator evaluator;

    public RuleMatchingEngine(RuleRegistry ruleRegistry, Evaluator evaluator) {
        this.ruleRegistry = ruleRegistry;
        this.evaluator = evaluator;
    }

    /**
     * Enabled rules for a type and event, by ascending priority then name.
     */
    public List<EmissionRule> matchRules(String entityType, DocumentEvent event) {
        return ruleRegistry.findEnabled(entityType, event).stream()
            .sorted(RULE_ORDER)
            .toList();
    }

    /**
     * Whether a document passes a rule's guard. A failing guard counts as false.
     */
    public boolean passesGuard(EmissionRule rule, Document document) {
        if (!rule.hasCondition()) {
            return true;
        }
        try {
            return evaluator.test(rule.condition(), Map.of("doc", document.asMap()));
        } catch (RuntimeException e) {
            log.error("Condition of rule {} failed for {}: {}", rule.name(), document.ref(), e.getMessage());
            return false;
        }
    }

    /**
     * Matched rules whose guards pass for the document, in match order.
     */
    public List<EmissionRule> selectRules(Document document, DocumentEvent event) {
        List<EmissionRule> selected = new ArrayList<>();
        for (EmissionRule rule : matchRules(document.entityType(), event)) {
            if (passesGuard(rule, document)) {
                selected.add(rule);
            } else {
                log.debug("Rule {} skipped for {}", rule.name(), document.ref());
            }
        }
        return selected;
    }

    public boolean hasRulesFor(String entityType) {
        return ruleRegistry.activeEntityTypes().contains(entityType);
    }
}
