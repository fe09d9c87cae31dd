package com.ivamare.connect.rule;

import com.ivamare.connect.model.DocumentEvent;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Registry of emission rules.
 */
public interface RuleRegistry {

    /**
     * Register or replace a rule after validating it.
     *
     * @throws com.ivamare.connect.exception.ValidationException if the rule is malformed
     */
    void register(EmissionRule rule);

    void remove(String ruleName);

    Optional<EmissionRule> get(String ruleName);

    /**
     * @throws com.ivamare.connect.exception.ValidationException if no such rule exists
     */
    EmissionRule getOrThrow(String ruleName);

    /**
     * Enabled rules for a document type and event, unordered.
     */
    List<EmissionRule> findEnabled(String entityType, DocumentEvent event);

    /**
     * Entity types with at least one enabled rule.
     */
    Set<String> activeEntityTypes();

    List<EmissionRule> all();
}
