package com.ivamare.connect.expression;

import java.util.Collection;
import java.util.Map;
import java.util.Set;

/**
 * Sandboxed evaluator for user-authored guard and mapping expressions.
 *
 * <p>Expressions see only the bindings they are given, named {@code doc},
 * {@code payload} or {@code envelope}. They have no access to types, beans,
 * constructors or any other process state.
 */
public interface Evaluator {

    /**
     * Names an expression may be bound to.
     */
    Set<String> ALLOWED_BINDINGS = Set.of("doc", "payload", "envelope");

    /**
     * Evaluate an expression to a value.
     *
     * @param expression the expression text
     * @param bindings variables visible to the expression
     * @return the result, may be null
     * @throws com.ivamare.connect.exception.ExpressionEvaluationException if parsing or evaluation fails
     * @throws com.ivamare.connect.exception.ValidationException if a binding name is not allowed
     */
    Object evaluate(String expression, Map<String, Object> bindings);

    /**
     * Evaluate a guard expression and apply truthiness to the result.
     *
     * @param expression the guard text
     * @param bindings variables visible to the expression
     * @return true if the result is truthy
     */
    default boolean test(String expression, Map<String, Object> bindings) {
        return isTruthy(evaluate(expression, bindings));
    }

    /**
     * Check that an expression parses, without evaluating it.
     *
     * @throws com.ivamare.connect.exception.ValidationException if it does not
     */
    void validate(String expression);

    /**
     * Truthiness: null, false, zero, and empty strings or containers are falsy.
     */
    static boolean isTruthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Number n) {
            return n.doubleValue() != 0d;
        }
        if (value instanceof CharSequence s) {
            return s.length() > 0;
        }
        if (value instanceof Collection<?> c) {
            return !c.isEmpty();
        }
        if (value instanceof Map<?, ?> m) {
            return !m.isEmpty();
        }
        return true;
    }
}
