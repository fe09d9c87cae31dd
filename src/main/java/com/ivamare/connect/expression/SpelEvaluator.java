package com.ivamare.connect.expression;

import com.ivamare.connect.exception.ExpressionEvaluationException;
import com.ivamare.connect.exception.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.expression.MapAccessor;
import org.springframework.expression.EvaluationContext;
import org.springframework.expression.EvaluationException;
import org.springframework.expression.Expression;
import org.springframework.expression.ExpressionParser;
import org.springframework.expression.ParseException;
import org.springframework.expression.spel.standard.SpelExpressionParser;
import org.springframework.expression.spel.support.DataBindingPropertyAccessor;
import org.springframework.expression.spel.support.SimpleEvaluationContext;

import java.util.Collections;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link Evaluator} backed by SpEL with a {@link SimpleEvaluationContext}.
 *
 * <p>The context is read-only: map keys and public properties can be read and instance
 * methods such as {@code doc.name.toUpperCase()} invoked, but type references
 * ({@code T(...)}), constructors, bean references and assignment are rejected.
 * Bindings are exposed both as variables ({@code #doc.status}) and as properties of the
 * root object ({@code doc.status}).
 *
 * <p>Parsed expressions are cached by their text.
 */
public class SpelEvaluator implements Evaluator {

    private static final Logger log = LoggerFactory.getLogger(SpelEvaluator.class);

    private final ExpressionParser parser = new SpelExpressionParser();
    private final Map<String, Expression> cache = new ConcurrentHashMap<>();

    @Override
    public Object evaluate(String expression, Map<String, Object> bindings) {
        for (String name : bindings.keySet()) {
            if (!ALLOWED_BINDINGS.contains(name)) {
                throw new ValidationException("bindings", "binding '" + name + "' is not allowed");
            }
        }

        Expression parsed = parse(expression);
        try {
            Object result = parsed.getValue(createContext(bindings));
            log.debug("Evaluated [{}] -> {}", expression, result);
            return result;
        } catch (EvaluationException e) {
            throw new ExpressionEvaluationException(expression, e);
        }
    }

    @Override
    public void validate(String expression) {
        try {
            parse(expression);
        } catch (ExpressionEvaluationException e) {
            throw new ValidationException("expression", e.getMessage());
        }
    }

    private Expression parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new ValidationException("expression", "must not be blank");
        }
        Expression cached = cache.get(expression);
        if (cached != null) {
            return cached;
        }
        try {
            Expression parsed = parser.parseExpression(expression);
            cache.put(expression, parsed);
            return parsed;
        } catch (ParseException e) {
            throw new ExpressionEvaluationException(expression, e);
        }
    }

    private EvaluationContext createContext(Map<String, Object> bindings) {
        SimpleEvaluationContext context = SimpleEvaluationContext
            .forPropertyAccessors(new MapAccessor(), DataBindingPropertyAccessor.forReadOnlyAccess())
            .withInstanceMethods()
            .withRootObject(Collections.unmodifiableMap(bindings))
            .build();
        bindings.forEach(context::setVariable);
        return context;
    }
}
