package com.ivamare.connect.exception;

/**
 * Raised when a guard or mapping expression fails to parse or evaluate.
 */
public class ExpressionEvaluationException extends ConnectException {

    private final String expression;

    public ExpressionEvaluationException(String expression, Throwable cause) {
        super("Failed to evaluate expression [" + expression + "]: " + cause.getMessage(), cause);
        this.expression = expression;
    }

    public String getExpression() {
        return expression;
    }
}
