package com.herzen.morphius.expression;

public class EvaluationException extends RuntimeException {
    public static final String EMPTY_RANGE = "EMPTY_RANGE";
    public static final String UNBOUND_VARIABLE = "UNBOUND_VARIABLE";
    public static final String MALFORMED_EXPRESSION = "MALFORMED_EXPRESSION";
    public static final String ARITHMETIC_FAULT = "ARITHMETIC_FAULT";

    private final String code;
    private final String expression;

    public EvaluationException(String code, String message, String expression) {
        super(message);
        this.code = code;
        this.expression = expression;
    }

    public EvaluationException(String code, String message, String expression, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.expression = expression;
    }

    public String getCode() {
        return code;
    }

    public String getExpression() {
        return expression;
    }
}
