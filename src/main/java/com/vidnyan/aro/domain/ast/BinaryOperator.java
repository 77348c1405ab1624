package com.vidnyan.aro.domain.ast;

/**
 * Binary operators with their binding power. Higher binds tighter.
 */
public enum BinaryOperator {
    OR("or", 1),
    AND("and", 2),
    EQUAL("==", 3),
    NOT_EQUAL("!=", 3),
    LESS("<", 3),
    LESS_EQUAL("<=", 3),
    GREATER(">", 3),
    GREATER_EQUAL(">=", 3),
    CONTAINS("contains", 3),
    MATCHES("matches", 3),
    ADD("+", 4),
    SUBTRACT("-", 4),
    CONCAT("++", 4),
    MULTIPLY("*", 5),
    DIVIDE("/", 5),
    MODULO("%", 5);

    public static final int UNARY_PRECEDENCE = 6;
    public static final int POSTFIX_PRECEDENCE = 7;

    private final String symbol;
    private final int precedence;

    BinaryOperator(String symbol, int precedence) {
        this.symbol = symbol;
        this.precedence = precedence;
    }

    public String symbol() {
        return symbol;
    }

    public int precedence() {
        return precedence;
    }
}
