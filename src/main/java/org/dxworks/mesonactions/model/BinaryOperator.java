package org.dxworks.mesonactions.model;

public enum BinaryOperator {
    OR("or", 1),
    AND("and", 2),
    EQUALS("==", 3),
    NOT_EQUALS("!=", 3),
    LESS("<", 3),
    LESS_EQUALS("<=", 3),
    GREATER(">", 3),
    GREATER_EQUALS(">=", 3),
    IN("in", 3),
    NOT_IN("not in", 3),
    PLUS("+", 4),
    MINUS("-", 4),
    MULTIPLY("*", 5),
    DIVIDE("/", 5),
    MODULO("%", 5);

    private final String symbol;
    private final int precedence;

    BinaryOperator(String symbol, int precedence) {
        this.symbol = symbol;
        this.precedence = precedence;
    }

    public String getSymbol() {
        return symbol;
    }

    /** Higher binds tighter. */
    public int getPrecedence() {
        return precedence;
    }
}
