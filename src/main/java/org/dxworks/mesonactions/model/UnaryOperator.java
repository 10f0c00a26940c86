package org.dxworks.mesonactions.model;

public enum UnaryOperator {
    NOT("not "),
    NEGATE("-");

    private final String symbol;

    UnaryOperator(String symbol) {
        this.symbol = symbol;
    }

    /** Source prefix, including the trailing space for {@code not}. */
    public String getSymbol() {
        return symbol;
    }
}
