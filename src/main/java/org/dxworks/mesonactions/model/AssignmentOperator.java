package org.dxworks.mesonactions.model;

public enum AssignmentOperator {
    ASSIGN("="),
    PLUS_ASSIGN("+=");

    private final String symbol;

    AssignmentOperator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
