package org.dxworks.mesonactions.model;

public class UnaryExpression extends Node {
    private final UnaryOperator operator;
    private final Node expression;

    public UnaryExpression(Location location, UnaryOperator operator, Node expression) {
        super(location);
        this.operator = operator;
        this.expression = adopt(expression);
    }

    public UnaryOperator getOperator() {
        return operator;
    }

    public Node getExpression() {
        return expression;
    }

    @Override
    public void accept(CodeVisitor visitor) {
        visitor.visitUnaryExpression(this);
    }

    @Override
    public void visitChildren(CodeVisitor visitor) {
        expression.accept(visitor);
    }
}
