package org.dxworks.mesonactions.model;

public class BinaryExpression extends Node {
    private final Node lhs;
    private final BinaryOperator operator;
    private final Node rhs;

    public BinaryExpression(Location location, Node lhs, BinaryOperator operator, Node rhs) {
        super(location);
        this.lhs = adopt(lhs);
        this.operator = operator;
        this.rhs = adopt(rhs);
    }

    public Node getLhs() {
        return lhs;
    }

    public BinaryOperator getOperator() {
        return operator;
    }

    public Node getRhs() {
        return rhs;
    }

    @Override
    public void accept(CodeVisitor visitor) {
        visitor.visitBinaryExpression(this);
    }

    @Override
    public void visitChildren(CodeVisitor visitor) {
        lhs.accept(visitor);
        rhs.accept(visitor);
    }
}
