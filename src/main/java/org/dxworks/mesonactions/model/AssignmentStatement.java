package org.dxworks.mesonactions.model;

public class AssignmentStatement extends Node {
    private final Node lhs;
    private final AssignmentOperator operator;
    private final Node rhs;

    public AssignmentStatement(Location location, Node lhs, AssignmentOperator operator, Node rhs) {
        super(location);
        this.lhs = adopt(lhs);
        this.operator = operator;
        this.rhs = adopt(rhs);
    }

    public Node getLhs() {
        return lhs;
    }

    public AssignmentOperator getOperator() {
        return operator;
    }

    public Node getRhs() {
        return rhs;
    }

    @Override
    public void accept(CodeVisitor visitor) {
        visitor.visitAssignmentStatement(this);
    }

    @Override
    public void visitChildren(CodeVisitor visitor) {
        lhs.accept(visitor);
        rhs.accept(visitor);
    }
}
