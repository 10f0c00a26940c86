package org.dxworks.mesonactions.model;

/**
 * Ternary {@code condition ? ifTrue : ifFalse}.
 */
public class ConditionalExpression extends Node {
    private final Node condition;
    private final Node ifTrue;
    private final Node ifFalse;

    public ConditionalExpression(Location location, Node condition, Node ifTrue, Node ifFalse) {
        super(location);
        this.condition = adopt(condition);
        this.ifTrue = adopt(ifTrue);
        this.ifFalse = adopt(ifFalse);
    }

    public Node getCondition() {
        return condition;
    }

    public Node getIfTrue() {
        return ifTrue;
    }

    public Node getIfFalse() {
        return ifFalse;
    }

    @Override
    public void accept(CodeVisitor visitor) {
        visitor.visitConditionalExpression(this);
    }

    @Override
    public void visitChildren(CodeVisitor visitor) {
        condition.accept(visitor);
        ifTrue.accept(visitor);
        ifFalse.accept(visitor);
    }
}
