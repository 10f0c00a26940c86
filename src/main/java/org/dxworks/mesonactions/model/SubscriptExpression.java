package org.dxworks.mesonactions.model;

/**
 * {@code outer[inner]}.
 */
public class SubscriptExpression extends Node {
    private final Node outer;
    private final Node inner;

    public SubscriptExpression(Location location, Node outer, Node inner) {
        super(location);
        this.outer = adopt(outer);
        this.inner = adopt(inner);
    }

    public Node getOuter() {
        return outer;
    }

    public Node getInner() {
        return inner;
    }

    @Override
    public void accept(CodeVisitor visitor) {
        visitor.visitSubscriptExpression(this);
    }

    @Override
    public void visitChildren(CodeVisitor visitor) {
        outer.accept(visitor);
        inner.accept(visitor);
    }
}
