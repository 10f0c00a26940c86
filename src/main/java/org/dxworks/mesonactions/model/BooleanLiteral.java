package org.dxworks.mesonactions.model;

public class BooleanLiteral extends Node {
    private final boolean value;

    public BooleanLiteral(Location location, boolean value) {
        super(location);
        this.value = value;
    }

    public boolean getValue() {
        return value;
    }

    @Override
    public void accept(CodeVisitor visitor) {
        visitor.visitBooleanLiteral(this);
    }

    @Override
    public void visitChildren(CodeVisitor visitor) {
    }
}
