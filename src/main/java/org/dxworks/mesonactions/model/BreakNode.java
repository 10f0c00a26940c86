package org.dxworks.mesonactions.model;

public class BreakNode extends Node {

    public BreakNode(Location location) {
        super(location);
    }

    @Override
    public void accept(CodeVisitor visitor) {
        visitor.visitBreakNode(this);
    }

    @Override
    public void visitChildren(CodeVisitor visitor) {
    }
}
