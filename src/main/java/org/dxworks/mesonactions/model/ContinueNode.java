package org.dxworks.mesonactions.model;

public class ContinueNode extends Node {

    public ContinueNode(Location location) {
        super(location);
    }

    @Override
    public void accept(CodeVisitor visitor) {
        visitor.visitContinueNode(this);
    }

    @Override
    public void visitChildren(CodeVisitor visitor) {
    }
}
