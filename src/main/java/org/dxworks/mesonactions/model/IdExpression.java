package org.dxworks.mesonactions.model;

public class IdExpression extends Node {
    private final String id;

    public IdExpression(Location location, String id) {
        super(location);
        this.id = id;
    }

    public String getId() {
        return id;
    }

    @Override
    public void accept(CodeVisitor visitor) {
        visitor.visitIdExpression(this);
    }

    @Override
    public void visitChildren(CodeVisitor visitor) {
    }
}
