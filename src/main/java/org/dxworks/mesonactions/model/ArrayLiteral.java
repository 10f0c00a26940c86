package org.dxworks.mesonactions.model;

import java.util.List;

public class ArrayLiteral extends Node {
    private final List<Node> elements;

    public ArrayLiteral(Location location, List<Node> elements) {
        super(location);
        this.elements = adoptAll(elements);
    }

    public List<Node> getElements() {
        return elements;
    }

    @Override
    public void accept(CodeVisitor visitor) {
        visitor.visitArrayLiteral(this);
    }

    @Override
    public void visitChildren(CodeVisitor visitor) {
        visitAll(elements, visitor);
    }
}
