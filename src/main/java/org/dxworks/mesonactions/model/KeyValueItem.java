package org.dxworks.mesonactions.model;

/**
 * Entry of a dictionary literal.
 */
public class KeyValueItem extends Node {
    private final Node key;
    private final Node value;

    public KeyValueItem(Location location, Node key, Node value) {
        super(location);
        this.key = adopt(key);
        this.value = adopt(value);
    }

    public Node getKey() {
        return key;
    }

    public Node getValue() {
        return value;
    }

    @Override
    public void accept(CodeVisitor visitor) {
        visitor.visitKeyValueItem(this);
    }

    @Override
    public void visitChildren(CodeVisitor visitor) {
        key.accept(visitor);
        value.accept(visitor);
    }
}
