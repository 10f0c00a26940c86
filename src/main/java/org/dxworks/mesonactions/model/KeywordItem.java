package org.dxworks.mesonactions.model;

/**
 * Keyword argument of a call, e.g. {@code install: true}.
 */
public class KeywordItem extends Node {
    private final IdExpression key;
    private final Node value;

    public KeywordItem(Location location, IdExpression key, Node value) {
        super(location);
        this.key = adopt(key);
        this.value = adopt(value);
    }

    public IdExpression getKey() {
        return key;
    }

    public String getName() {
        return key.getId();
    }

    public Node getValue() {
        return value;
    }

    @Override
    public void accept(CodeVisitor visitor) {
        visitor.visitKeywordItem(this);
    }

    @Override
    public void visitChildren(CodeVisitor visitor) {
        key.accept(visitor);
        value.accept(visitor);
    }
}
