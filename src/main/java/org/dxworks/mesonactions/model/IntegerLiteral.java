package org.dxworks.mesonactions.model;

/**
 * Integer literal. {@code text} is the literal as written ({@code 42}, {@code 0x2A}, {@code 0o52},
 * {@code 0b101010}); {@code value} is what it evaluates to.
 */
public class IntegerLiteral extends Node {
    private final long value;
    private final String text;

    public IntegerLiteral(Location location, long value, String text) {
        super(location);
        this.value = value;
        this.text = text;
    }

    public long getValue() {
        return value;
    }

    public String getText() {
        return text;
    }

    @Override
    public void accept(CodeVisitor visitor) {
        visitor.visitIntegerLiteral(this);
    }

    @Override
    public void visitChildren(CodeVisitor visitor) {
    }
}
