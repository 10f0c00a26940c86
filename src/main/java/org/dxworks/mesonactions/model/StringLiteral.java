package org.dxworks.mesonactions.model;

public class StringLiteral extends Node {
    private final String value;
    private final boolean format;

    public StringLiteral(Location location, String value, boolean format) {
        super(location);
        this.value = value;
        this.format = format;
    }

    /** Unescaped content, without quotes. */
    public String getValue() {
        return value;
    }

    /** {@code f'...'} string. */
    public boolean isFormat() {
        return format;
    }

    @Override
    public void accept(CodeVisitor visitor) {
        visitor.visitStringLiteral(this);
    }

    @Override
    public void visitChildren(CodeVisitor visitor) {
    }
}
