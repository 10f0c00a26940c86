package org.dxworks.mesonactions.model;

/**
 * Placeholder the parser leaves where it could not make sense of the input.
 */
public class ErrorNode extends Node {
    private final String message;

    public ErrorNode(Location location, String message) {
        super(location);
        this.message = message;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public void accept(CodeVisitor visitor) {
        visitor.visitErrorNode(this);
    }

    @Override
    public void visitChildren(CodeVisitor visitor) {
    }
}
