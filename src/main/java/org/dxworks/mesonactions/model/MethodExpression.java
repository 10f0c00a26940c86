package org.dxworks.mesonactions.model;

/**
 * Method call on an object, e.g. {@code fs.copyfile('a')}.
 */
public class MethodExpression extends Node {
    private final Node object;
    private final IdExpression id;
    private final ArgumentList args;

    public MethodExpression(Location location, Node object, IdExpression id, ArgumentList args) {
        super(location);
        this.object = adopt(object);
        this.id = adopt(id);
        this.args = adopt(args);
    }

    public Node getObject() {
        return object;
    }

    public IdExpression getId() {
        return id;
    }

    public ArgumentList getArgs() {
        return args;
    }

    @Override
    public void accept(CodeVisitor visitor) {
        visitor.visitMethodExpression(this);
    }

    @Override
    public void visitChildren(CodeVisitor visitor) {
        object.accept(visitor);
        id.accept(visitor);
        args.accept(visitor);
    }
}
