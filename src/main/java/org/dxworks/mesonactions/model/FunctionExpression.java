package org.dxworks.mesonactions.model;

/**
 * Call of a free function, e.g. {@code static_library('foo', 'foo.c')}.
 */
public class FunctionExpression extends Node {
    private final IdExpression id;
    private final ArgumentList args;

    public FunctionExpression(Location location, IdExpression id, ArgumentList args) {
        super(location);
        this.id = adopt(id);
        this.args = adopt(args);
    }

    public IdExpression getId() {
        return id;
    }

    public String getFunctionName() {
        return id.getId();
    }

    public ArgumentList getArgs() {
        return args;
    }

    @Override
    public void accept(CodeVisitor visitor) {
        visitor.visitFunctionExpression(this);
    }

    @Override
    public void visitChildren(CodeVisitor visitor) {
        id.accept(visitor);
        args.accept(visitor);
    }
}
