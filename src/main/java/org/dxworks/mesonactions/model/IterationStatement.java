package org.dxworks.mesonactions.model;

import java.util.List;

/**
 * {@code foreach ids : expression ... endforeach}.
 */
public class IterationStatement extends Node {
    private final List<IdExpression> ids;
    private final Node expression;
    private final List<Node> statements;

    public IterationStatement(Location location, List<IdExpression> ids, Node expression, List<Node> statements) {
        super(location);
        this.ids = adoptAll(ids);
        this.expression = adopt(expression);
        this.statements = adoptAll(statements);
    }

    public List<IdExpression> getIds() {
        return ids;
    }

    public Node getExpression() {
        return expression;
    }

    public List<Node> getStatements() {
        return statements;
    }

    @Override
    public void accept(CodeVisitor visitor) {
        visitor.visitIterationStatement(this);
    }

    @Override
    public void visitChildren(CodeVisitor visitor) {
        visitAll(ids, visitor);
        expression.accept(visitor);
        visitAll(statements, visitor);
    }
}
