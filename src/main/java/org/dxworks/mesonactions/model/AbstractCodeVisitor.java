package org.dxworks.mesonactions.model;

/**
 * Visitor that walks the whole tree. Subclasses override the node kinds they care about and call
 * {@link #visitChildren(Node)} to keep descending.
 */
public abstract class AbstractCodeVisitor implements CodeVisitor {

    protected void visitChildren(Node node) {
        node.visitChildren(this);
    }

    @Override
    public void visitArgumentList(ArgumentList node) {
        visitChildren(node);
    }

    @Override
    public void visitArrayLiteral(ArrayLiteral node) {
        visitChildren(node);
    }

    @Override
    public void visitAssignmentStatement(AssignmentStatement node) {
        visitChildren(node);
    }

    @Override
    public void visitBinaryExpression(BinaryExpression node) {
        visitChildren(node);
    }

    @Override
    public void visitBooleanLiteral(BooleanLiteral node) {
        visitChildren(node);
    }

    @Override
    public void visitBuildDefinition(BuildDefinition node) {
        visitChildren(node);
    }

    @Override
    public void visitConditionalExpression(ConditionalExpression node) {
        visitChildren(node);
    }

    @Override
    public void visitDictionaryLiteral(DictionaryLiteral node) {
        visitChildren(node);
    }

    @Override
    public void visitFunctionExpression(FunctionExpression node) {
        visitChildren(node);
    }

    @Override
    public void visitIdExpression(IdExpression node) {
        visitChildren(node);
    }

    @Override
    public void visitIntegerLiteral(IntegerLiteral node) {
        visitChildren(node);
    }

    @Override
    public void visitIterationStatement(IterationStatement node) {
        visitChildren(node);
    }

    @Override
    public void visitKeyValueItem(KeyValueItem node) {
        visitChildren(node);
    }

    @Override
    public void visitKeywordItem(KeywordItem node) {
        visitChildren(node);
    }

    @Override
    public void visitMethodExpression(MethodExpression node) {
        visitChildren(node);
    }

    @Override
    public void visitSelectionStatement(SelectionStatement node) {
        visitChildren(node);
    }

    @Override
    public void visitStringLiteral(StringLiteral node) {
        visitChildren(node);
    }

    @Override
    public void visitSubscriptExpression(SubscriptExpression node) {
        visitChildren(node);
    }

    @Override
    public void visitUnaryExpression(UnaryExpression node) {
        visitChildren(node);
    }

    @Override
    public void visitErrorNode(ErrorNode node) {
        visitChildren(node);
    }

    @Override
    public void visitBreakNode(BreakNode node) {
        visitChildren(node);
    }

    @Override
    public void visitContinueNode(ContinueNode node) {
        visitChildren(node);
    }
}
