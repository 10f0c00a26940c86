package org.dxworks.mesonactions.format;

import org.dxworks.mesonactions.model.*;

import java.util.List;

/**
 * Renders nodes back to Meson source. Used for arguments synthesized by the recognizers; the result
 * is normalized (single quotes, {@code ", "} separators, two-space indentation).
 */
public class SourcePrinter implements CodeVisitor {
    private static final String INDENT = "  ";

    private final StringBuilder out = new StringBuilder();
    private int depth;

    public static String print(Node node) {
        SourcePrinter printer = new SourcePrinter();
        node.accept(printer);
        return printer.out.toString();
    }

    public static String printArguments(List<? extends Node> args) {
        SourcePrinter printer = new SourcePrinter();
        printer.printList(args);
        return printer.out.toString();
    }

    public static String quote(String value) {
        StringBuilder quoted = new StringBuilder("'");
        for (char c : value.toCharArray()) {
            switch (c) {
                case '\\' -> quoted.append("\\\\");
                case '\'' -> quoted.append("\\'");
                case '\n' -> quoted.append("\\n");
                case '\t' -> quoted.append("\\t");
                default -> quoted.append(c);
            }
        }
        return quoted.append('\'').toString();
    }

    @Override
    public void visitArgumentList(ArgumentList node) {
        printList(node.getArgs());
    }

    @Override
    public void visitArrayLiteral(ArrayLiteral node) {
        out.append('[');
        printList(node.getElements());
        out.append(']');
    }

    @Override
    public void visitAssignmentStatement(AssignmentStatement node) {
        node.getLhs().accept(this);
        out.append(' ').append(node.getOperator().getSymbol()).append(' ');
        node.getRhs().accept(this);
    }

    @Override
    public void visitBinaryExpression(BinaryExpression node) {
        int precedence = node.getOperator().getPrecedence();
        printOperand(node.getLhs(), precedence, false);
        out.append(' ').append(node.getOperator().getSymbol()).append(' ');
        printOperand(node.getRhs(), precedence, true);
    }

    @Override
    public void visitBooleanLiteral(BooleanLiteral node) {
        out.append(node.getValue() ? "true" : "false");
    }

    @Override
    public void visitBuildDefinition(BuildDefinition node) {
        printBlock(node.getStatements());
    }

    @Override
    public void visitConditionalExpression(ConditionalExpression node) {
        printWrapped(node.getCondition(), node.getCondition() instanceof ConditionalExpression);
        out.append(" ? ");
        node.getIfTrue().accept(this);
        out.append(" : ");
        node.getIfFalse().accept(this);
    }

    @Override
    public void visitDictionaryLiteral(DictionaryLiteral node) {
        out.append('{');
        printList(node.getEntries());
        out.append('}');
    }

    @Override
    public void visitFunctionExpression(FunctionExpression node) {
        out.append(node.getFunctionName()).append('(');
        node.getArgs().accept(this);
        out.append(')');
    }

    @Override
    public void visitIdExpression(IdExpression node) {
        out.append(node.getId());
    }

    @Override
    public void visitIntegerLiteral(IntegerLiteral node) {
        out.append(node.getText());
    }

    @Override
    public void visitIterationStatement(IterationStatement node) {
        out.append("foreach ");
        printList(node.getIds());
        out.append(" : ");
        node.getExpression().accept(this);
        printNested(node.getStatements());
        newLine();
        out.append("endforeach");
    }

    @Override
    public void visitKeyValueItem(KeyValueItem node) {
        node.getKey().accept(this);
        out.append(": ");
        node.getValue().accept(this);
    }

    @Override
    public void visitKeywordItem(KeywordItem node) {
        node.getKey().accept(this);
        out.append(": ");
        node.getValue().accept(this);
    }

    @Override
    public void visitMethodExpression(MethodExpression node) {
        printWrapped(node.getObject(), needsParentheses(node.getObject()));
        out.append('.').append(node.getId().getId()).append('(');
        node.getArgs().accept(this);
        out.append(')');
    }

    @Override
    public void visitSelectionStatement(SelectionStatement node) {
        List<Node> conditions = node.getConditions();
        List<List<Node>> blocks = node.getBlocks();
        for (int i = 0; i < conditions.size(); i++) {
            out.append(i == 0 ? "if " : "elif ");
            conditions.get(i).accept(this);
            printNested(blocks.get(i));
            newLine();
        }
        if (node.hasElseBlock()) {
            out.append("else");
            printNested(blocks.get(blocks.size() - 1));
            newLine();
        }
        out.append("endif");
    }

    @Override
    public void visitStringLiteral(StringLiteral node) {
        if (node.isFormat()) {
            out.append('f');
        }
        out.append(quote(node.getValue()));
    }

    @Override
    public void visitSubscriptExpression(SubscriptExpression node) {
        printWrapped(node.getOuter(), needsParentheses(node.getOuter()));
        out.append('[');
        node.getInner().accept(this);
        out.append(']');
    }

    @Override
    public void visitUnaryExpression(UnaryExpression node) {
        out.append(node.getOperator().getSymbol());
        printWrapped(node.getExpression(), needsParentheses(node.getExpression()));
    }

    @Override
    public void visitErrorNode(ErrorNode node) {
        // nothing sensible to print
    }

    @Override
    public void visitBreakNode(BreakNode node) {
        out.append("break");
    }

    @Override
    public void visitContinueNode(ContinueNode node) {
        out.append("continue");
    }

    private void printList(List<? extends Node> nodes) {
        for (int i = 0; i < nodes.size(); i++) {
            if (i > 0) {
                out.append(", ");
            }
            nodes.get(i).accept(this);
        }
    }

    private void printBlock(List<Node> statements) {
        for (int i = 0; i < statements.size(); i++) {
            if (i > 0) {
                newLine();
            }
            statements.get(i).accept(this);
        }
    }

    private void printNested(List<Node> statements) {
        depth++;
        for (Node statement : statements) {
            newLine();
            statement.accept(this);
        }
        depth--;
    }

    private void newLine() {
        out.append('\n');
        out.append(INDENT.repeat(depth));
    }

    private void printOperand(Node operand, int parentPrecedence, boolean rightSide) {
        boolean wrap = false;
        if (operand instanceof BinaryExpression binary) {
            int precedence = binary.getOperator().getPrecedence();
            // left-associative: an equal-precedence operand on the right keeps its grouping only in parentheses
            wrap = precedence < parentPrecedence || (rightSide && precedence == parentPrecedence);
        } else if (operand instanceof ConditionalExpression) {
            wrap = true;
        }
        printWrapped(operand, wrap);
    }

    private void printWrapped(Node node, boolean wrap) {
        if (wrap) {
            out.append('(');
        }
        node.accept(this);
        if (wrap) {
            out.append(')');
        }
    }

    private static boolean needsParentheses(Node node) {
        return node instanceof BinaryExpression
                || node instanceof ConditionalExpression
                || node instanceof UnaryExpression;
    }
}
