package org.dxworks.mesonactions.action;

import org.dxworks.mesonactions.action.recognizer.CodeActionRecognizer;
import org.dxworks.mesonactions.index.Function;
import org.dxworks.mesonactions.index.ProjectIndex;
import org.dxworks.mesonactions.model.AbstractCodeVisitor;
import org.dxworks.mesonactions.model.FunctionExpression;
import org.dxworks.mesonactions.model.IntegerLiteral;
import org.dxworks.mesonactions.model.Node;
import org.eclipse.lsp4j.CodeAction;
import org.eclipse.lsp4j.Range;
import org.eclipse.lsp4j.jsonrpc.CancelChecker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Walks a build definition once, pre-order, and collects the code actions of every in-range
 * integer literal and function call. Children are always visited, so nested matches are found too.
 */
public class CodeActionVisitor extends AbstractCodeVisitor {
    private static final Logger LOG = LoggerFactory.getLogger(CodeActionVisitor.class);

    private final List<CodeAction> actions = new ArrayList<>();
    private final RangeMatcher matcher;
    private final CodeActionBuilder builder;
    private final ProjectIndex tree;
    private final List<CodeActionRecognizer> recognizers;
    private final CancelChecker cancelChecker;

    public CodeActionVisitor(Range range, String uri, ProjectIndex tree, List<CodeActionRecognizer> recognizers,
                             CancelChecker cancelChecker) {
        this.matcher = new RangeMatcher(range);
        this.builder = new CodeActionBuilder(uri);
        this.tree = tree;
        this.recognizers = recognizers;
        this.cancelChecker = cancelChecker;
    }

    public List<CodeAction> getActions() {
        return Collections.unmodifiableList(actions);
    }

    @Override
    protected void visitChildren(Node node) {
        cancelChecker.checkCanceled();
        super.visitChildren(node);
    }

    @Override
    public void visitIntegerLiteral(IntegerLiteral node) {
        if (matcher.inRange(node)) {
            for (CodeActionRecognizer recognizer : recognizers) {
                addAll(recognizer.recognize(node));
            }
        }
        visitChildren(node);
    }

    @Override
    public void visitFunctionExpression(FunctionExpression node) {
        if (matcher.inRange(node)) {
            Optional<Function> function = tree.resolveFunction(node);
            if (function.isPresent()) {
                for (CodeActionRecognizer recognizer : recognizers) {
                    addAll(recognizer.recognize(node, function.get(), tree));
                }
            } else {
                LOG.debug("Unresolved call {}() at {}", node.getFunctionName(), node.getLocation());
            }
        }
        visitChildren(node);
    }

    private void addAll(List<ActionProposal> proposals) {
        for (ActionProposal proposal : proposals) {
            actions.add(builder.build(proposal));
        }
    }
}
