package org.dxworks.mesonactions;

import org.dxworks.mesonactions.action.CodeActionVisitor;
import org.dxworks.mesonactions.action.recognizer.CodeActionRecognizer;
import org.dxworks.mesonactions.index.BuiltinProjectIndex;
import org.dxworks.mesonactions.index.ProjectIndex;
import org.dxworks.mesonactions.model.BuildDefinition;
import org.eclipse.lsp4j.CodeAction;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;
import org.eclipse.lsp4j.jsonrpc.CancelChecker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Entry point: collects the code actions offered for a range of a parsed {@code meson.build}.
 * Instances are immutable and can serve concurrent requests against the same tree.
 */
public class CodeActions {
    private static final Logger LOG = LoggerFactory.getLogger(CodeActions.class);

    private static final CancelChecker NEVER_CANCELLED = () -> {
    };

    private final CodeActionsConfig config;
    private final List<CodeActionRecognizer> recognizers;

    public CodeActions(CodeActionsConfig config) {
        this.config = config;
        this.recognizers = RecognizerRegistry.buildRecognizers(config);
    }

    public static CodeActions withDefaults() {
        return new CodeActions(CodeActionsConfig.defaults());
    }

    /** Index over the builtin functions, using the configured aliases. */
    public ProjectIndex builtinIndex() {
        return new BuiltinProjectIndex(config.getFunctionAliases());
    }

    public List<CodeAction> collectCodeActions(Range range, String uri, ProjectIndex tree, BuildDefinition root) {
        return collectCodeActions(range, uri, tree, root, NEVER_CANCELLED);
    }

    public List<CodeAction> collectCodeActions(Range range, String uri, ProjectIndex tree, BuildDefinition root,
                                               CancelChecker cancelChecker) {
        try {
            validate(range, uri, tree, root);
        } catch (InvalidCodeActionRequestException e) {
            LOG.warn(e.getMessage());
            throw e;
        }

        CodeActionVisitor visitor = new CodeActionVisitor(range, uri, tree, recognizers,
                cancelChecker != null ? cancelChecker : NEVER_CANCELLED);
        root.accept(visitor);

        List<CodeAction> actions = visitor.getActions();
        LOG.debug("Collected {} code actions for {} at {}", actions.size(), uri, range);
        return actions;
    }

    private static void validate(Range range, String uri, ProjectIndex tree, BuildDefinition root) {
        if (range == null || range.getStart() == null || range.getEnd() == null) {
            throw new InvalidCodeActionRequestException("range is missing");
        }
        Position start = range.getStart();
        Position end = range.getEnd();
        if (start.getLine() < 0 || start.getCharacter() < 0 || end.getLine() < 0 || end.getCharacter() < 0) {
            throw new InvalidCodeActionRequestException("range has negative coordinates: " + range);
        }
        if (start.getLine() > end.getLine()
                || (start.getLine() == end.getLine() && start.getCharacter() > end.getCharacter())) {
            throw new InvalidCodeActionRequestException("range ends before it starts: " + range);
        }
        if (uri == null || uri.isBlank()) {
            throw new InvalidCodeActionRequestException("document uri is missing");
        }
        if (tree == null) {
            throw new InvalidCodeActionRequestException("project index is missing");
        }
        if (root == null) {
            throw new InvalidCodeActionRequestException("build definition is missing");
        }
        if (root.getParent() != null) {
            throw new InvalidCodeActionRequestException("build definition is not a root node");
        }
    }
}
