package org.dxworks.mesonactions.action.recognizer;

import org.dxworks.mesonactions.action.ActionProposal;
import org.dxworks.mesonactions.index.BuiltinFunctions;
import org.dxworks.mesonactions.index.Function;
import org.dxworks.mesonactions.index.ProjectIndex;
import org.dxworks.mesonactions.model.FunctionExpression;
import org.dxworks.mesonactions.model.KeywordItem;
import org.dxworks.mesonactions.model.Location;
import org.dxworks.mesonactions.model.Node;
import org.eclipse.lsp4j.CodeActionKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts a call of one build target function into another. Keyword arguments the source
 * accepts but the target does not are removed; keywords unknown to both are left alone.
 * <p>
 * Removed keywords are deleted in place, so the rest of the argument list keeps its layout and
 * comments.
 */
public abstract class TargetConversionRecognizer implements CodeActionRecognizer {
    private final String sourceId;
    private final String targetId;

    protected TargetConversionRecognizer(String sourceId, String targetId) {
        this.sourceId = sourceId;
        this.targetId = targetId;
    }

    @Override
    public List<ActionProposal> recognize(FunctionExpression call, Function function, ProjectIndex index) {
        if (!sourceId.equals(function.id())) {
            return List.of();
        }
        Function target = BuiltinFunctions.lookup(targetId)
                .orElseThrow(() -> new IllegalStateException("Unknown builtin " + targetId));

        List<Node> args = call.getArgs().getArgs();
        List<ActionProposal.Replacement> replacements = new ArrayList<>();
        replacements.add(new ActionProposal.Replacement(call.getId().getLocation(), targetId));
        List<String> dropped = new ArrayList<>();

        int i = 0;
        while (i < args.size()) {
            if (!isDropped(args.get(i), function, target)) {
                i++;
                continue;
            }
            int first = i;
            while (i < args.size() && isDropped(args.get(i), function, target)) {
                dropped.add(((KeywordItem) args.get(i)).getName());
                i++;
            }
            replacements.add(new ActionProposal.Replacement(deletionFor(args, first, i - 1), ""));
        }

        String title = "Convert to " + targetId + "()";
        if (!dropped.isEmpty()) {
            title += " (drops " + String.join(", ", dropped) + ")";
        }
        return List.of(new ActionProposal(title, CodeActionKind.RefactorRewrite, replacements));
    }

    private static boolean isDropped(Node arg, Function source, Function target) {
        return arg instanceof KeywordItem keyword
                && source.acceptsKwarg(keyword.getName())
                && !target.acceptsKwarg(keyword.getName());
    }

    /**
     * Span to delete for the run of arguments {@code first..last}, together with a separating comma.
     * A comment runs to the end of its line, so text between two arguments on the same line holds
     * nothing but the comma and blanks.
     */
    static Location deletionFor(List<Node> args, int first, int last) {
        Location start = args.get(first).getLocation();
        Location end = args.get(last).getLocation();
        Node previous = first > 0 ? args.get(first - 1) : null;
        Node next = last + 1 < args.size() ? args.get(last + 1) : null;

        if (next != null && (previous == null || next.getLocation().getStartLine() == end.getEndLine())) {
            // up to the next argument
            return new Location(start.getStartLine(), start.getStartColumn(),
                    next.getLocation().getStartLine(), next.getLocation().getStartColumn());
        }
        if (previous != null && previous.getLocation().getEndLine() == start.getStartLine()) {
            // from the end of the previous argument
            return new Location(previous.getLocation().getEndLine(), previous.getLocation().getEndColumn(),
                    end.getEndLine(), end.getEndColumn());
        }
        if (next != null) {
            // the run has lines of its own; its trailing comma and comment go with it
            return new Location(start.getStartLine(), 0, end.getEndLine() + 1, 0);
        }
        // last argument on its own line: the preceding comma stays as a trailing comma
        return Location.between(start, end);
    }
}
