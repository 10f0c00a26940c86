package org.dxworks.mesonactions.action;

import org.dxworks.mesonactions.model.Location;
import org.eclipse.lsp4j.CodeAction;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;
import org.eclipse.lsp4j.TextEdit;
import org.eclipse.lsp4j.WorkspaceEdit;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns recognizer proposals into LSP code actions for one document.
 */
public class CodeActionBuilder {
    private final String uri;

    public CodeActionBuilder(String uri) {
        this.uri = uri;
    }

    public CodeAction build(ActionProposal proposal) {
        List<TextEdit> edits = new ArrayList<>();
        for (ActionProposal.Replacement replacement : proposal.getReplacements()) {
            edits.add(new TextEdit(toRange(replacement.getLocation()), replacement.getNewText()));
        }

        Map<String, List<TextEdit>> changes = new HashMap<>();
        changes.put(uri, edits);

        CodeAction action = new CodeAction(proposal.getTitle());
        action.setKind(proposal.getKind());
        action.setEdit(new WorkspaceEdit(changes));
        return action;
    }

    public static Range toRange(Location location) {
        return new Range(
            new Position(location.getStartLine(), location.getStartColumn()),
            new Position(location.getEndLine(), location.getEndColumn())
        );
    }
}
