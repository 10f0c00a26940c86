package org.dxworks.mesonactions.action.recognizer;

import org.dxworks.mesonactions.RecognizerKind;
import org.dxworks.mesonactions.action.ActionProposal;
import org.dxworks.mesonactions.index.Function;
import org.dxworks.mesonactions.index.ProjectIndex;
import org.dxworks.mesonactions.model.FunctionExpression;
import org.dxworks.mesonactions.model.IntegerLiteral;

import java.util.List;

/**
 * Tests one structural pattern on an in-range node and proposes edits for it. A node that does not
 * fit the pattern yields an empty list.
 */
public interface CodeActionRecognizer {
    RecognizerKind getKind();

    default List<ActionProposal> recognize(IntegerLiteral literal) {
        return List.of();
    }

    default List<ActionProposal> recognize(FunctionExpression call, Function function, ProjectIndex index) {
        return List.of();
    }
}
