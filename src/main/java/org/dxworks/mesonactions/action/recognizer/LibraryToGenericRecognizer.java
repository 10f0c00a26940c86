package org.dxworks.mesonactions.action.recognizer;

import org.dxworks.mesonactions.RecognizerKind;
import org.dxworks.mesonactions.action.ActionProposal;
import org.dxworks.mesonactions.index.BuiltinFunctions;
import org.dxworks.mesonactions.index.Function;
import org.dxworks.mesonactions.index.ProjectIndex;
import org.dxworks.mesonactions.model.FunctionExpression;
import org.eclipse.lsp4j.CodeActionKind;

import java.util.List;

/**
 * Rewrites {@code static_library} and {@code shared_library} to {@code library}, so the library
 * kind follows the {@code default_library} option.
 */
public class LibraryToGenericRecognizer implements CodeActionRecognizer {
    static final String TITLE = "Convert to library()";

    @Override
    public RecognizerKind getKind() {
        return RecognizerKind.LIBRARY_TO_GENERIC;
    }

    @Override
    public List<ActionProposal> recognize(FunctionExpression call, Function function, ProjectIndex index) {
        String id = function.id();
        if (!id.equals(BuiltinFunctions.STATIC_LIBRARY) && !id.equals(BuiltinFunctions.SHARED_LIBRARY)) {
            return List.of();
        }
        return List.of(ActionProposal.replace(TITLE, CodeActionKind.RefactorRewrite, call.getId().getLocation(),
                BuiltinFunctions.LIBRARY));
    }
}
