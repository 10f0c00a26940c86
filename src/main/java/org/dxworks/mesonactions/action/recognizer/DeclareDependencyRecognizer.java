package org.dxworks.mesonactions.action.recognizer;

import org.dxworks.mesonactions.RecognizerKind;
import org.dxworks.mesonactions.action.ActionProposal;
import org.dxworks.mesonactions.index.BuiltinFunctions;
import org.dxworks.mesonactions.index.Function;
import org.dxworks.mesonactions.index.ProjectIndex;
import org.dxworks.mesonactions.model.AbstractCodeVisitor;
import org.dxworks.mesonactions.model.ArrayLiteral;
import org.dxworks.mesonactions.model.AssignmentStatement;
import org.dxworks.mesonactions.model.FunctionExpression;
import org.dxworks.mesonactions.model.IdExpression;
import org.dxworks.mesonactions.model.Location;
import org.dxworks.mesonactions.model.Node;
import org.eclipse.lsp4j.CodeActionKind;

import java.util.List;
import java.util.Optional;

/**
 * For {@code x = static_library(...)}, offers to add {@code x_dep = declare_dependency(link_with: x)}
 * right below, unless the file already declares such a dependency.
 */
public class DeclareDependencyRecognizer implements CodeActionRecognizer {
    static final String TITLE = "Add declare_dependency";

    private final String suffix;

    public DeclareDependencyRecognizer(String suffix) {
        this.suffix = suffix;
    }

    @Override
    public RecognizerKind getKind() {
        return RecognizerKind.DECLARE_DEPENDENCY;
    }

    @Override
    public List<ActionProposal> recognize(FunctionExpression call, Function function, ProjectIndex index) {
        if (!Calls.createsLibrary(function)) {
            return List.of();
        }
        Optional<String> variable = Calls.extractVariablename(call);
        if (variable.isEmpty()) {
            return List.of();
        }
        String library = variable.get();
        String dependency = library + suffix;

        Node root = Calls.rootOf(call);
        DependencyScan scan = new DependencyScan(library, dependency, index);
        root.accept(scan);
        if (scan.found) {
            return List.of();
        }

        Location statement = call.getParent().getLocation();
        String line = " ".repeat(statement.getStartColumn())
                + dependency + " = declare_dependency(link_with: " + library + ")";
        // below the statement's last line, so a trailing comment stays where it is
        if (statement.getEndLine() < root.getLocation().getEndLine()) {
            return List.of(ActionProposal.replace(TITLE, CodeActionKind.Refactor,
                    Location.at(statement.getEndLine() + 1, 0), line + "\n"));
        }
        return List.of(ActionProposal.replace(TITLE, CodeActionKind.Refactor, statement.endPoint(), "\n" + line));
    }

    /**
     * Looks for an assignment to the dependency name, or a declare_dependency that already links the
     * library.
     */
    private static class DependencyScan extends AbstractCodeVisitor {
        private final String library;
        private final String dependency;
        private final ProjectIndex index;
        private boolean found;

        DependencyScan(String library, String dependency, ProjectIndex index) {
            this.library = library;
            this.dependency = dependency;
            this.index = index;
        }

        @Override
        protected void visitChildren(Node node) {
            if (!found) {
                super.visitChildren(node);
            }
        }

        @Override
        public void visitAssignmentStatement(AssignmentStatement node) {
            if (node.getLhs() instanceof IdExpression id && id.getId().equals(dependency)) {
                found = true;
                return;
            }
            visitChildren(node);
        }

        @Override
        public void visitFunctionExpression(FunctionExpression node) {
            Optional<Function> function = index.resolveFunction(node);
            if (function.isPresent() && BuiltinFunctions.DECLARE_DEPENDENCY.equals(function.get().id())) {
                Optional<Node> linkWith = node.getArgs().getKwarg("link_with");
                if (linkWith.isPresent() && references(linkWith.get())) {
                    found = true;
                    return;
                }
            }
            visitChildren(node);
        }

        private boolean references(Node value) {
            if (value instanceof IdExpression id) {
                return id.getId().equals(library);
            }
            if (value instanceof ArrayLiteral array) {
                for (Node element : array.getElements()) {
                    if (references(element)) {
                        return true;
                    }
                }
            }
            return false;
        }
    }
}
