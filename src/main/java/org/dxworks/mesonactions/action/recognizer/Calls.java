package org.dxworks.mesonactions.action.recognizer;

import org.dxworks.mesonactions.index.BuiltinFunctions;
import org.dxworks.mesonactions.index.Function;
import org.dxworks.mesonactions.model.AssignmentOperator;
import org.dxworks.mesonactions.model.AssignmentStatement;
import org.dxworks.mesonactions.model.FunctionExpression;
import org.dxworks.mesonactions.model.IdExpression;
import org.dxworks.mesonactions.model.Node;

import java.util.Optional;

/**
 * Structural queries on calls shared by the recognizers.
 */
public final class Calls {

    private Calls() {
    }

    public static boolean createsLibrary(Function func) {
        String name = func.id();
        return name.equals(BuiltinFunctions.STATIC_LIBRARY)
                || name.equals(BuiltinFunctions.SHARED_LIBRARY)
                || name.equals(BuiltinFunctions.LIBRARY);
    }

    /**
     * Name of the variable a call is assigned to, looking at the immediate parent only.
     * {@code x = static_library(...)} gives {@code x}; {@code x += ...}, nested calls and
     * expression statements give empty.
     */
    public static Optional<String> extractVariablename(FunctionExpression fExpr) {
        Node parent = fExpr.getParent();
        if (!(parent instanceof AssignmentStatement ass)) {
            return Optional.empty();
        }
        if (ass.getRhs() != fExpr) {
            if (ass.getLhs() == fExpr) {
                return Optional.empty();
            }
            throw new IllegalStateException("Call at " + fExpr.getLocation()
                    + " points to an assignment that does not own it");
        }
        if (ass.getOperator() != AssignmentOperator.ASSIGN) {
            return Optional.empty();
        }
        if (!(ass.getLhs() instanceof IdExpression idExpr)) {
            return Optional.empty();
        }
        return Optional.of(idExpr.getId());
    }

    public static Node rootOf(Node node) {
        Node current = node;
        while (current.getParent() != null) {
            current = current.getParent();
        }
        return current;
    }
}
