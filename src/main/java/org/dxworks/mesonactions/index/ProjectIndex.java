package org.dxworks.mesonactions.index;

import org.dxworks.mesonactions.model.FunctionExpression;

import java.util.Optional;

/**
 * Read-only view of the project used while collecting code actions.
 */
public interface ProjectIndex {
    /**
     * Resolves the function a call refers to, or empty when the call cannot be resolved (unknown or
     * shadowed identifier).
     */
    Optional<Function> resolveFunction(FunctionExpression call);
}
