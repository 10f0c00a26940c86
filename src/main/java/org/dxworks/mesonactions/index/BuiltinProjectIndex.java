package org.dxworks.mesonactions.index;

import org.dxworks.mesonactions.model.FunctionExpression;

import java.util.Map;
import java.util.Optional;

/**
 * Index that knows only the builtin functions. Calls are resolved by their identifier, after
 * applying the alias table.
 */
public class BuiltinProjectIndex implements ProjectIndex {
    private final Map<String, String> aliases;

    public BuiltinProjectIndex() {
        this(Map.of());
    }

    public BuiltinProjectIndex(Map<String, String> aliases) {
        this.aliases = Map.copyOf(aliases);
    }

    @Override
    public Optional<Function> resolveFunction(FunctionExpression call) {
        String name = call.getFunctionName();
        return BuiltinFunctions.lookup(aliases.getOrDefault(name, name));
    }
}
