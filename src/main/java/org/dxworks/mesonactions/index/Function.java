package org.dxworks.mesonactions.index;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Resolved identity of a called function together with the keyword arguments it accepts.
 */
public class Function {
    private final String id;
    private final Set<String> kwargs;

    public Function(String id, Set<String> kwargs) {
        this.id = Objects.requireNonNull(id, "id");
        this.kwargs = Collections.unmodifiableSet(new LinkedHashSet<>(kwargs));
    }

    /** Canonical name, aliases already resolved. */
    public String id() {
        return id;
    }

    public boolean acceptsKwarg(String name) {
        return kwargs.contains(name);
    }

    @Override
    public String toString() {
        return id + "()";
    }
}
