package org.dxworks.mesonactions;

/**
 * Supported code actions. Declaration order is the order in which actions for the same node are
 * reported.
 */
public enum RecognizerKind {
    INTEGER_BASE("integer-base"),
    COPY_FILE("copy-file"),
    DECLARE_DEPENDENCY("declare-dependency"),
    LIBRARY_TO_GENERIC("library-to-generic"),
    SHARED_LIBRARY_TO_MODULE("shared-library-to-module"),
    MODULE_TO_SHARED_LIBRARY("module-to-shared-library");

    private final String name;

    RecognizerKind(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
