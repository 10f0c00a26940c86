package org.dxworks.mesonactions.support;

import org.dxworks.mesonactions.model.AbstractCodeVisitor;
import org.dxworks.mesonactions.model.Node;

import java.util.ArrayList;
import java.util.List;

public final class Nodes {

    private Nodes() {
    }

    /** All nodes of the given type, in pre-order. */
    public static <T extends Node> List<T> findAll(Node root, Class<T> type) {
        List<T> found = new ArrayList<>();
        root.accept(new AbstractCodeVisitor() {
            @Override
            protected void visitChildren(Node node) {
                if (type.isInstance(node)) {
                    found.add(type.cast(node));
                }
                super.visitChildren(node);
            }
        });
        return found;
    }

    public static <T extends Node> T first(Node root, Class<T> type) {
        List<T> found = findAll(root, type);
        if (found.isEmpty()) {
            throw new AssertionError("No " + type.getSimpleName() + " in tree");
        }
        return found.get(0);
    }
}
