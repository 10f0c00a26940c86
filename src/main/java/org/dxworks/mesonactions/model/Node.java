package org.dxworks.mesonactions.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Base class of all syntax nodes of a build definition.
 * <p>
 * Children are adopted in the owner's constructor, which sets their parent. A node can only be
 * owned once, so the nodes always form a tree rooted at a {@link BuildDefinition}.
 */
public abstract class Node {
    private final Location location;
    private Node parent;

    protected Node(Location location) {
        this.location = Objects.requireNonNull(location, "location");
    }

    public Location getLocation() {
        return location;
    }

    /** Owner of this node, or {@code null} for the root and for nodes not yet adopted. */
    public Node getParent() {
        return parent;
    }

    public abstract void accept(CodeVisitor visitor);

    /** Visits the direct children in source order. */
    public abstract void visitChildren(CodeVisitor visitor);

    protected final <T extends Node> T adopt(T child) {
        Node node = Objects.requireNonNull(child, "child");
        if (node.parent != null) {
            throw new IllegalStateException(node.getClass().getSimpleName() + " at " + node.location
                    + " is already owned by " + node.parent.getClass().getSimpleName());
        }
        if (node == this) {
            throw new IllegalStateException("Node cannot own itself");
        }
        node.parent = this;
        return child;
    }

    protected final <T extends Node> List<T> adoptAll(List<T> children) {
        List<T> adopted = new ArrayList<>(children.size());
        for (T child : children) {
            adopted.add(adopt(child));
        }
        return Collections.unmodifiableList(adopted);
    }

    protected static void visitAll(List<? extends Node> nodes, CodeVisitor visitor) {
        for (Node node : nodes) {
            node.accept(visitor);
        }
    }
}
