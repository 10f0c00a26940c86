package org.dxworks.mesonactions.model;

import java.util.List;

/**
 * Root of a parsed {@code meson.build} file.
 */
public class BuildDefinition extends Node {
    private final List<Node> statements;

    public BuildDefinition(Location location, List<Node> statements) {
        super(location);
        this.statements = adoptAll(statements);
    }

    public List<Node> getStatements() {
        return statements;
    }

    @Override
    public void accept(CodeVisitor visitor) {
        visitor.visitBuildDefinition(this);
    }

    @Override
    public void visitChildren(CodeVisitor visitor) {
        visitAll(statements, visitor);
    }
}
