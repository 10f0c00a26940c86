package org.dxworks.mesonactions.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * {@code if / elif / else / endif}. Block {@code i} belongs to condition {@code i}; one extra
 * trailing block is the {@code else} branch.
 */
public class SelectionStatement extends Node {
    private final List<Node> conditions;
    private final List<List<Node>> blocks;

    public SelectionStatement(Location location, List<Node> conditions, List<List<Node>> blocks) {
        super(location);
        if (blocks.size() != conditions.size() && blocks.size() != conditions.size() + 1) {
            throw new IllegalArgumentException("Expected " + conditions.size() + " or " + (conditions.size() + 1)
                    + " blocks, got " + blocks.size());
        }
        this.conditions = adoptAll(conditions);
        List<List<Node>> adoptedBlocks = new ArrayList<>(blocks.size());
        for (List<Node> block : blocks) {
            adoptedBlocks.add(adoptAll(block));
        }
        this.blocks = Collections.unmodifiableList(adoptedBlocks);
    }

    public List<Node> getConditions() {
        return conditions;
    }

    public List<List<Node>> getBlocks() {
        return blocks;
    }

    public boolean hasElseBlock() {
        return blocks.size() > conditions.size();
    }

    @Override
    public void accept(CodeVisitor visitor) {
        visitor.visitSelectionStatement(this);
    }

    @Override
    public void visitChildren(CodeVisitor visitor) {
        for (int i = 0; i < blocks.size(); i++) {
            if (i < conditions.size()) {
                conditions.get(i).accept(visitor);
            }
            visitAll(blocks.get(i), visitor);
        }
    }
}
