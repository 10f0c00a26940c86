package org.dxworks.mesonactions.action;

import org.dxworks.mesonactions.model.Location;
import org.dxworks.mesonactions.model.Node;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;

/**
 * Decides whether a node is relevant for the requested range.
 * <p>
 * Both the range and node locations are half-open. A non-empty range matches every node it
 * overlaps; an empty range (a cursor) matches every node it touches, including at the node's edges.
 * Recorded nodes are remembered by identity and never match a second time.
 */
public class RangeMatcher {
    private final Range range;
    private final Set<Node> recorded = Collections.newSetFromMap(new IdentityHashMap<>());

    public RangeMatcher(Range range) {
        this.range = range;
    }

    public boolean inRange(Node node) {
        return inRange(node, true);
    }

    public boolean inRange(Node node, boolean record) {
        if (!overlaps(node.getLocation())) {
            return false;
        }
        if (record) {
            return recorded.add(node);
        }
        return true;
    }

    public boolean overlaps(Location location) {
        Position start = range.getStart();
        Position end = range.getEnd();
        int startLine = location.getStartLine();
        int startColumn = location.getStartColumn();
        int endLine = location.getEndLine();
        int endColumn = location.getEndColumn();

        if (start.getLine() == end.getLine() && start.getCharacter() == end.getCharacter()) {
            return Location.compare(startLine, startColumn, start.getLine(), start.getCharacter()) <= 0
                && Location.compare(start.getLine(), start.getCharacter(), endLine, endColumn) <= 0;
        }
        return Location.compare(startLine, startColumn, end.getLine(), end.getCharacter()) < 0
            && Location.compare(start.getLine(), start.getCharacter(), endLine, endColumn) < 0;
    }
}
