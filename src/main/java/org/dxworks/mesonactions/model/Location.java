package org.dxworks.mesonactions.model;

import java.util.Objects;

/**
 * Source span of a node. Lines and columns are 0-based and the end position is exclusive.
 */
public final class Location {
    private final int startLine;
    private final int startColumn;
    private final int endLine;
    private final int endColumn;

    public Location(int startLine, int startColumn, int endLine, int endColumn) {
        if (startLine < 0 || startColumn < 0 || endLine < 0 || endColumn < 0) {
            throw new IllegalArgumentException("Negative location: " + startLine + ":" + startColumn
                    + "-" + endLine + ":" + endColumn);
        }
        if (compare(startLine, startColumn, endLine, endColumn) > 0) {
            throw new IllegalArgumentException("Location ends before it starts: " + startLine + ":" + startColumn
                    + "-" + endLine + ":" + endColumn);
        }
        this.startLine = startLine;
        this.startColumn = startColumn;
        this.endLine = endLine;
        this.endColumn = endColumn;
    }

    /** Empty location, used as an insertion point. */
    public static Location at(int line, int column) {
        return new Location(line, column, line, column);
    }

    public static Location between(Location start, Location end) {
        return new Location(start.startLine, start.startColumn, end.endLine, end.endColumn);
    }

    public Location endPoint() {
        return at(endLine, endColumn);
    }

    public int getStartLine() {
        return startLine;
    }

    public int getStartColumn() {
        return startColumn;
    }

    public int getEndLine() {
        return endLine;
    }

    public int getEndColumn() {
        return endColumn;
    }

    public boolean isEmpty() {
        return startLine == endLine && startColumn == endColumn;
    }

    /** Orders two positions the way they appear in the document. */
    public static int compare(int lineA, int columnA, int lineB, int columnB) {
        if (lineA != lineB) {
            return Integer.compare(lineA, lineB);
        }
        return Integer.compare(columnA, columnB);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Location)) return false;
        Location other = (Location) o;
        return startLine == other.startLine && startColumn == other.startColumn
                && endLine == other.endLine && endColumn == other.endColumn;
    }

    @Override
    public int hashCode() {
        return Objects.hash(startLine, startColumn, endLine, endColumn);
    }

    @Override
    public String toString() {
        return startLine + ":" + startColumn + "-" + endLine + ":" + endColumn;
    }
}
