package org.pragmatica.scad.tree;

/**
 * A position in source text. Line and column are zero-based, offset is the character index.
 */
public record SourceLocation(int line, int column, int offset) {

    public static final SourceLocation START = new SourceLocation(0, 0, 0);

    public static SourceLocation at(int line, int column, int offset) {
        return new SourceLocation(line, column, offset);
    }

    public static SourceLocation of(Point point, int offset) {
        return new SourceLocation(point.row(), point.column(), offset);
    }

    public boolean isAfter(SourceLocation other) {
        return offset > other.offset;
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
