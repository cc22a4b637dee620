package org.pragmatica.scad.tree;

/**
 * A zero-based row/column position as reported by the syntax tree producer.
 */
public record Point(int row, int column) {

    public static Point of(int row, int column) {
        return new Point(row, column);
    }

    @Override
    public String toString() {
        return row + ":" + column;
    }
}
