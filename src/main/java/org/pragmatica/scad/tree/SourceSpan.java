package org.pragmatica.scad.tree;

/**
 * A range in source text from start (inclusive) to end (exclusive).
 */
public record SourceSpan(SourceLocation start, SourceLocation end) {

    public SourceSpan {
        if (start.isAfter(end)) {
            throw new IllegalArgumentException("Span start " + start + " is after end " + end);
        }
    }

    public static SourceSpan of(SourceLocation start, SourceLocation end) {
        return new SourceSpan(start, end);
    }

    public static SourceSpan at(SourceLocation location) {
        return new SourceSpan(location, location);
    }

    /**
     * Span covered by a syntax node, or {@code null} for a {@code null} node.
     */
    public static SourceSpan of(SyntaxNode node) {
        if (node == null) {
            return null;
        }
        return new SourceSpan(SourceLocation.of(node.startPosition(), node.startIndex()),
                              SourceLocation.of(node.endPosition(), node.endIndex()));
    }

    public int length() {
        return end.offset() - start.offset();
    }

    public String extract(String source) {
        return source.substring(start.offset(), end.offset());
    }

    public boolean contains(int offset) {
        return offset >= start.offset() && offset < end.offset();
    }

    public SourceSpan merge(SourceSpan other) {
        var newStart = start.offset() <= other.start.offset() ? start : other.start;
        var newEnd = end.offset() >= other.end.offset() ? end : other.end;
        return new SourceSpan(newStart, newEnd);
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }
}
