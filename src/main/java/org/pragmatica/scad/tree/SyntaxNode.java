package org.pragmatica.scad.tree;

import java.util.ArrayList;
import java.util.List;

/**
 * Read-only view of a concrete syntax tree node.
 *
 * <p>This is the only shape the AST builders rely on. Trees may be partial: any child or field
 * accessor can return {@code null} and error or missing nodes are ordinary input.
 */
public interface SyntaxNode {
    String ERROR_TYPE = "ERROR";

    String type();

    String text();

    Point startPosition();

    Point endPosition();

    int startIndex();

    int endIndex();

    int childCount();

    /**
     * Child at the given index, or {@code null} when out of range.
     */
    SyntaxNode child(int index);

    /**
     * Name of the field the child at the given index occupies, or {@code null}.
     */
    String fieldNameForChild(int index);

    /**
     * First child stored under the given field, or {@code null}.
     */
    default SyntaxNode childForFieldName(String fieldName) {
        for (int i = 0; i < childCount(); i++) {
            if (fieldName.equals(fieldNameForChild(i))) {
                return child(i);
            }
        }
        return null;
    }

    /**
     * Named nodes are grammar symbols; unnamed ones are punctuation and keywords.
     */
    boolean isNamed();

    /**
     * Zero-width node inserted by error recovery in place of an expected token.
     */
    boolean isMissing();

    default boolean isError() {
        return ERROR_TYPE.equals(type());
    }

    /**
     * Whether this node or any descendant is an error or missing node.
     */
    default boolean hasError() {
        if (isError() || isMissing()) {
            return true;
        }
        for (int i = 0; i < childCount(); i++) {
            var child = child(i);
            if (child != null && child.hasError()) {
                return true;
            }
        }
        return false;
    }

    default List<? extends SyntaxNode> children() {
        var result = new ArrayList<SyntaxNode>(childCount());
        for (int i = 0; i < childCount(); i++) {
            result.add(child(i));
        }
        return result;
    }

    default List<SyntaxNode> namedChildren() {
        var result = new ArrayList<SyntaxNode>();
        for (int i = 0; i < childCount(); i++) {
            var child = child(i);
            if (child != null && child.isNamed()) {
                result.add(child);
            }
        }
        return result;
    }

    default int namedChildCount() {
        return namedChildren().size();
    }

    default SyntaxNode namedChild(int index) {
        var named = namedChildren();
        return index >= 0 && index < named.size() ? named.get(index) : null;
    }
}
