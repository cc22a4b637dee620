package org.pragmatica.scad.tree;

import java.util.ArrayList;
import java.util.List;

/**
 * Single place where structured field access meets raw-text fallback.
 *
 * <p>Builders ask for a field and receive either the node stored under it, or a {@link Field}
 * flagged as degraded whose value was recovered from the parent's text and has no position.
 */
public final class FieldReader {
    private FieldReader() {}

    /**
     * Value of a named field: either backed by a node or recovered from text.
     */
    public record Field(String text, SyntaxNode node) {
        public boolean degraded() {
            return node == null;
        }
    }

    public static SyntaxNode field(SyntaxNode node, String name) {
        return node == null ? null : node.childForFieldName(name);
    }

    /**
     * Node under a field, or the non-comment named child at {@code position} when the field is unset.
     * Positional call arguments carry no field, so their value is always read this way.
     */
    public static SyntaxNode fieldOrPositional(SyntaxNode node, String name, int position) {
        var child = field(node, name);
        if (child != null || node == null) {
            return child;
        }
        int seen = 0;
        for (int i = 0; i < node.childCount(); i++) {
            var candidate = node.child(i);
            if (candidate == null || !candidate.isNamed() || NodeTypes.COMMENT.equals(candidate.type())) {
                continue;
            }
            if (seen == position) {
                return candidate;
            }
            seen++;
        }
        return null;
    }

    public static String text(SyntaxNode node, String name) {
        var child = field(node, name);
        return child == null || child.isMissing() ? null : child.text();
    }

    /**
     * Name of a definition such as {@code function f(x) = ...}. When the {@code name} field is absent
     * the name is taken from the text between the keyword and the opening parenthesis.
     */
    public static Field definitionName(SyntaxNode node, String keyword) {
        var child = field(node, "name");
        if (child != null && !child.isMissing() && !child.text().isBlank()) {
            return new Field(child.text(), child);
        }
        var text = node.text().strip();
        if (!text.startsWith(keyword)) {
            return null;
        }
        var rest = text.substring(keyword.length());
        int paren = rest.indexOf('(');
        var name = (paren < 0 ? rest : rest.substring(0, paren)).strip();
        return isIdentifier(name) ? new Field(name, null) : null;
    }

    /**
     * First named child that is not a comment.
     */
    public static SyntaxNode firstNamed(SyntaxNode node) {
        if (node == null) {
            return null;
        }
        for (int i = 0; i < node.childCount(); i++) {
            var child = node.child(i);
            if (child != null && child.isNamed() && !NodeTypes.COMMENT.equals(child.type())) {
                return child;
            }
        }
        return null;
    }

    /**
     * Named, non-comment children of the given type.
     */
    public static List<SyntaxNode> childrenOfType(SyntaxNode node, String type) {
        var result = new ArrayList<SyntaxNode>();
        if (node == null) {
            return result;
        }
        for (int i = 0; i < node.childCount(); i++) {
            var child = node.child(i);
            if (child != null && type.equals(child.type())) {
                result.add(child);
            }
        }
        return result;
    }

    public static SyntaxNode firstOfType(SyntaxNode node, String type) {
        var found = childrenOfType(node, type);
        return found.isEmpty() ? null : found.get(0);
    }

    private static boolean isIdentifier(String text) {
        if (text.isEmpty() || !(Character.isLetter(text.charAt(0)) || text.charAt(0) == '_' || text.charAt(0) == '$')) {
            return false;
        }
        for (int i = 1; i < text.length(); i++) {
            char c = text.charAt(i);
            if (!Character.isLetterOrDigit(c) && c != '_') {
                return false;
            }
        }
        return true;
    }
}
