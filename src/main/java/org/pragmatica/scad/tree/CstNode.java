package org.pragmatica.scad.tree;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Concrete syntax tree node produced by the reference OpenSCAD parser.
 *
 * <p>Nodes are immutable. Every node remembers the field it occupies in its parent
 * (empty string when it is not stored under a field).
 */
public sealed interface CstNode extends SyntaxNode {
    String NO_FIELD = "";

    SourceSpan span();

    /**
     * The field this node occupies in its parent.
     */
    String field();

    /**
     * Copy of this node stored under another field.
     */
    CstNode withField(String field);

    @Override
    default Point startPosition() {
        return Point.of(span().start().line(), span().start().column());
    }

    @Override
    default Point endPosition() {
        return Point.of(span().end().line(), span().end().column());
    }

    @Override
    default int startIndex() {
        return span().start().offset();
    }

    @Override
    default int endIndex() {
        return span().end().offset();
    }

    /**
     * Terminal node: a token, an identifier, a literal or a zero-width missing token.
     */
    record Leaf(String type, String field, String text, SourceSpan span, boolean named, boolean missing)
    implements CstNode {

        @Override
        public int childCount() {
            return 0;
        }

        @Override
        public CstNode child(int index) {
            return null;
        }

        @Override
        public String fieldNameForChild(int index) {
            return null;
        }

        @Override
        public boolean isNamed() {
            return named;
        }

        @Override
        public boolean isMissing() {
            return missing;
        }

        @Override
        public Leaf withField(String field) {
            return new Leaf(type, field, text, span, named, missing);
        }
    }

    /**
     * Interior node for a grammar symbol.
     */
    record Branch(String type, String field, String text, SourceSpan span, List<CstNode> children)
    implements CstNode {

        public Branch {
            children = List.copyOf(children);
        }

        @Override
        public int childCount() {
            return children.size();
        }

        @Override
        public CstNode child(int index) {
            return index >= 0 && index < children.size() ? children.get(index) : null;
        }

        @Override
        public String fieldNameForChild(int index) {
            var child = child(index);
            return child == null || child.field().isEmpty() ? null : child.field();
        }

        @Override
        public boolean isNamed() {
            return true;
        }

        @Override
        public boolean isMissing() {
            return false;
        }

        @Override
        public Branch withField(String field) {
            return new Branch(type, field, text, span, children);
        }
    }

    /**
     * Region the parser could not make sense of. Holds whatever tokens were skipped.
     */
    record Error(String field, String text, SourceSpan span, List<CstNode> children) implements CstNode {

        public Error {
            children = List.copyOf(children);
        }

        @Override
        public String type() {
            return ERROR_TYPE;
        }

        @Override
        public int childCount() {
            return children.size();
        }

        @Override
        public CstNode child(int index) {
            return index >= 0 && index < children.size() ? children.get(index) : null;
        }

        @Override
        public String fieldNameForChild(int index) {
            var child = child(index);
            return child == null || child.field().isEmpty() ? null : child.field();
        }

        @Override
        public boolean isNamed() {
            return true;
        }

        @Override
        public boolean isMissing() {
            return false;
        }

        @Override
        public Error withField(String field) {
            return new Error(field, text, span, children);
        }
    }

    // Factories for trees assembled by hand. Text of a branch is its children's text joined by spaces.

    static Leaf leaf(String type, String text) {
        var end = SourceLocation.at(0, text.length(), text.length());
        return new Leaf(type, NO_FIELD, text, SourceSpan.of(SourceLocation.START, end), isNamedType(type), false);
    }

    static Leaf token(String text) {
        var end = SourceLocation.at(0, text.length(), text.length());
        return new Leaf(text, NO_FIELD, text, SourceSpan.of(SourceLocation.START, end), false, false);
    }

    static Leaf missing(String type) {
        return new Leaf(type, NO_FIELD, "", SourceSpan.at(SourceLocation.START), isNamedType(type), true);
    }

    static Branch branch(String type, List<CstNode> children) {
        return new Branch(type, NO_FIELD, joinText(children), spanOf(children), children);
    }

    static Error error(List<CstNode> children) {
        return new Error(NO_FIELD, joinText(children), spanOf(children), children);
    }

    private static boolean isNamedType(String type) {
        return !type.isEmpty() && (Character.isLetter(type.charAt(0)) || type.charAt(0) == '_');
    }

    private static String joinText(List<CstNode> children) {
        return children.stream()
                       .map(CstNode::text)
                       .filter(text -> !text.isEmpty())
                       .collect(Collectors.joining(" "));
    }

    private static SourceSpan spanOf(List<CstNode> children) {
        return children.stream()
                       .map(CstNode::span)
                       .reduce(SourceSpan::merge)
                       .orElse(SourceSpan.at(SourceLocation.START));
    }
}
