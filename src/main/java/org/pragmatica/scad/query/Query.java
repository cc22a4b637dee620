package org.pragmatica.scad.query;

import org.pragmatica.scad.error.ParserException;
import org.pragmatica.scad.query.Pattern.Alternation;
import org.pragmatica.scad.query.Pattern.ChildPattern;
import org.pragmatica.scad.query.Pattern.Guarded;
import org.pragmatica.scad.query.Pattern.NodePattern;
import org.pragmatica.scad.query.Pattern.Predicate;
import org.pragmatica.scad.tree.SyntaxNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Compiled structural query over a syntax tree.
 *
 * <p>Example: {@code (module_instantiation name: (identifier) @name (#eq? @name "cube")) @call}
 * captures every {@code cube(...)} instantiation and its name.
 */
public final class Query {
    private final String source;
    private final List<Pattern> patterns;

    private Query(String source, List<Pattern> patterns) {
        this.source = source;
        this.patterns = List.copyOf(patterns);
    }

    /**
     * @throws ParserException if the query text is malformed
     */
    public static Query compile(String source) {
        return new Query(source, QueryParser.parse(source));
    }

    public String source() {
        return source;
    }

    public List<Pattern> patterns() {
        return patterns;
    }

    /**
     * All captures of all matches under {@code root}, visiting nodes in pre-order.
     */
    public List<Capture> captures(SyntaxNode root) {
        var result = new ArrayList<Capture>();
        var stack = new ArrayDeque<SyntaxNode>();
        if (root != null) {
            stack.push(root);
        }
        while (!stack.isEmpty()) {
            var node = stack.pop();
            for (var pattern : patterns) {
                var captures = new ArrayList<Capture>();
                if (match(pattern, node, captures)) {
                    result.addAll(captures);
                }
            }
            for (int i = node.childCount() - 1; i >= 0; i--) {
                var child = node.child(i);
                if (child != null) {
                    stack.push(child);
                }
            }
        }
        return result;
    }

    /**
     * Captured nodes without their names, duplicates removed.
     */
    public List<SyntaxNode> nodes(SyntaxNode root) {
        var result = new ArrayList<SyntaxNode>();
        for (var capture : captures(root)) {
            if (result.stream().noneMatch(node -> node == capture.node())) {
                result.add(capture.node());
            }
        }
        return result;
    }

    private static boolean match(Pattern pattern, SyntaxNode node, List<Capture> captures) {
        int mark = captures.size();
        boolean matched;
        if (pattern instanceof NodePattern nodePattern) {
            matched = matchNode(nodePattern, node, captures);
        } else if (pattern instanceof Alternation alternation) {
            matched = alternation.alternatives().stream().anyMatch(alt -> match(alt, node, captures));
        } else if (pattern instanceof Guarded guarded) {
            matched = match(guarded.pattern(), node, captures) && guarded.predicates()
                                                                         .stream()
                                                                         .allMatch(p -> test(p, captures));
        } else {
            matched = false;
        }
        if (!matched) {
            truncate(captures, mark);
            return false;
        }
        if (!(pattern instanceof Guarded)) {
            pattern.capture().ifPresent(name -> captures.add(mark, new Capture(name, node)));
        }
        return true;
    }

    private static boolean matchNode(NodePattern pattern, SyntaxNode node, List<Capture> captures) {
        if (Pattern.WILDCARD.equals(pattern.type())) {
            if (!node.isNamed()) {
                return false;
            }
        } else if (!pattern.type().equals(node.type())) {
            return false;
        }
        return matchChildren(pattern.children(), 0, node, 0, captures);
    }

    private static boolean matchChildren(List<ChildPattern> children, int index, SyntaxNode node, int from,
                                         List<Capture> captures) {
        if (index == children.size()) {
            return true;
        }
        var expected = children.get(index);
        for (int i = from; i < node.childCount(); i++) {
            var candidate = node.child(i);
            if (candidate == null) {
                continue;
            }
            if (expected.field().isPresent()) {
                if (!expected.field().get().equals(node.fieldNameForChild(i))) {
                    continue;
                }
            } else if (!candidate.isNamed()) {
                continue;
            }
            int mark = captures.size();
            if (match(expected.pattern(), candidate, captures)
                && matchChildren(children, index + 1, node, i + 1, captures)) {
                return true;
            }
            truncate(captures, mark);
        }
        return false;
    }

    private static boolean test(Predicate predicate, List<Capture> captures) {
        var subject = captured(predicate.capture(), captures);
        if (subject == null) {
            return false;
        }
        var argument = predicate.argumentIsCapture() ? captured(predicate.argument(), captures) : predicate.argument();
        return switch (predicate.kind()) {
            case EQ -> Objects.equals(subject, argument);
            case NOT_EQ -> !Objects.equals(subject, argument);
            case MATCH -> predicate.regex()
                                   .map(regex -> regex.matcher(subject).find())
                                   .orElse(false);
        };
    }

    private static String captured(String name, List<Capture> captures) {
        for (var capture : captures) {
            if (capture.name().equals(name)) {
                return capture.node().text();
            }
        }
        return null;
    }

    private static void truncate(List<Capture> captures, int size) {
        while (captures.size() > size) {
            captures.remove(captures.size() - 1);
        }
    }

    @Override
    public String toString() {
        return source;
    }
}
