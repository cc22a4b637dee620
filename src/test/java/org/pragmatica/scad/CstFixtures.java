package org.pragmatica.scad;

import org.pragmatica.scad.parser.CstParser;
import org.pragmatica.scad.tree.SyntaxNode;

import java.util.ArrayDeque;

/**
 * Helpers for locating nodes in parsed test sources.
 */
public final class CstFixtures {
    private CstFixtures() {}

    public static SyntaxNode parse(String source) {
        return CstParser.parse(source).root();
    }

    /**
     * First node of the given type in pre-order, failing the test when absent.
     */
    public static SyntaxNode find(SyntaxNode root, String type) {
        var stack = new ArrayDeque<SyntaxNode>();
        stack.push(root);
        while (!stack.isEmpty()) {
            var node = stack.pop();
            if (type.equals(node.type())) {
                return node;
            }
            for (int i = node.childCount() - 1; i >= 0; i--) {
                if (node.child(i) != null) {
                    stack.push(node.child(i));
                }
            }
        }
        throw new AssertionError("No " + type + " node in " + root.text());
    }

    public static SyntaxNode parseAndFind(String source, String type) {
        return find(parse(source), type);
    }

    /**
     * First statement of a parsed source file.
     */
    public static SyntaxNode firstStatement(String source) {
        return parse(source).child(0);
    }
}
