package org.pragmatica.scad.outline;

import org.pragmatica.scad.outline.OutlineSymbol.Kind;
import org.pragmatica.scad.tree.FieldReader;
import org.pragmatica.scad.tree.SourceSpan;
import org.pragmatica.scad.tree.SyntaxNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.pragmatica.scad.tree.NodeTypes.*;

/**
 * Collects module, function and variable declarations straight from the syntax tree.
 *
 * <p>Runs independently of AST construction and reports nothing: declarations whose name cannot be
 * recovered are left out.
 */
public final class OutlineExtractor {
    private OutlineExtractor() {}

    public static List<OutlineSymbol> extract(SyntaxNode root) {
        var symbols = new ArrayList<OutlineSymbol>();
        collect(root, symbols);
        return symbols;
    }

    private static void collect(SyntaxNode container, List<OutlineSymbol> symbols) {
        if (container == null) {
            return;
        }
        for (int i = 0; i < container.childCount(); i++) {
            var child = container.child(i);
            if (child == null) {
                continue;
            }
            switch (child.type()) {
                case STATEMENT, BLOCK -> collect(child, symbols);
                case MODULE_DEFINITION -> addDeclaration(child, "module", Kind.MODULE, symbols);
                case FUNCTION_DEFINITION -> addDeclaration(child, "function", Kind.FUNCTION, symbols);
                case ASSIGNMENT_STATEMENT -> addVariable(child, symbols);
                default -> {
                }
            }
        }
    }

    private static void addDeclaration(SyntaxNode node, String keyword, Kind kind, List<OutlineSymbol> symbols) {
        var name = FieldReader.definitionName(node, keyword);
        if (name == null) {
            return;
        }
        var children = new ArrayList<OutlineSymbol>();
        if (kind == Kind.MODULE) {
            collect(FieldReader.field(node, "body"), children);
        }
        symbols.add(symbol(node, name, kind, children));
    }

    private static void addVariable(SyntaxNode node, List<OutlineSymbol> symbols) {
        var nameNode = FieldReader.field(node, "name");
        if (nameNode == null || nameNode.isMissing()) {
            return;
        }
        symbols.add(symbol(node, new FieldReader.Field(nameNode.text(), nameNode), Kind.VARIABLE, List.of()));
    }

    private static OutlineSymbol symbol(SyntaxNode node, FieldReader.Field name, Kind kind, List<OutlineSymbol> children) {
        var selection = name.degraded() ? Optional.<SourceSpan>empty() : Optional.of(SourceSpan.of(name.node()));
        return new OutlineSymbol(name.text(), kind, SourceSpan.of(node), selection, children);
    }
}
