package org.pragmatica.scad.parser;

import org.pragmatica.scad.error.ParseError;
import org.pragmatica.scad.tree.CstNode;

import java.util.List;

/**
 * A parsed source file together with the syntax errors reported while producing it.
 */
public record SyntaxTree(String source, CstNode root, List<ParseError> syntaxErrors) {

    public SyntaxTree {
        syntaxErrors = List.copyOf(syntaxErrors);
    }

    public boolean hasErrors() {
        return root.hasError() || !syntaxErrors.isEmpty();
    }
}
