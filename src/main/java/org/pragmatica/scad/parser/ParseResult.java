package org.pragmatica.scad.parser;

import org.pragmatica.scad.ast.AstNode;
import org.pragmatica.scad.ast.ErrorNode;
import org.pragmatica.scad.error.ParseError;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Outcome of a full parse: the AST, every diagnostic and the overall verdict.
 *
 * @param ast     top-level nodes, possibly containing {@link ErrorNode}s
 * @param errors  syntax errors followed by diagnostics reported while building the AST
 * @param success {@code true} only when the tree has no error nodes and no diagnostics were reported
 * @param tree    the syntax tree the AST was built from
 */
public record ParseResult(List<AstNode> ast, List<ParseError> errors, boolean success, SyntaxTree tree) {

    public ParseResult {
        ast = List.copyOf(ast);
        errors = List.copyOf(errors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public int errorCount() {
        return (int) errors.stream()
                           .filter(ParseError::isError)
                           .count();
    }

    /**
     * Top-level nodes that failed to build.
     */
    public List<ErrorNode> errorNodes() {
        return ast.stream()
                  .filter(ErrorNode.class::isInstance)
                  .map(ErrorNode.class::cast)
                  .toList();
    }

    public String formatErrors(String filename) {
        return errors.stream()
                     .map(error -> error.format(tree.source(), filename))
                     .collect(Collectors.joining("\n"));
    }
}
