package org.pragmatica.scad.visitor;

import org.pragmatica.scad.ast.AstNode;
import org.pragmatica.scad.ast.Expression;
import org.pragmatica.scad.tree.SyntaxNode;

import java.util.List;

/**
 * Converts CST nodes into AST nodes.
 *
 * <p>Every method returns {@code null} when the node is outside the visitor's slice of the grammar.
 * Malformed but recognised nodes produce an {@link org.pragmatica.scad.ast.ErrorNode} instead.
 */
public interface AstVisitor {

    AstNode visitNode(SyntaxNode node);

    /**
     * Visit named children, flattening blocks and dropping {@code null} results.
     */
    List<AstNode> visitChildren(SyntaxNode node);

    List<AstNode> visitBlock(SyntaxNode node);

    AstNode visitStatement(SyntaxNode node);

    AstNode visitModuleInstantiation(SyntaxNode node);

    AstNode visitModuleDefinition(SyntaxNode node);

    AstNode visitFunctionDefinition(SyntaxNode node);

    AstNode visitIfStatement(SyntaxNode node);

    AstNode visitForStatement(SyntaxNode node);

    AstNode visitLetStatement(SyntaxNode node);

    AstNode visitEachExpression(SyntaxNode node);

    AstNode visitAssignmentStatement(SyntaxNode node);

    AstNode visitEchoStatement(SyntaxNode node);

    AstNode visitAssertStatement(SyntaxNode node);

    /**
     * Handles both {@code include} and {@code use}.
     */
    AstNode visitIncludeStatement(SyntaxNode node);

    AstNode visitCallExpression(SyntaxNode node);

    Expression visitExpression(SyntaxNode node);
}
