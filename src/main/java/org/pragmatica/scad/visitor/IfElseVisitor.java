package org.pragmatica.scad.visitor;

import org.pragmatica.scad.ast.AstNode;
import org.pragmatica.scad.ast.ErrorNode;
import org.pragmatica.scad.ast.Parameter;
import org.pragmatica.scad.error.ErrorCode;
import org.pragmatica.scad.error.ErrorHandler;
import org.pragmatica.scad.tree.SourceSpan;
import org.pragmatica.scad.tree.SyntaxNode;

import java.util.List;
import java.util.Optional;

/**
 * {@code if (condition) consequence [else alternative]}. An else-if chain becomes an else branch
 * holding one nested {@link AstNode.If}.
 */
public class IfElseVisitor extends BaseVisitor {

    public IfElseVisitor(ErrorHandler errorHandler) {
        super(errorHandler);
    }

    @Override
    protected AstNode createNodeForCall(SyntaxNode node, String name, List<Parameter> arguments) {
        return null;
    }

    @Override
    public AstNode visitIfStatement(SyntaxNode node) {
        var conditionNode = node.childForFieldName("condition");
        var consequence = node.childForFieldName("consequence");
        if (conditionNode == null || consequence == null || consequence.isMissing()) {
            errorHandler.logDebug("Incomplete if statement: " + node.text());
            return null;
        }
        var condition = expression(conditionNode);
        if (condition == null) {
            errorHandler.logError("Unsupported if condition: " + conditionNode.type(), conditionNode);
            condition = ErrorNode.of(ErrorCode.UNEXPECTED_NODE_TYPE, "If condition is not an expression", conditionNode);
        }
        var alternative = node.childForFieldName("alternative");
        var elseBranch = alternative == null ? Optional.<List<AstNode>>empty() : Optional.of(visitBody(alternative));
        return new AstNode.If(condition, visitBody(consequence), elseBranch, SourceSpan.of(node));
    }
}
