package org.pragmatica.scad.visitor;

import org.pragmatica.scad.ast.AstNode;
import org.pragmatica.scad.ast.ErrorNode;
import org.pragmatica.scad.ast.Expression;
import org.pragmatica.scad.ast.Parameter;
import org.pragmatica.scad.error.ErrorCode;
import org.pragmatica.scad.error.ErrorHandler;
import org.pragmatica.scad.tree.SourceSpan;
import org.pragmatica.scad.tree.SyntaxNode;

import java.util.List;
import java.util.Optional;

public class EchoAssertVisitor extends BaseVisitor {

    public EchoAssertVisitor(ErrorHandler errorHandler) {
        super(errorHandler);
    }

    @Override
    protected AstNode createNodeForCall(SyntaxNode node, String name, List<Parameter> arguments) {
        return null;
    }

    @Override
    public AstNode visitEchoStatement(SyntaxNode node) {
        return new AstNode.Echo(arguments(node.childForFieldName("arguments")), SourceSpan.of(node));
    }

    @Override
    public AstNode visitAssertStatement(SyntaxNode node) {
        var conditionNode = node.childForFieldName("condition");
        Expression condition = expression(conditionNode);
        if (condition == null) {
            errorHandler.logError("assert without a usable condition", node);
            condition = ErrorNode.of(ErrorCode.MISSING_CHILD_NODE, "assert has no condition", node);
        }
        var messageNode = node.childForFieldName("message");
        var message = messageNode == null ? Optional.<Expression>empty() : Optional.ofNullable(expression(messageNode));
        return new AstNode.Assert(condition, message, SourceSpan.of(node));
    }
}
