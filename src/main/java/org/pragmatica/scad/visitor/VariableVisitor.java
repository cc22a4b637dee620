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

/**
 * Variable assignments such as {@code width = 10;} or {@code $fn = 64;}.
 */
public class VariableVisitor extends BaseVisitor {

    public VariableVisitor(ErrorHandler errorHandler) {
        super(errorHandler);
    }

    @Override
    protected AstNode createNodeForCall(SyntaxNode node, String name, List<Parameter> arguments) {
        return null;
    }

    @Override
    public AstNode visitAssignmentStatement(SyntaxNode node) {
        var nameNode = node.childForFieldName("name");
        if (nameNode == null || nameNode.isMissing()) {
            errorHandler.logError("Assignment without a variable name", node);
            return ErrorNode.of(ErrorCode.MISSING_CHILD_NODE, "Assignment has no variable name", node);
        }
        var valueNode = node.childForFieldName("value");
        Expression value;
        if (valueNode == null || valueNode.isMissing()) {
            errorHandler.logError("Assignment to '" + nameNode.text() + "' without a value", node);
            value = ErrorNode.of(ErrorCode.MISSING_CHILD_NODE, "Assignment has no value", node);
        } else {
            value = expression(valueNode);
            if (value == null) {
                errorHandler.logError("Unsupported assigned value: " + valueNode.type(), valueNode);
                value = ErrorNode.of(ErrorCode.UNEXPECTED_NODE_TYPE, "Assigned value is not an expression", valueNode);
            }
        }
        var variable = new Expression.Identifier(nameNode.text(), SourceSpan.of(nameNode));
        return new AstNode.Assignment(variable, value, SourceSpan.of(node));
    }
}
