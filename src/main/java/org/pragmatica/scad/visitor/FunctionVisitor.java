package org.pragmatica.scad.visitor;

import org.pragmatica.scad.ast.AstNode;
import org.pragmatica.scad.ast.ErrorNode;
import org.pragmatica.scad.ast.Expression;
import org.pragmatica.scad.ast.Parameter;
import org.pragmatica.scad.error.ErrorCode;
import org.pragmatica.scad.error.ErrorHandler;
import org.pragmatica.scad.tree.FieldReader;
import org.pragmatica.scad.tree.SourceSpan;
import org.pragmatica.scad.tree.SyntaxNode;

import java.util.List;

/**
 * Function definitions and function calls.
 */
public class FunctionVisitor extends BaseVisitor {

    public FunctionVisitor(ErrorHandler errorHandler) {
        super(errorHandler);
    }

    @Override
    protected boolean handlesCall(String name) {
        return true;
    }

    @Override
    protected AstNode createNodeForCall(SyntaxNode node, String name, List<Parameter> arguments) {
        return new Expression.FunctionCall(name, arguments, SourceSpan.of(node));
    }

    /**
     * Statement-level calls are module instantiations, not function calls.
     */
    @Override
    public AstNode visitModuleInstantiation(SyntaxNode node) {
        return null;
    }

    @Override
    public AstNode visitCallExpression(SyntaxNode node) {
        var callee = node.childForFieldName("function");
        if (callee == null || callee.isMissing()) {
            return null;
        }
        return createNodeForCall(node, callee.text(), arguments(node.childForFieldName("arguments")));
    }

    /**
     * Without a structured {@code name} field the name is recovered from the source text; such a name
     * carries no location.
     */
    @Override
    public AstNode visitFunctionDefinition(SyntaxNode node) {
        var name = FieldReader.definitionName(node, "function");
        if (name == null) {
            errorHandler.logError("Function definition without a name", node);
            return ErrorNode.of(ErrorCode.MISSING_CHILD_NODE, "Function definition has no name", node);
        }
        if (name.degraded()) {
            errorHandler.logWarning("Function name '" + name.text() + "' recovered from source text, location unavailable",
                                    node);
        }
        var identifier = new Expression.Identifier(name.text(), SourceSpan.of(name.node()));
        return new AstNode.FunctionDefinition(identifier,
                                              parameters(node.childForFieldName("parameters")),
                                              body(node),
                                              SourceSpan.of(node));
    }

    private Expression body(SyntaxNode node) {
        var valueNode = node.childForFieldName("value");
        if (valueNode == null || valueNode.isMissing()) {
            errorHandler.logError("Function definition without a body expression", node);
            return ErrorNode.of(ErrorCode.MISSING_CHILD_NODE, "Function definition has no body expression", node);
        }
        var value = expression(valueNode);
        if (value == null) {
            errorHandler.logError("Unsupported function body: " + valueNode.type(), valueNode);
            return ErrorNode.of(ErrorCode.UNEXPECTED_NODE_TYPE, "Function body is not an expression", valueNode);
        }
        return value;
    }
}
