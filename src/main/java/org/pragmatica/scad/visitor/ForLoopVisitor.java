package org.pragmatica.scad.visitor;

import org.pragmatica.scad.ast.AstNode;
import org.pragmatica.scad.ast.Parameter;
import org.pragmatica.scad.error.ErrorHandler;
import org.pragmatica.scad.tree.SourceSpan;
import org.pragmatica.scad.tree.SyntaxNode;

import java.util.List;

/**
 * {@code for (i = [0:10], j = list) body}. Each clause may iterate over a range, a vector or any
 * other expression.
 */
public class ForLoopVisitor extends BaseVisitor {

    public ForLoopVisitor(ErrorHandler errorHandler) {
        super(errorHandler);
    }

    @Override
    protected AstNode createNodeForCall(SyntaxNode node, String name, List<Parameter> arguments) {
        return null;
    }

    @Override
    public AstNode visitForStatement(SyntaxNode node) {
        var body = node.childForFieldName("body");
        if (body == null || body.isMissing()) {
            errorHandler.logDebug("for without a body: " + node.text());
            return null;
        }
        var variables = expressions().loopVariables(node);
        if (variables.isEmpty()) {
            errorHandler.logDebug("for without loop variables: " + node.text());
            return null;
        }
        return new AstNode.ForLoop(variables, visitBody(body), SourceSpan.of(node));
    }
}
