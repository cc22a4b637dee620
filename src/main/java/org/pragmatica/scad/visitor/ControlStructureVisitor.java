package org.pragmatica.scad.visitor;

import org.pragmatica.scad.ast.AstNode;
import org.pragmatica.scad.ast.Expression;
import org.pragmatica.scad.ast.Parameter;
import org.pragmatica.scad.error.ErrorHandler;
import org.pragmatica.scad.tree.FieldReader;
import org.pragmatica.scad.tree.SourceSpan;
import org.pragmatica.scad.tree.SyntaxNode;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Set;

import static org.pragmatica.scad.tree.NodeTypes.*;

/**
 * {@code if}/{@code else}, {@code for}, {@code let} and {@code each}.
 *
 * <p>Only the construct directly wrapped by a statement is inspected. Statements wrapping anything
 * else yield {@code null}, leaving ordinary calls to the other visitors of a composite.
 */
public class ControlStructureVisitor extends BaseVisitor {
    private static final Set<String> CONTROL_TYPES = Set.of(IF_STATEMENT, FOR_STATEMENT, LET_STATEMENT, EACH_EXPRESSION);

    private final IfElseVisitor ifElse;
    private final ForLoopVisitor forLoop;

    public ControlStructureVisitor(ErrorHandler errorHandler) {
        super(errorHandler);
        this.ifElse = new IfElseVisitor(errorHandler);
        this.forLoop = new ForLoopVisitor(errorHandler);
        ifElse.bindRoot(this);
        forLoop.bindRoot(this);
    }

    @Override
    protected void bindRoot(AstVisitor root) {
        super.bindRoot(root);
        ifElse.bindRoot(root);
        forLoop.bindRoot(root);
    }

    @Override
    protected AstNode createNodeForCall(SyntaxNode node, String name, List<Parameter> arguments) {
        return null;
    }

    @Override
    public AstNode visitStatement(SyntaxNode node) {
        var inner = FieldReader.firstNamed(node);
        if (inner == null || !CONTROL_TYPES.contains(inner.type())) {
            return null;
        }
        return visitNode(inner);
    }

    @Override
    public AstNode visitIfStatement(SyntaxNode node) {
        return ifElse.visitIfStatement(node);
    }

    @Override
    public AstNode visitForStatement(SyntaxNode node) {
        return forLoop.visitForStatement(node);
    }

    /**
     * {@code let (a = 1, b = a + 1) body}: bindings come from named arguments in declaration order.
     */
    @Override
    public AstNode visitLetStatement(SyntaxNode node) {
        var body = node.childForFieldName("body");
        if (body == null || body.isMissing()) {
            errorHandler.logDebug("let without a body: " + node.text());
            return null;
        }
        var assignments = new LinkedHashMap<String, Expression>();
        for (var argument : arguments(node.childForFieldName("arguments"))) {
            if (argument.name().isEmpty()) {
                errorHandler.logWarning("let binding without a name is ignored", node);
                continue;
            }
            assignments.put(argument.name().get(), argument.value());
        }
        return new AstNode.Let(assignments, visitBody(body), SourceSpan.of(node));
    }

    @Override
    public AstNode visitEachExpression(SyntaxNode node) {
        var operand = node.childForFieldName("expression");
        var value = operand == null ? FieldReader.firstNamed(node) : operand;
        if (value == null || value.isMissing()) {
            errorHandler.logDebug("each without an operand: " + node.text());
            return null;
        }
        var expression = expression(value);
        if (expression == null) {
            return null;
        }
        return new Expression.Each(expression, SourceSpan.of(node));
    }
}
