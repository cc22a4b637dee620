package org.pragmatica.scad.visitor;

import org.pragmatica.scad.ast.AstNode;
import org.pragmatica.scad.ast.Expression;
import org.pragmatica.scad.ast.Parameter;
import org.pragmatica.scad.error.ErrorHandler;
import org.pragmatica.scad.error.ParserException;
import org.pragmatica.scad.tree.NodeTypes;
import org.pragmatica.scad.tree.SyntaxNode;

import java.util.List;
import java.util.function.Function;

import static org.pragmatica.scad.tree.NodeTypes.*;

/**
 * Routes CST nodes to a list of delegate visitors.
 *
 * <p>Known node types go to the matching {@code visitXxx} method of the delegates; other types are
 * offered to each delegate's {@link #visitNode}. Either way the delegates are asked in registration
 * order and the first non-null result wins, so <b>registration order is a priority list</b>: a
 * visitor that accepts any call name (such as {@link ModuleVisitor}) must come after the visitors
 * for built-in modules.
 */
public class CompositeVisitor extends BaseVisitor {
    private final List<BaseVisitor> visitors;

    public CompositeVisitor(List<? extends BaseVisitor> visitors, ErrorHandler errorHandler) {
        super(errorHandler);
        if (visitors.isEmpty()) {
            throw new ParserException("Composite visitor requires at least one delegate");
        }
        this.visitors = List.copyOf(visitors);
        this.visitors.forEach(visitor -> visitor.bindRoot(this));
    }

    public List<BaseVisitor> visitors() {
        return visitors;
    }

    @Override
    protected void bindRoot(AstVisitor root) {
        super.bindRoot(root);
        visitors.forEach(visitor -> visitor.bindRoot(root));
    }

    @Override
    public AstNode visitNode(SyntaxNode node) {
        if (node == null) {
            return null;
        }
        return switch (node.type()) {
            case STATEMENT -> visitStatement(node);
            case MODULE_INSTANTIATION -> visitModuleInstantiation(node);
            case MODULE_DEFINITION -> visitModuleDefinition(node);
            case FUNCTION_DEFINITION -> visitFunctionDefinition(node);
            case IF_STATEMENT -> visitIfStatement(node);
            case FOR_STATEMENT -> visitForStatement(node);
            case LET_STATEMENT -> visitLetStatement(node);
            case EACH_EXPRESSION -> visitEachExpression(node);
            case ASSIGNMENT_STATEMENT -> visitAssignmentStatement(node);
            case ECHO_STATEMENT -> visitEchoStatement(node);
            case ASSERT_STATEMENT -> visitAssertStatement(node);
            case INCLUDE_STATEMENT, USE_STATEMENT -> visitIncludeStatement(node);
            case CALL_EXPRESSION -> visitCallExpression(node);
            case BLOCK -> null;
            default -> visitOther(node);
        };
    }

    private AstNode visitOther(SyntaxNode node) {
        if (NodeTypes.isExpression(node.type())) {
            return visitExpression(node);
        }
        return firstNonNull(visitor -> visitor.visitNode(node));
    }

    @Override
    public AstNode visitStatement(SyntaxNode node) {
        return firstNonNull(visitor -> visitor.visitStatement(node));
    }

    @Override
    public AstNode visitModuleInstantiation(SyntaxNode node) {
        return firstNonNull(visitor -> visitor.visitModuleInstantiation(node));
    }

    @Override
    public AstNode visitModuleDefinition(SyntaxNode node) {
        return firstNonNull(visitor -> visitor.visitModuleDefinition(node));
    }

    @Override
    public AstNode visitFunctionDefinition(SyntaxNode node) {
        return firstNonNull(visitor -> visitor.visitFunctionDefinition(node));
    }

    @Override
    public AstNode visitIfStatement(SyntaxNode node) {
        return firstNonNull(visitor -> visitor.visitIfStatement(node));
    }

    @Override
    public AstNode visitForStatement(SyntaxNode node) {
        return firstNonNull(visitor -> visitor.visitForStatement(node));
    }

    @Override
    public AstNode visitLetStatement(SyntaxNode node) {
        return firstNonNull(visitor -> visitor.visitLetStatement(node));
    }

    @Override
    public AstNode visitEachExpression(SyntaxNode node) {
        return firstNonNull(visitor -> visitor.visitEachExpression(node));
    }

    @Override
    public AstNode visitAssignmentStatement(SyntaxNode node) {
        return firstNonNull(visitor -> visitor.visitAssignmentStatement(node));
    }

    @Override
    public AstNode visitEchoStatement(SyntaxNode node) {
        return firstNonNull(visitor -> visitor.visitEchoStatement(node));
    }

    @Override
    public AstNode visitAssertStatement(SyntaxNode node) {
        return firstNonNull(visitor -> visitor.visitAssertStatement(node));
    }

    @Override
    public AstNode visitIncludeStatement(SyntaxNode node) {
        return firstNonNull(visitor -> visitor.visitIncludeStatement(node));
    }

    @Override
    public AstNode visitCallExpression(SyntaxNode node) {
        return firstNonNull(visitor -> visitor.visitCallExpression(node));
    }

    @Override
    public Expression visitExpression(SyntaxNode node) {
        return firstNonNull(visitor -> visitor.visitExpression(node));
    }

    @Override
    protected boolean handlesCall(String name) {
        return visitors.stream().anyMatch(visitor -> visitor.handlesCall(name));
    }

    @Override
    protected AstNode createNodeForCall(SyntaxNode node, String name, List<Parameter> arguments) {
        return firstNonNull(visitor -> visitor.handlesCall(name) ? visitor.createNodeForCall(node, name, arguments) : null);
    }

    private <T> T firstNonNull(Function<BaseVisitor, T> call) {
        for (var visitor : visitors) {
            var result = call.apply(visitor);
            if (result != null) {
                return result;
            }
        }
        return null;
    }
}
