package org.pragmatica.scad.visitor;

import org.pragmatica.scad.ast.AstNode;
import org.pragmatica.scad.ast.Expression;
import org.pragmatica.scad.ast.Modifier;
import org.pragmatica.scad.ast.ModuleParameter;
import org.pragmatica.scad.ast.Parameter;
import org.pragmatica.scad.error.ErrorHandler;
import org.pragmatica.scad.tree.FieldReader;
import org.pragmatica.scad.tree.NodeTypes;
import org.pragmatica.scad.tree.SyntaxNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.pragmatica.scad.tree.NodeTypes.*;

/**
 * Shared traversal for all visitors.
 *
 * <p>{@link #visitNode} dispatches on the CST node type to the per-construct methods, all of which
 * return {@code null} here. Subclasses override the constructs they own and implement
 * {@link #createNodeForCall} for call-shaped nodes.
 *
 * <p>Nested bodies are visited through the root visitor. A visitor used on its own is its own root;
 * a {@link CompositeVisitor} rebinds the root of each delegate to itself so that, for example, the
 * children of a {@code translate} are dispatched to whichever delegate owns them.
 */
public abstract class BaseVisitor implements AstVisitor {
    protected final ErrorHandler errorHandler;

    private AstVisitor root = this;
    private ExpressionVisitor expressionVisitor;

    protected BaseVisitor(ErrorHandler errorHandler) {
        this.errorHandler = errorHandler;
    }

    protected void bindRoot(AstVisitor root) {
        this.root = root;
        if (expressionVisitor != null) {
            expressionVisitor.bindRoot(root);
        }
    }

    protected AstVisitor root() {
        return root;
    }

    /**
     * Whether {@link #createNodeForCall} builds a node for calls with this name.
     */
    protected boolean handlesCall(String name) {
        return false;
    }

    /**
     * Build the node for a recognised call-shaped construct.
     *
     * @param node      the instantiation or call expression
     * @param name      called module or function name
     * @param arguments call arguments in source order
     * @return the node, or {@code null} if this visitor does not build calls of that name
     */
    protected abstract AstNode createNodeForCall(SyntaxNode node, String name, List<Parameter> arguments);

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
            default -> NodeTypes.isExpression(node.type()) ? visitExpression(node) : null;
        };
    }

    @Override
    public List<AstNode> visitChildren(SyntaxNode node) {
        var results = new ArrayList<AstNode>();
        if (node == null) {
            return results;
        }
        for (int i = 0; i < node.childCount(); i++) {
            var child = node.child(i);
            if (child == null || !child.isNamed() || COMMENT.equals(child.type())) {
                continue;
            }
            var block = blockOf(child);
            if (block != null) {
                results.addAll(root.visitBlock(block));
                continue;
            }
            var result = root.visitNode(child);
            if (result != null) {
                results.add(result);
            }
        }
        return results;
    }

    @Override
    public List<AstNode> visitBlock(SyntaxNode node) {
        return visitChildren(node);
    }

    /**
     * Visit the construct wrapped by a statement with this visitor's own dispatch.
     */
    @Override
    public AstNode visitStatement(SyntaxNode node) {
        var inner = FieldReader.firstNamed(node);
        return inner == null ? null : visitNode(inner);
    }

    @Override
    public AstNode visitModuleInstantiation(SyntaxNode node) {
        var name = FieldReader.text(node, "name");
        if (name == null || !handlesCall(name)) {
            return null;
        }
        return createNodeForCall(node, name, arguments(node.childForFieldName("arguments")));
    }

    @Override
    public AstNode visitModuleDefinition(SyntaxNode node) {
        return null;
    }

    @Override
    public AstNode visitFunctionDefinition(SyntaxNode node) {
        return null;
    }

    @Override
    public AstNode visitIfStatement(SyntaxNode node) {
        return null;
    }

    @Override
    public AstNode visitForStatement(SyntaxNode node) {
        return null;
    }

    @Override
    public AstNode visitLetStatement(SyntaxNode node) {
        return null;
    }

    @Override
    public AstNode visitEachExpression(SyntaxNode node) {
        return null;
    }

    @Override
    public AstNode visitAssignmentStatement(SyntaxNode node) {
        return null;
    }

    @Override
    public AstNode visitEchoStatement(SyntaxNode node) {
        return null;
    }

    @Override
    public AstNode visitAssertStatement(SyntaxNode node) {
        return null;
    }

    @Override
    public AstNode visitIncludeStatement(SyntaxNode node) {
        return null;
    }

    @Override
    public AstNode visitCallExpression(SyntaxNode node) {
        return null;
    }

    @Override
    public Expression visitExpression(SyntaxNode node) {
        return null;
    }

    // === Helpers for subclasses ===

    protected ExpressionVisitor expressions() {
        if (expressionVisitor == null) {
            expressionVisitor = new ExpressionVisitor(errorHandler);
            expressionVisitor.bindRoot(root);
        }
        return expressionVisitor;
    }

    protected Expression expression(SyntaxNode node) {
        return node == null ? null : expressions().visitExpression(node);
    }

    protected List<Parameter> arguments(SyntaxNode argumentList) {
        return ArgumentExtractor.extract(argumentList, expressions(), errorHandler);
    }

    protected List<ModuleParameter> parameters(SyntaxNode parameterList) {
        return ParameterExtractor.extract(parameterList, expressions(), errorHandler);
    }

    /**
     * AST of a body slot: a block, a single statement or nothing.
     */
    protected List<AstNode> visitBody(SyntaxNode body) {
        if (body == null || body.isMissing()) {
            return List.of();
        }
        var block = blockOf(body);
        if (block != null) {
            return root.visitBlock(block);
        }
        var result = root.visitNode(body);
        return result == null ? List.of() : List.of(result);
    }

    protected static Optional<Modifier> modifierOf(SyntaxNode node) {
        return Modifier.fromSymbol(FieldReader.text(node, "modifier"));
    }

    private static SyntaxNode blockOf(SyntaxNode node) {
        if (BLOCK.equals(node.type())) {
            return node;
        }
        if (STATEMENT.equals(node.type())) {
            var inner = FieldReader.firstNamed(node);
            return inner != null && BLOCK.equals(inner.type()) ? inner : null;
        }
        return null;
    }
}
