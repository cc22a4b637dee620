package org.pragmatica.scad.visitor;

import org.pragmatica.scad.ast.AstNode;
import org.pragmatica.scad.ast.ErrorNode;
import org.pragmatica.scad.ast.Expression;
import org.pragmatica.scad.ast.Parameter;
import org.pragmatica.scad.error.ErrorCode;
import org.pragmatica.scad.error.ErrorHandler;
import org.pragmatica.scad.tree.FieldReader;
import org.pragmatica.scad.tree.NodeTypes;
import org.pragmatica.scad.tree.SourceSpan;
import org.pragmatica.scad.tree.SyntaxNode;

import java.util.List;

/**
 * Module definitions, instantiations of user modules, and {@code include}/{@code use} statements.
 *
 * <p>Accepts every call name, so it belongs after the built-in module visitors in a composite.
 */
public class ModuleVisitor extends BaseVisitor {

    public ModuleVisitor(ErrorHandler errorHandler) {
        super(errorHandler);
    }

    @Override
    protected boolean handlesCall(String name) {
        return true;
    }

    @Override
    protected AstNode createNodeForCall(SyntaxNode node, String name, List<Parameter> arguments) {
        return new AstNode.ModuleInstantiation(name,
                                               arguments,
                                               visitBody(node.childForFieldName("body")),
                                               modifierOf(node),
                                               SourceSpan.of(node));
    }

    @Override
    public AstNode visitModuleDefinition(SyntaxNode node) {
        var name = FieldReader.definitionName(node, "module");
        if (name == null) {
            errorHandler.logError("Module definition without a name", node);
            return ErrorNode.of(ErrorCode.MISSING_CHILD_NODE, "Module definition has no name", node);
        }
        if (name.degraded()) {
            errorHandler.logWarning("Module name '" + name.text() + "' recovered from source text, location unavailable",
                                    node);
        }
        var identifier = new Expression.Identifier(name.text(), SourceSpan.of(name.node()));
        return new AstNode.ModuleDefinition(identifier,
                                            parameters(node.childForFieldName("parameters")),
                                            visitBody(node.childForFieldName("body")),
                                            SourceSpan.of(node));
    }

    @Override
    public AstNode visitIncludeStatement(SyntaxNode node) {
        var path = node.childForFieldName("path");
        if (path == null || path.isMissing()) {
            errorHandler.logError("Missing path in " + node.type(), node);
            return ErrorNode.of(ErrorCode.MISSING_CHILD_NODE, "Missing path in " + node.type(), node);
        }
        var kind = NodeTypes.USE_STATEMENT.equals(node.type()) ? AstNode.Include.Kind.USE : AstNode.Include.Kind.INCLUDE;
        return new AstNode.Include(stripDelimiters(path.text()), kind, SourceSpan.of(node));
    }

    private static String stripDelimiters(String path) {
        if (path.length() >= 2 && (path.startsWith("<") || path.startsWith("\""))) {
            return path.substring(1, path.length() - 1);
        }
        return path;
    }
}
