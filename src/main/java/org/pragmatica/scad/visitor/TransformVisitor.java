package org.pragmatica.scad.visitor;

import org.pragmatica.scad.ast.AstNode;
import org.pragmatica.scad.ast.BuiltinKind;
import org.pragmatica.scad.ast.Parameter;
import org.pragmatica.scad.ast.TransformKind;
import org.pragmatica.scad.error.ErrorHandler;
import org.pragmatica.scad.tree.SourceSpan;
import org.pragmatica.scad.tree.SyntaxNode;

import java.util.List;

/**
 * Transformations that apply to their children: translate, rotate, scale, mirror, color, extrusions and so on.
 */
public class TransformVisitor extends BaseVisitor {

    public TransformVisitor(ErrorHandler errorHandler) {
        super(errorHandler);
    }

    @Override
    protected boolean handlesCall(String name) {
        return BuiltinKind.byKeyword(TransformKind.class, name).isPresent();
    }

    @Override
    protected AstNode createNodeForCall(SyntaxNode node, String name, List<Parameter> arguments) {
        var kind = BuiltinKind.byKeyword(TransformKind.class, name);
        if (kind.isEmpty()) {
            return null;
        }
        var children = visitBody(node.childForFieldName("body"));
        if (children.isEmpty()) {
            errorHandler.logDebug(name + " has no children");
        }
        return new AstNode.Transform(kind.get(), arguments, children, modifierOf(node), SourceSpan.of(node));
    }
}
