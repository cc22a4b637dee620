package org.pragmatica.scad.visitor;

import org.pragmatica.scad.ast.AstNode;
import org.pragmatica.scad.ast.BuiltinKind;
import org.pragmatica.scad.ast.Parameter;
import org.pragmatica.scad.ast.PrimitiveKind;
import org.pragmatica.scad.error.ErrorHandler;
import org.pragmatica.scad.tree.SourceSpan;
import org.pragmatica.scad.tree.SyntaxNode;

import java.util.List;

/**
 * 2D and 3D primitives: cube, sphere, cylinder, square, circle, polygon, polyhedron and text.
 */
public class PrimitiveVisitor extends BaseVisitor {

    public PrimitiveVisitor(ErrorHandler errorHandler) {
        super(errorHandler);
    }

    @Override
    protected boolean handlesCall(String name) {
        return BuiltinKind.byKeyword(PrimitiveKind.class, name).isPresent();
    }

    @Override
    protected AstNode createNodeForCall(SyntaxNode node, String name, List<Parameter> arguments) {
        var kind = BuiltinKind.byKeyword(PrimitiveKind.class, name);
        if (kind.isEmpty()) {
            return null;
        }
        if (node.childForFieldName("body") != null) {
            errorHandler.logInfo(name + " ignores its child statements");
        }
        return new AstNode.Primitive(kind.get(), arguments, modifierOf(node), SourceSpan.of(node));
    }
}
