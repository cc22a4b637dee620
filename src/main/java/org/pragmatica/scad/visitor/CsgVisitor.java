package org.pragmatica.scad.visitor;

import org.pragmatica.scad.ast.AstNode;
import org.pragmatica.scad.ast.BuiltinKind;
import org.pragmatica.scad.ast.CsgKind;
import org.pragmatica.scad.ast.Parameter;
import org.pragmatica.scad.error.ErrorHandler;
import org.pragmatica.scad.tree.SourceSpan;
import org.pragmatica.scad.tree.SyntaxNode;

import java.util.List;

public class CsgVisitor extends BaseVisitor {

    public CsgVisitor(ErrorHandler errorHandler) {
        super(errorHandler);
    }

    @Override
    protected boolean handlesCall(String name) {
        return BuiltinKind.byKeyword(CsgKind.class, name).isPresent();
    }

    @Override
    protected AstNode createNodeForCall(SyntaxNode node, String name, List<Parameter> arguments) {
        return BuiltinKind.byKeyword(CsgKind.class, name)
                          .map(kind -> (AstNode) new AstNode.Csg(kind,
                                                                 arguments,
                                                                 visitBody(node.childForFieldName("body")),
                                                                 modifierOf(node),
                                                                 SourceSpan.of(node)))
                          .orElse(null);
    }
}
