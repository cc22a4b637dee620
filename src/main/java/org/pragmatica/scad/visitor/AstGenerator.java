package org.pragmatica.scad.visitor;

import org.pragmatica.scad.ast.AstNode;
import org.pragmatica.scad.error.ErrorHandler;
import org.pragmatica.scad.tree.SyntaxNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Builds the AST of a whole source file with the default visitor set.
 */
public final class AstGenerator {
    private static final Logger log = LoggerFactory.getLogger(AstGenerator.class);

    private final CompositeVisitor visitor;

    public AstGenerator(ErrorHandler errorHandler) {
        this.visitor = defaultVisitor(errorHandler);
    }

    /**
     * Default delegates in priority order. Built-in modules come before {@link ModuleVisitor},
     * which accepts every call name.
     */
    public static CompositeVisitor defaultVisitor(ErrorHandler errorHandler) {
        return new CompositeVisitor(List.of(new PrimitiveVisitor(errorHandler),
                                            new TransformVisitor(errorHandler),
                                            new CsgVisitor(errorHandler),
                                            new ControlStructureVisitor(errorHandler),
                                            new ExpressionVisitor(errorHandler),
                                            new VariableVisitor(errorHandler),
                                            new EchoAssertVisitor(errorHandler),
                                            new ModuleVisitor(errorHandler),
                                            new FunctionVisitor(errorHandler)),
                                    errorHandler);
    }

    public List<AstNode> generate(SyntaxNode root) {
        var ast = visitor.visitChildren(root);
        log.debug("Generated {} top-level nodes", ast.size());
        return ast;
    }

    public CompositeVisitor visitor() {
        return visitor;
    }
}
