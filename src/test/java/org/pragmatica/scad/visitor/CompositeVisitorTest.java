package org.pragmatica.scad.visitor;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.pragmatica.scad.ast.AstNode;
import org.pragmatica.scad.ast.CsgKind;
import org.pragmatica.scad.ast.Expression;
import org.pragmatica.scad.ast.PrimitiveKind;
import org.pragmatica.scad.ast.TransformKind;
import org.pragmatica.scad.error.CollectingErrorHandler;
import org.pragmatica.scad.error.ParserException;
import org.pragmatica.scad.tree.NodeTypes;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;
import static org.pragmatica.scad.CstFixtures.firstStatement;
import static org.pragmatica.scad.CstFixtures.parse;
import static org.pragmatica.scad.CstFixtures.parseAndFind;

/**
 * Tests for delegate dispatch and the registration-order priority of {@link CompositeVisitor}.
 */
class CompositeVisitorTest {

    private CollectingErrorHandler handler;

    @BeforeEach
    void setUp() {
        handler = new CollectingErrorHandler();
    }

    // === Negative contract of control structures ===

    @Test
    void visitNode_ifStatement_returnsIfNode() {
        var composite = new CompositeVisitor(List.of(new PrimitiveVisitor(handler), new ControlStructureVisitor(handler)),
                                             handler);

        var result = assertInstanceOf(AstNode.If.class, composite.visitNode(firstStatement("if (true) cube(1);")));

        var cube = assertInstanceOf(AstNode.Primitive.class, result.thenBranch().get(0));
        assertEquals(PrimitiveKind.CUBE, cube.kind());
    }

    @Test
    void visitNode_bareCall_returnsPrimitive() {
        var composite = new CompositeVisitor(List.of(new PrimitiveVisitor(handler), new ControlStructureVisitor(handler)),
                                             handler);

        var result = composite.visitNode(firstStatement("cube(1);"));

        assertNotNull(result);
        assertEquals("cube", result.type());
    }

    @Test
    void visitNode_controlRegisteredFirst_doesNotShadowCalls() {
        var composite = new CompositeVisitor(List.of(new ControlStructureVisitor(handler), new PrimitiveVisitor(handler)),
                                             handler);

        assertInstanceOf(AstNode.Primitive.class, composite.visitNode(firstStatement("sphere(2);")));
        assertInstanceOf(AstNode.If.class, composite.visitNode(firstStatement("if (a) sphere(2);")));
    }

    // === Priority ===

    @Test
    void visitNode_builtinBeforeModuleVisitor_returnsPrimitive() {
        var composite = new CompositeVisitor(List.of(new PrimitiveVisitor(handler), new ModuleVisitor(handler)), handler);

        assertInstanceOf(AstNode.Primitive.class, composite.visitNode(firstStatement("cube(1);")));
        assertInstanceOf(AstNode.ModuleInstantiation.class, composite.visitNode(firstStatement("gear(1);")));
    }

    @Test
    void visitNode_moduleVisitorFirst_winsForBuiltins() {
        var composite = new CompositeVisitor(List.of(new ModuleVisitor(handler), new PrimitiveVisitor(handler)), handler);

        var result = assertInstanceOf(AstNode.ModuleInstantiation.class, composite.visitNode(firstStatement("cube(1);")));

        assertEquals("cube", result.name());
    }

    @Test
    void defaultVisitor_registersDocumentedOrder() {
        var visitors = AstGenerator.defaultVisitor(handler).visitors();

        assertThat(visitors).extracting(visitor -> visitor.getClass().getSimpleName())
                            .containsExactly("PrimitiveVisitor",
                                             "TransformVisitor",
                                             "CsgVisitor",
                                             "ControlStructureVisitor",
                                             "ExpressionVisitor",
                                             "VariableVisitor",
                                             "EchoAssertVisitor",
                                             "ModuleVisitor",
                                             "FunctionVisitor");
    }

    // === Nested dispatch through the root ===

    @Test
    void visitNode_transformChildren_dispatchedToOwningDelegates() {
        var composite = AstGenerator.defaultVisitor(handler);

        var translate = assertInstanceOf(AstNode.Transform.class,
                                         composite.visitNode(firstStatement("translate([1, 0, 0]) difference() { cube(2); for (i = [0:1]) sphere(i); }")));

        assertEquals(TransformKind.TRANSLATE, translate.kind());
        assertInstanceOf(Expression.Vector.class, translate.argument("v").orElseThrow());
        var difference = assertInstanceOf(AstNode.Csg.class, translate.children().get(0));
        assertEquals(CsgKind.DIFFERENCE, difference.kind());
        assertEquals(2, difference.children().size());
        assertInstanceOf(AstNode.ForLoop.class, difference.children().get(1));
    }

    @Test
    void visitNode_expressionNode_usesExpressionDelegate() {
        var composite = AstGenerator.defaultVisitor(handler);

        var result = composite.visitNode(parseAndFind("x = a + 1;", NodeTypes.BINARY_EXPRESSION));

        assertInstanceOf(Expression.Binary.class, result);
    }

    @Test
    void visitNode_callExpression_returnsFunctionCall() {
        var composite = AstGenerator.defaultVisitor(handler);

        var result = composite.visitNode(parseAndFind("x = sqrt(2);", NodeTypes.CALL_EXPRESSION));

        assertEquals("sqrt", assertInstanceOf(Expression.FunctionCall.class, result).name());
    }

    @Test
    void visitNode_unknownType_returnsNull() {
        var composite = AstGenerator.defaultVisitor(handler);

        assertNull(composite.visitNode(parseAndFind("m(1);", NodeTypes.ARGUMENT_LIST)));
        assertNull(composite.visitNode(null));
    }

    @Test
    void visitChildren_flattensBareBlocksAndSkipsComments() {
        var composite = AstGenerator.defaultVisitor(handler);

        var result = composite.visitChildren(parse("// shapes\n{ cube(1); sphere(1); }\ncircle(1);"));

        assertThat(result).extracting(AstNode::type).containsExactly("cube", "sphere", "circle");
    }

    @Test
    void visitNode_sameNodeTwice_returnsEqualTrees() {
        var composite = AstGenerator.defaultVisitor(handler);
        var statement = firstStatement("module m(s = [1, 2]) { if (s[0] > 1) cube(s); else for (i = [0:2:4]) translate([i, 0]) sphere(1); }");

        assertEquals(composite.visitNode(statement), composite.visitNode(statement));
    }

    // === Construction ===

    @Test
    void constructor_withoutDelegates_throws() {
        assertThatThrownBy(() -> new CompositeVisitor(List.of(), handler)).isInstanceOf(ParserException.class);
    }
}
