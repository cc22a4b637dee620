package org.pragmatica.scad.visitor;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.pragmatica.scad.ast.AstNode;
import org.pragmatica.scad.ast.ErrorNode;
import org.pragmatica.scad.ast.Expression;
import org.pragmatica.scad.ast.Modifier;
import org.pragmatica.scad.ast.PrimitiveKind;
import org.pragmatica.scad.error.CollectingErrorHandler;
import org.pragmatica.scad.error.ErrorCode;
import org.pragmatica.scad.error.ParseError;
import org.pragmatica.scad.tree.CstNode;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.pragmatica.scad.CstFixtures.parse;
import static org.pragmatica.scad.CstFixtures.parseAndFind;
import static org.pragmatica.scad.tree.NodeTypes.*;

/**
 * Tests for module definitions, user module instantiations and include/use statements.
 */
class ModuleVisitorTest {

    private CollectingErrorHandler handler;
    private AstGenerator generator;

    @BeforeEach
    void setUp() {
        handler = new CollectingErrorHandler();
        generator = new AstGenerator(handler);
    }

    private AstNode single(String source) {
        var ast = generator.generate(parse(source));
        assertEquals(1, ast.size(), () -> "Expected one node, got " + ast);
        return ast.get(0);
    }

    // === Definitions ===

    @Test
    void visitModuleDefinition_withDefaults_readsNameParametersAndBody() {
        var module = assertInstanceOf(AstNode.ModuleDefinition.class,
                                      single("module mycube(size = 10, center = false) { cube(size, center = center); }"));

        assertEquals("module_definition", module.type());
        assertEquals("mycube", module.name().name());
        assertTrue(module.name().location().isPresent());

        assertEquals(2, module.parameters().size());
        assertEquals("size", module.parameters().get(0).name());
        assertEquals(10.0, ((Expression.Literal) module.parameters().get(0).defaultValue().orElseThrow()).value());
        assertEquals("center", module.parameters().get(1).name());
        assertEquals(false, ((Expression.Literal) module.parameters().get(1).defaultValue().orElseThrow()).value());

        assertEquals(1, module.body().size());
        var cube = assertInstanceOf(AstNode.Primitive.class, module.body().get(0));
        assertEquals(PrimitiveKind.CUBE, cube.kind());
        assertEquals("size", ((Expression.Identifier) cube.argument("size").orElseThrow()).name());
        assertEquals("center", ((Expression.Identifier) cube.argument("center").orElseThrow()).name());
        assertTrue(handler.diagnostics().isEmpty());
    }

    @Test
    void visitModuleDefinition_parameterCount_matchesDeclarationOrder() {
        var module = assertInstanceOf(AstNode.ModuleDefinition.class, single("module m(c, a, d = 1, b) {}"));

        assertEquals(List.of("c", "a", "d", "b"), module.parameters().stream().map(p -> p.name()).toList());
        assertTrue(module.parameters().get(0).defaultValue().isEmpty());
        assertTrue(module.body().isEmpty());
    }

    @Test
    void visitModuleDefinition_withoutNameField_recoversNameWithoutLocation() {
        var node = CstNode.branch(MODULE_DEFINITION,
                                  List.of(CstNode.token("module"),
                                          CstNode.leaf(IDENTIFIER, "box"),
                                          CstNode.branch(PARAMETER_LIST, List.of(CstNode.token("("), CstNode.token(")")))
                                                 .withField("parameters"),
                                          CstNode.branch(STATEMENT, List.of(CstNode.token(";"))).withField("body")));

        var module = assertInstanceOf(AstNode.ModuleDefinition.class, new ModuleVisitor(handler).visitModuleDefinition(node));

        assertEquals("box", module.name().name());
        assertTrue(module.name().location().isEmpty());
        assertTrue(module.location().isPresent());
        assertThat(handler.diagnostics()).singleElement()
                                         .extracting(ParseError::severity)
                                         .isEqualTo(ParseError.Severity.WARNING);
    }

    @Test
    void visitModuleDefinition_withoutAnyName_returnsErrorNode() {
        var node = CstNode.branch(MODULE_DEFINITION, List.of(CstNode.token("module"), CstNode.token("(")));

        var error = assertInstanceOf(ErrorNode.class, new ModuleVisitor(handler).visitModuleDefinition(node));

        assertEquals(ErrorCode.MISSING_CHILD_NODE, error.errorCode());
    }

    // === Instantiations ===

    @Test
    void visitModuleInstantiation_userModule_keepsArgumentsAndChildren() {
        var call = assertInstanceOf(AstNode.ModuleInstantiation.class, single("#gear(12, pitch = 2) { sphere(1); cube(2); }"));

        assertEquals("gear", call.name());
        assertEquals(Modifier.HIGHLIGHT, call.modifier().orElseThrow());
        assertEquals(2, call.arguments().size());
        assertEquals(2, call.children().size());
        assertEquals(PrimitiveKind.SPHERE, ((AstNode.Primitive) call.children().get(0)).kind());
    }

    @Test
    void visitModuleInstantiation_standalone_acceptsAnyName() {
        var node = parseAndFind("anything(1);", MODULE_INSTANTIATION);

        var call = assertInstanceOf(AstNode.ModuleInstantiation.class, new ModuleVisitor(handler).visitModuleInstantiation(node));

        assertEquals("anything", call.name());
        assertTrue(call.children().isEmpty());
    }

    // === Include and use ===

    @Test
    void visitIncludeStatement_angleBrackets_stripsDelimiters() {
        var include = assertInstanceOf(AstNode.Include.class, single("include <lib/gears.scad>"));

        assertEquals("lib/gears.scad", include.path());
        assertEquals(AstNode.Include.Kind.INCLUDE, include.kind());
    }

    @Test
    void visitIncludeStatement_use_returnsUseKind() {
        var use = assertInstanceOf(AstNode.Include.class, single("use <shapes.scad>;"));

        assertEquals("use", use.type());
        assertEquals("shapes.scad", use.path());
    }
}
