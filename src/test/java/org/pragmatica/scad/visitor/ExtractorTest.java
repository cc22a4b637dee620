package org.pragmatica.scad.visitor;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.pragmatica.scad.ast.ErrorNode;
import org.pragmatica.scad.ast.Expression;
import org.pragmatica.scad.error.CollectingErrorHandler;
import org.pragmatica.scad.error.ErrorCode;
import org.pragmatica.scad.tree.CstNode;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.pragmatica.scad.CstFixtures.parseAndFind;
import static org.pragmatica.scad.tree.NodeTypes.*;

/**
 * Argument and parameter extraction, for parsed trees and for trees that lack field names.
 */
class ExtractorTest {

    private CollectingErrorHandler handler;
    private ExpressionVisitor expressions;

    @BeforeEach
    void setUp() {
        handler = new CollectingErrorHandler();
        expressions = new ExpressionVisitor(handler);
    }

    // === Arguments ===

    @Test
    void arguments_mixedNamedAndPositional_keepSourceOrder() {
        var list = parseAndFind("cube(10, center = true);", ARGUMENT_LIST);

        var arguments = ArgumentExtractor.extract(list, expressions, handler);

        assertEquals(2, arguments.size());
        assertEquals(Optional.empty(), arguments.get(0).name());
        assertEquals(10.0, ((Expression.Literal) arguments.get(0).value()).value());
        assertEquals(Optional.of("center"), arguments.get(1).name());
        assertEquals(true, ((Expression.Literal) arguments.get(1).value()).value());
        assertFalse(handler.hasDiagnostics());
    }

    @Test
    void arguments_namedWithoutValueField_readsValuePositionally() {
        var argument = CstNode.branch(ARGUMENT,
                                      List.of(CstNode.leaf(IDENTIFIER, "r").withField("name"),
                                              CstNode.token("="),
                                              CstNode.leaf(NUMBER, "3")));
        var list = CstNode.branch(ARGUMENT_LIST, List.of(CstNode.token("("), argument, CstNode.token(")")));

        var arguments = ArgumentExtractor.extract(list, expressions, handler);

        assertEquals(Optional.of("r"), arguments.get(0).name());
        assertEquals(3.0, ((Expression.Literal) arguments.get(0).value()).value());
    }

    @Test
    void arguments_emptyArgument_becomesErrorNode() {
        var list = CstNode.branch(ARGUMENT_LIST,
                                  List.of(CstNode.token("("), CstNode.branch(ARGUMENT, List.of()), CstNode.token(")")));

        var arguments = ArgumentExtractor.extract(list, expressions, handler);

        var error = assertInstanceOf(ErrorNode.class, arguments.get(0).value());
        assertEquals(ErrorCode.MISSING_CHILD_NODE, error.errorCode());
        assertEquals(1, handler.errorCount());
    }

    // === Parameters ===

    @Test
    void parameters_parsedList_keepDefaults() {
        var list = parseAndFind("module m(a, b = 2) {}", PARAMETER_LIST);

        var parameters = ParameterExtractor.extract(list, expressions, handler);

        assertEquals("a", parameters.get(0).name());
        assertTrue(parameters.get(0).defaultValue().isEmpty());
        assertEquals("b", parameters.get(1).name());
        assertEquals(2.0, ((Expression.Literal) parameters.get(1).defaultValue().orElseThrow()).value());
    }

    @Test
    void parameters_declarationWithoutFields_readsNameAndDefaultPositionally() {
        var declaration = CstNode.branch(PARAMETER_DECLARATION,
                                         List.of(CstNode.leaf(IDENTIFIER, "size"),
                                                 CstNode.token("="),
                                                 CstNode.leaf(NUMBER, "4")));
        var list = CstNode.branch(PARAMETER_LIST, List.of(CstNode.token("("), declaration, CstNode.token(")")));

        var parameters = ParameterExtractor.extract(list, expressions, handler);

        assertThat(parameters).hasSize(1);
        assertEquals("size", parameters.get(0).name());
        assertEquals(4.0, ((Expression.Literal) parameters.get(0).defaultValue().orElseThrow()).value());
    }

    @Test
    void parameters_missingName_isSkippedWithWarning() {
        var declaration = CstNode.branch(PARAMETER_DECLARATION,
                                         List.of(CstNode.missing(IDENTIFIER).withField("name")));
        var list = CstNode.branch(PARAMETER_LIST, List.of(CstNode.token("("), declaration, CstNode.token(")")));

        assertTrue(ParameterExtractor.extract(list, expressions, handler).isEmpty());
        assertEquals(1, handler.diagnostics().size());
    }
}
