package org.pragmatica.scad.tree;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.pragmatica.scad.CstFixtures.parseAndFind;

class FieldReaderTest {

    @Test
    void definitionName_structuredField_isNotDegraded() {
        var name = FieldReader.definitionName(parseAndFind("function f(x) = x;", NodeTypes.FUNCTION_DEFINITION), "function");

        assertEquals("f", name.text());
        assertFalse(name.degraded());
        assertEquals(9, name.node().startIndex());
    }

    @Test
    void definitionName_withoutField_readsTextBetweenKeywordAndParenthesis() {
        var node = CstNode.branch(NodeTypes.MODULE_DEFINITION,
                                  List.of(CstNode.token("module"), CstNode.leaf(NodeTypes.IDENTIFIER, "bracket_2"),
                                          CstNode.token("(")));

        var name = FieldReader.definitionName(node, "module");

        assertEquals("bracket_2", name.text());
        assertTrue(name.degraded());
        assertNull(name.node());
    }

    @Test
    void definitionName_unrecoverable_returnsNull() {
        var node = CstNode.branch(NodeTypes.MODULE_DEFINITION, List.of(CstNode.token("module"), CstNode.token("(")));

        assertNull(FieldReader.definitionName(node, "module"));
        assertNull(FieldReader.definitionName(CstNode.leaf(NodeTypes.IDENTIFIER, "x"), "module"));
    }

    @Test
    void firstNamed_skipsPunctuationAndComments() {
        var node = CstNode.branch(NodeTypes.BLOCK,
                                  List.of(CstNode.token("{"), CstNode.leaf(NodeTypes.COMMENT, "// c"),
                                          CstNode.leaf(NodeTypes.NUMBER, "1"), CstNode.token("}")));

        assertEquals(NodeTypes.NUMBER, FieldReader.firstNamed(node).type());
        assertNull(FieldReader.firstNamed(null));
    }

    @Test
    void text_missingField_returnsNull() {
        var node = CstNode.branch(NodeTypes.ASSIGNMENT_STATEMENT,
                                  List.of(CstNode.missing(NodeTypes.IDENTIFIER).withField("name")));

        assertNull(FieldReader.text(node, "name"));
        assertNull(FieldReader.text(node, "value"));
    }

    @Test
    void fieldOrPositional_prefersField() {
        var argument = CstNode.branch(NodeTypes.ARGUMENT,
                                      List.of(CstNode.leaf(NodeTypes.IDENTIFIER, "r").withField("name"),
                                              CstNode.token("="),
                                              CstNode.leaf(NodeTypes.NUMBER, "5").withField("value")));

        assertEquals("5", FieldReader.fieldOrPositional(argument, "value", 0).text());
    }

    @Test
    void fieldOrPositional_withoutField_countsNamedChildrenSkippingComments() {
        var declaration = CstNode.branch(NodeTypes.PARAMETER_DECLARATION,
                                         List.of(CstNode.leaf(NodeTypes.IDENTIFIER, "r"),
                                                 CstNode.leaf(NodeTypes.COMMENT, "/* radius */"),
                                                 CstNode.token("="),
                                                 CstNode.leaf(NodeTypes.NUMBER, "5")));

        assertEquals("r", FieldReader.fieldOrPositional(declaration, "name", 0).text());
        assertEquals("5", FieldReader.fieldOrPositional(declaration, "value", 1).text());
        assertNull(FieldReader.fieldOrPositional(declaration, "other", 2));
        assertNull(FieldReader.fieldOrPositional(null, "value", 0));
    }
}
