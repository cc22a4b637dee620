package org.pragmatica.scad.parser;

import org.junit.jupiter.api.Test;
import org.pragmatica.scad.tree.SyntaxNode;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.pragmatica.scad.CstFixtures.find;
import static org.pragmatica.scad.tree.NodeTypes.*;

/**
 * Tests for the tree shapes and error recovery of the reference CST producer.
 */
class CstParserTest {

    // === Tree shapes ===

    @Test
    void parse_validSource_hasNoErrors() {
        var tree = CstParser.parse("""
            include <lib.scad>
            $fn = 32;
            module m(a, b = 2) { translate([a, 0]) cube(b); }
            function f(x) = x > 0 ? x : -x;
            for (i = [0:2:10], j = [1, 2]) m(i, j);
            if (a) m(1); else { m(2); }
            """);

        assertFalse(tree.hasErrors(), () -> tree.syntaxErrors().toString());
        assertEquals(SOURCE_FILE, tree.root().type());
        assertEquals(6, tree.root().childCount());
    }

    @Test
    void parse_moduleDefinition_exposesFields() {
        var definition = find(CstParser.parse("module m(a, b = 2) cube(a);").root(), MODULE_DEFINITION);

        assertEquals("m", definition.childForFieldName("name").text());
        assertEquals(PARAMETER_LIST, definition.childForFieldName("parameters").type());
        assertEquals(STATEMENT, definition.childForFieldName("body").type());
    }

    @Test
    void parse_instantiation_exposesModifierNameAndBody() {
        var call = find(CstParser.parse("!rotate(45) square(2);").root(), MODULE_INSTANTIATION);

        assertEquals("!", call.childForFieldName("modifier").text());
        assertEquals("rotate", call.childForFieldName("name").text());
        assertNotNull(call.childForFieldName("body"));
    }

    @Test
    void parse_rangeWithStep_fillsAllBoundFields() {
        var range = find(CstParser.parse("x = [0:0.5:2];").root(), RANGE_EXPRESSION);

        assertEquals("0", range.childForFieldName("start").text());
        assertEquals("0.5", range.childForFieldName("step").text());
        assertEquals("2", range.childForFieldName("end").text());
    }

    @Test
    void parse_binaryExpression_storesOperatorField() {
        var binary = find(CstParser.parse("x = a == b;").root(), BINARY_EXPRESSION);

        assertEquals("==", binary.childForFieldName("operator").text());
        assertFalse(binary.childForFieldName("operator").isNamed());
    }

    @Test
    void parse_comments_keptWhenCaptureEnabled() {
        var source = "// header\ncube(1); /* trailing */";

        var captured = CstParser.parse(source).root();
        var dropped = CstParser.parse(source, new ParserConfig(false, ParserConfig.DEFAULT.minLogSeverity(), true, 8)).root();

        assertThat(captured.children()).extracting(SyntaxNode::type).containsExactly(COMMENT, STATEMENT, COMMENT);
        assertThat(dropped.children()).extracting(SyntaxNode::type).containsExactly(STATEMENT);
    }

    // === Recovery ===

    @Test
    void parse_missingSemicolon_insertsMissingLeaf() {
        var tree = CstParser.parse("cube(1)");

        assertTrue(tree.hasErrors());
        assertTrue(tree.root().hasError());
        assertThat(tree.syntaxErrors()).extracting(error -> error.message()).contains("Missing ';'");
    }

    @Test
    void parse_garbageStatement_becomesErrorNodeAndParsingResumes() {
        var tree = CstParser.parse("cube(1); ) ) ; sphere(2);");

        var root = tree.root();
        assertEquals(3, root.childCount());
        assertTrue(root.child(1).isError());
        assertEquals(MODULE_INSTANTIATION, root.child(2).child(0).type());
        assertEquals(1, tree.syntaxErrors().size());
    }

    @Test
    void parse_missingRangeEnd_insertsMissingIdentifier() {
        var range = find(CstParser.parse("x = [0:];").root(), RANGE_EXPRESSION);

        var end = range.childForFieldName("end");
        assertTrue(end.isMissing());
        assertEquals(IDENTIFIER, end.type());
    }

    @Test
    void parse_reservedKeywordInExpression_becomesIdentifierAndError() {
        var tree = CstParser.parse("x = [0:if];");

        var end = find(tree.root(), RANGE_EXPRESSION).childForFieldName("end");
        assertEquals(IDENTIFIER, end.type());
        assertEquals("if", end.text());
        assertEquals(1, tree.syntaxErrors().size());
    }

    @Test
    void parse_unclosedArguments_skipsToCloser() {
        var tree = CstParser.parse("cube(1 2);");

        var arguments = find(tree.root(), ARGUMENT_LIST);
        assertTrue(arguments.hasError());
        assertEquals(STATEMENT, tree.root().child(0).type());
    }

    @Test
    void parse_emptySource_returnsEmptyRoot() {
        var tree = CstParser.parse("");

        assertEquals(0, tree.root().childCount());
        assertFalse(tree.hasErrors());
    }

    @Test
    void parse_positions_matchSource() {
        var source = "a = 1;\nb = 22;";
        var tree = CstParser.parse(source);

        var second = tree.root().child(1);
        assertEquals(1, second.startPosition().row());
        assertEquals("b = 22;", source.substring(second.startIndex(), second.endIndex()));
    }
}
