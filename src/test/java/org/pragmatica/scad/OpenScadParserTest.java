package org.pragmatica.scad;

import org.junit.jupiter.api.Test;
import org.pragmatica.scad.ast.AstNode;
import org.pragmatica.scad.ast.ErrorNode;
import org.pragmatica.scad.error.ErrorCode;
import org.pragmatica.scad.error.ParseError;
import org.pragmatica.scad.error.ParserException;
import org.pragmatica.scad.outline.OutlineSymbol;
import org.pragmatica.scad.query.QueryCache;
import org.pragmatica.scad.tree.NodeTypes;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests: source text to {@link org.pragmatica.scad.parser.ParseResult}.
 */
class OpenScadParserTest {

    // === Success verdict ===

    @Test
    void parse_validProgram_succeeds() {
        var result = OpenScadParser.create().parse("""
            // plate with holes
            use <utils.scad>
            thickness = 2;
            module plate(w = 20) {
                difference() {
                    cube([w, w, thickness]);
                    for (x = [5:10:15]) translate([x, 5, -1]) cylinder(h = thickness + 2, r = 1);
                }
            }
            plate();
            echo("done", thickness);
            """);

        assertTrue(result.success(), () -> result.formatErrors("plate.scad"));
        assertFalse(result.hasErrors());
        assertThat(result.ast()).extracting(AstNode::type)
                                .containsExactly("use", "assignment", "module_definition", "module_instantiation", "echo");
    }

    @Test
    void parse_syntaxError_failsWithCstErrors() {
        var result = OpenScadParser.create().parse("cube(1)\nx = 2;");

        assertFalse(result.success());
        assertThat(result.errors()).extracting(ParseError::message).contains("Missing ';'");
        assertEquals(2, result.ast().size());
    }

    @Test
    void parse_constructionError_failsWithErrorNodeInAst() {
        var result = OpenScadParser.create().parse("for (i = [0:if]) cube(i);");

        assertFalse(result.success());
        var loop = assertInstanceOf(AstNode.ForLoop.class, result.ast().get(0));
        var error = assertInstanceOf(ErrorNode.class, loop.variables().get(0).range());
        assertEquals(ErrorCode.E211_INVALID_SYNTAX_IN_RANGE_END, error.errorCode());
        assertTrue(result.errorCount() >= 2);
    }

    @Test
    void parse_handlerDiagnosticsOnly_stillFails() {
        var result = OpenScadParser.create().parse("let (1) cube(1);");

        assertFalse(result.tree().hasErrors());
        assertFalse(result.success());
        assertThat(result.errors()).extracting(ParseError::severity).containsExactly(ParseError.Severity.WARNING);
        assertInstanceOf(AstNode.Let.class, result.ast().get(0));
    }

    @Test
    void parse_rangeInsideTernary_succeeds() {
        var result = OpenScadParser.create().parse("x = [0:1] ? 1 : 2; y = let(a = 1) a;");

        assertTrue(result.success(), () -> result.formatErrors("x.scad"));
    }

    @Test
    void parse_topLevelErrorNode_listedInErrorNodes() {
        var result = OpenScadParser.create().parse("module (a) {}");

        assertThat(result.errorNodes()).extracting(ErrorNode::errorCode).containsExactly(ErrorCode.MISSING_CHILD_NODE);
    }

    @Test
    void parse_errorsAreFormattedWithLocation() {
        var result = OpenScadParser.create().parse("cube(1);\nsphere(2)");

        assertThat(result.formatErrors("model.scad")).contains("model.scad:2:").contains("Missing ';'");
    }

    // === Parse isolation ===

    @Test
    void parse_twice_doesNotCarryDiagnostics() {
        var parser = OpenScadParser.create();

        assertFalse(parser.parse("x = [:1];").success());
        assertTrue(parser.parse("x = [0:1];").success());
    }

    @Test
    void parse_sameSourceTwice_yieldsEqualAst() {
        var parser = OpenScadParser.create();
        var source = "module m(a = [1, 2]) { let (b = a[0]) rotate(b) children(); } m();";

        assertEquals(parser.parseAst(source), parser.parseAst(source));
    }

    // === Queries and outline ===

    @Test
    void query_beforeParse_throws() {
        var parser = OpenScadParser.create();

        assertThatThrownBy(parser::query).isInstanceOf(ParserException.class);
        assertThatThrownBy(parser::outline).isInstanceOf(ParserException.class);
        assertTrue(parser.lastTree().isEmpty());
    }

    @Test
    void query_afterParse_searchesLatestTree() {
        var parser = OpenScadParser.create();
        parser.parse("cube(1); sphere(1);");
        parser.parse("circle(1);");

        var nodes = parser.query().findNodesByType(NodeTypes.MODULE_INSTANTIATION);

        assertEquals(1, nodes.size());
        assertEquals("circle(1);", nodes.get(0).text());
    }

    @Test
    void query_reparse_startsWithEmptyCache() {
        var parser = OpenScadParser.create();
        parser.parse("cube(1);");
        parser.query().findNodesByType(NodeTypes.MODULE_INSTANTIATION);
        parser.query().findNodesByType(NodeTypes.MODULE_INSTANTIATION);
        assertEquals(new QueryCache.Stats(1, 1, 1), parser.query().cacheStats());

        parser.parse("cube(2);");

        assertEquals(new QueryCache.Stats(0, 0, 0), parser.query().cacheStats());
    }

    @Test
    void query_afterParseCstOnly_isAvailable() {
        var parser = OpenScadParser.create();
        parser.parseCst("function f() = 1;");

        assertEquals(1, parser.query().findNodesByType(NodeTypes.FUNCTION_DEFINITION).size());
    }

    @Test
    void outline_afterParse_listsDeclarations() {
        var parser = OpenScadParser.create();
        parser.parse("a = 1; module m() {}");

        assertThat(parser.outline()).extracting(OutlineSymbol::name).containsExactly("a", "m");
    }

    // === Configuration ===

    @Test
    void builder_appliesOptions() {
        var parser = OpenScadParser.builder()
                                   .captureComments(false)
                                   .minLogSeverity(ParseError.Severity.ERROR)
                                   .queryCache(false)
                                   .build();

        var tree = parser.parseCst("// note\ncube(1);");

        assertFalse(parser.config().captureComments());
        assertFalse(parser.config().queryCacheEnabled());
        assertEquals(1, tree.root().childCount());
        parser.query().findNodesByType(NodeTypes.MODULE_INSTANTIATION);
        parser.query().findNodesByType(NodeTypes.MODULE_INSTANTIATION);
        assertEquals(0, parser.query().cacheStats().hits());
    }

    @Test
    void builder_queryCacheSize_boundsCachedResults() {
        var parser = OpenScadParser.builder()
                                   .queryCacheSize(1)
                                   .build();
        parser.parseCst("cube(1); sphere(2);");

        parser.query().findNodesByType(NodeTypes.MODULE_INSTANTIATION);
        parser.query().findNodesByType(NodeTypes.MODULE_DEFINITION);
        parser.query().findNodesByType(NodeTypes.MODULE_INSTANTIATION);

        assertEquals(1, parser.config().queryCacheSize());
        assertEquals(new QueryCache.Stats(0, 3, 1), parser.query().cacheStats());
    }
}
