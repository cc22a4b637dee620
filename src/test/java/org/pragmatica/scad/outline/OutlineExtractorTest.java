package org.pragmatica.scad.outline;

import org.junit.jupiter.api.Test;
import org.pragmatica.scad.outline.OutlineSymbol.Kind;
import org.pragmatica.scad.tree.CstNode;
import org.pragmatica.scad.tree.NodeTypes;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.pragmatica.scad.CstFixtures.parse;

class OutlineExtractorTest {

    @Test
    void extract_topLevelDeclarations_inSourceOrder() {
        var symbols = OutlineExtractor.extract(parse("""
            width = 10;
            function area(w) = w * w;
            module plate() { cube(width); }
            plate();
            """));

        assertThat(symbols).extracting(OutlineSymbol::name).containsExactly("width", "area", "plate");
        assertThat(symbols).extracting(OutlineSymbol::kind).containsExactly(Kind.VARIABLE, Kind.FUNCTION, Kind.MODULE);
    }

    @Test
    void extract_moduleBody_producesNestedSymbols() {
        var symbols = OutlineExtractor.extract(parse("module outer() { r = 2; module inner() {} function f() = r; }"));

        var outer = symbols.get(0);
        assertEquals(1, symbols.size());
        assertThat(outer.children()).extracting(OutlineSymbol::name).containsExactly("r", "inner", "f");
    }

    @Test
    void extract_selectionRange_coversNameOnly() {
        var symbol = OutlineExtractor.extract(parse("module gear(teeth) {}")).get(0);

        assertEquals(0, symbol.range().start().offset());
        var selection = symbol.selectionRange().orElseThrow();
        assertEquals(7, selection.start().offset());
        assertEquals(11, selection.end().offset());
    }

    @Test
    void extract_bareBlock_isTraversed() {
        var symbols = OutlineExtractor.extract(parse("{ a = 1; }"));

        assertThat(symbols).extracting(OutlineSymbol::name).containsExactly("a");
    }

    @Test
    void extract_nameRecoveredFromText_omitsSelectionRange() {
        var definition = CstNode.branch(NodeTypes.FUNCTION_DEFINITION,
                                        List.of(CstNode.token("function"), CstNode.leaf(NodeTypes.IDENTIFIER, "g"),
                                                CstNode.token("("), CstNode.token(")")));
        var root = CstNode.branch(NodeTypes.SOURCE_FILE, List.of(definition));

        var symbol = OutlineExtractor.extract(root).get(0);

        assertEquals("g", symbol.name());
        assertTrue(symbol.selectionRange().isEmpty());
        assertNotNull(symbol.range());
    }

    @Test
    void extract_unnamedDefinition_isSkipped() {
        var symbols = OutlineExtractor.extract(parse("module (x) {}"));

        assertTrue(symbols.isEmpty());
    }
}
