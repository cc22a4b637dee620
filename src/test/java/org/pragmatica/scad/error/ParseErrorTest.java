package org.pragmatica.scad.error;

import org.junit.jupiter.api.Test;
import org.pragmatica.scad.tree.SourceLocation;
import org.pragmatica.scad.tree.SourceSpan;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class ParseErrorTest {

    private static final String SOURCE = "cube(1);\nsphere(2)";
    private static final SourceSpan MISSING_SEMICOLON = SourceSpan.at(SourceLocation.at(1, 9, 18));

    @Test
    void format_showsOneBasedLocationAndCaret() {
        var error = ParseError.error("syntax", "Missing ';'", MISSING_SEMICOLON);

        var formatted = error.format(SOURCE, "model.scad");

        assertThat(formatted).startsWith("error[syntax]: Missing ';'")
                             .contains("--> model.scad:2:10")
                             .contains("2 | sphere(2)")
                             .contains("^");
    }

    @Test
    void format_includesNotes() {
        var error = ParseError.warning("Unused value", MISSING_SEMICOLON).withHelp("remove it");

        assertThat(error.format(SOURCE, null)).contains("= help: remove it").startsWith("warning: ");
    }

    @Test
    void lineAndColumn_areZeroBased() {
        var error = ParseError.error("x", MISSING_SEMICOLON);

        assertEquals(1, error.line());
        assertEquals(9, error.column());
        assertTrue(error.isError());
    }

    @Test
    void formatSimple_isSingleLine() {
        var error = ParseError.warning("careful", MISSING_SEMICOLON);

        assertEquals("input:2:10: warning: careful", error.formatSimple());
    }
}
