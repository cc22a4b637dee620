package org.pragmatica.scad.parser;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class OpenScadLexerTest {

    private static List<String> texts(String input) {
        return OpenScadLexer.tokenize(input).stream()
                            .filter(token -> !(token instanceof Token.Eof))
                            .map(Token::text)
                            .toList();
    }

    @Test
    void tokenize_statement_splitsTokens() {
        assertEquals(List.of("translate", "(", "[", "1", ",", "-", "2.5", "]", ")", "cube", "(", "1e3", ")", ";"),
                     texts("translate([1, -2.5]) cube(1e3);"));
    }

    @Test
    void tokenize_twoCharOperators_areSingleTokens() {
        assertEquals(List.of("a", "<=", "b", "&&", "c", "!=", "d", "||", "!", "e"), texts("a <= b && c != d || !e"));
    }

    @Test
    void tokenize_keywordsAndSpecialVariables_areClassified() {
        var tokens = OpenScadLexer.tokenize("module $fn each width");

        assertInstanceOf(Token.Keyword.class, tokens.get(0));
        assertInstanceOf(Token.SpecialVariable.class, tokens.get(1));
        assertInstanceOf(Token.Keyword.class, tokens.get(2));
        assertInstanceOf(Token.Identifier.class, tokens.get(3));
        assertInstanceOf(Token.Eof.class, tokens.get(4));
    }

    @Test
    void tokenize_includePath_isSingleToken() {
        var tokens = OpenScadLexer.tokenize("include <MCAD/gears.scad>");

        var path = assertInstanceOf(Token.Path.class, tokens.get(1));
        assertEquals("<MCAD/gears.scad>", path.text());
    }

    @Test
    void tokenize_lessThanOutsideInclude_isOperator() {
        assertInstanceOf(Token.Punct.class, OpenScadLexer.tokenize("a < b").get(1));
    }

    @Test
    void tokenize_comments_areKept() {
        var tokens = OpenScadLexer.tokenize("// line\n/* block */ x");

        assertThat(tokens).filteredOn(Token.Comment.class::isInstance)
                          .extracting(Token::text)
                          .containsExactly("// line", "/* block */");
    }

    @Test
    void tokenize_stringWithEscapedQuote_isSingleToken() {
        var tokens = OpenScadLexer.tokenize("\"say \\\"hi\\\"\"");

        assertInstanceOf(Token.StringLiteral.class, tokens.get(0));
        assertEquals(2, tokens.size());
    }

    @Test
    void tokenize_unterminatedString_returnsInvalidToken() {
        var invalid = assertInstanceOf(Token.Invalid.class, OpenScadLexer.tokenize("\"open").get(0));

        assertThat(invalid.message()).contains("Unterminated");
    }

    @Test
    void tokenize_positions_areZeroBased() {
        var tokens = OpenScadLexer.tokenize("a\n  b");

        var b = tokens.get(1);
        assertEquals(1, b.span().start().line());
        assertEquals(2, b.span().start().column());
        assertEquals(4, b.start());
    }
}
