package org.pragmatica.scad.parser;

import org.pragmatica.scad.tree.SourceLocation;
import org.pragmatica.scad.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Lexer for OpenSCAD source text. Positions are zero-based.
 */
public final class OpenScadLexer {
    private static final int MAX_INPUT_SIZE = 10_000_000;

    static final Set<String> KEYWORDS = Set.of(
        "module", "function", "if", "else", "for", "let", "each", "include", "use",
        "true", "false", "undef", "echo", "assert");

    private static final List<String> TWO_CHAR_OPERATORS = List.of("==", "!=", "<=", ">=", "&&", "||");
    private static final String SINGLE_CHAR_PUNCT = "()[]{};,=:?+-*/%^!<>.#";

    private final String input;
    private int pos;
    private int line;
    private int column;
    private Token lastSignificant;

    private OpenScadLexer(String input) {
        this.input = input;
    }

    public static List<Token> tokenize(String input) {
        if (input.length() > MAX_INPUT_SIZE) {
            throw new IllegalArgumentException("Input exceeds maximum size of " + MAX_INPUT_SIZE + " characters");
        }
        return new OpenScadLexer(input).tokenizeAll();
    }

    private List<Token> tokenizeAll() {
        var tokens = new ArrayList<Token>();
        while (true) {
            skipWhitespace();
            if (isAtEnd()) {
                break;
            }
            var token = nextToken();
            tokens.add(token);
            if (!(token instanceof Token.Comment)) {
                lastSignificant = token;
            }
        }
        tokens.add(new Token.Eof(SourceSpan.at(currentLocation())));
        return tokens;
    }

    private Token nextToken() {
        var start = currentLocation();
        char c = peek();

        if (c == '/' && peekNext() == '/') {
            return scanLineComment(start);
        }
        if (c == '/' && peekNext() == '*') {
            return scanBlockComment(start);
        }
        if (c == '<' && afterIncludeKeyword()) {
            return scanPath(start);
        }
        if (c == '$' || isIdentifierStart(c)) {
            return scanWord(start);
        }
        if (isDigit(c) || (c == '.' && isDigit(peekNext()))) {
            return scanNumber(start);
        }
        if (c == '"') {
            return scanString(start);
        }
        return scanPunct(start);
    }

    private Token scanLineComment(SourceLocation start) {
        while (!isAtEnd() && peek() != '\n') {
            advance();
        }
        return new Token.Comment(span(start), text(start));
    }

    private Token scanBlockComment(SourceLocation start) {
        advance();
        advance();
        while (!isAtEnd() && !(peek() == '*' && peekNext() == '/')) {
            advance();
        }
        if (isAtEnd()) {
            return new Token.Invalid(span(start), text(start), "Unterminated block comment");
        }
        advance();
        advance();
        return new Token.Comment(span(start), text(start));
    }

    private Token scanPath(SourceLocation start) {
        advance();
        while (!isAtEnd() && peek() != '>' && peek() != '\n') {
            advance();
        }
        if (isAtEnd() || peek() != '>') {
            return new Token.Invalid(span(start), text(start), "Unterminated include path");
        }
        advance();
        return new Token.Path(span(start), text(start));
    }

    private Token scanWord(SourceLocation start) {
        boolean special = peek() == '$';
        advance();
        while (!isAtEnd() && isIdentifierPart(peek())) {
            advance();
        }
        var word = text(start);
        if (special) {
            return new Token.SpecialVariable(span(start), word);
        }
        if (KEYWORDS.contains(word)) {
            return new Token.Keyword(span(start), word);
        }
        return new Token.Identifier(span(start), word);
    }

    private Token scanNumber(SourceLocation start) {
        while (!isAtEnd() && isDigit(peek())) {
            advance();
        }
        if (!isAtEnd() && peek() == '.' && isDigit(peekNext())) {
            advance();
            while (!isAtEnd() && isDigit(peek())) {
                advance();
            }
        } else if (!isAtEnd() && peek() == '.' && !isIdentifierStart(peekNext())) {
            advance();
        }
        if (!isAtEnd() && (peek() == 'e' || peek() == 'E')) {
            int save = pos;
            int saveLine = line;
            int saveColumn = column;
            advance();
            if (!isAtEnd() && (peek() == '+' || peek() == '-')) {
                advance();
            }
            if (!isAtEnd() && isDigit(peek())) {
                while (!isAtEnd() && isDigit(peek())) {
                    advance();
                }
            } else {
                pos = save;
                line = saveLine;
                column = saveColumn;
            }
        }
        return new Token.Number(span(start), text(start));
    }

    private Token scanString(SourceLocation start) {
        advance();
        while (!isAtEnd() && peek() != '"') {
            if (peek() == '\\' && pos + 1 < input.length()) {
                advance();
            }
            advance();
        }
        if (isAtEnd()) {
            return new Token.Invalid(span(start), text(start), "Unterminated string literal");
        }
        advance();
        return new Token.StringLiteral(span(start), text(start));
    }

    private Token scanPunct(SourceLocation start) {
        for (var op : TWO_CHAR_OPERATORS) {
            if (input.startsWith(op, pos)) {
                advance();
                advance();
                return new Token.Punct(span(start), op);
            }
        }
        char c = advance();
        if (SINGLE_CHAR_PUNCT.indexOf(c) >= 0) {
            return new Token.Punct(span(start), String.valueOf(c));
        }
        return new Token.Invalid(span(start), String.valueOf(c), "Unexpected character '" + c + "'");
    }

    private boolean afterIncludeKeyword() {
        return lastSignificant instanceof Token.Keyword keyword
               && (keyword.text().equals("include") || keyword.text().equals("use"));
    }

    private void skipWhitespace() {
        while (!isAtEnd() && Character.isWhitespace(peek())) {
            advance();
        }
    }

    private boolean isAtEnd() {
        return pos >= input.length();
    }

    private char peek() {
        return input.charAt(pos);
    }

    private char peekNext() {
        return pos + 1 < input.length() ? input.charAt(pos + 1) : '\0';
    }

    private char advance() {
        char c = input.charAt(pos++);
        if (c == '\n') {
            line++;
            column = 0;
        } else {
            column++;
        }
        return c;
    }

    private SourceLocation currentLocation() {
        return SourceLocation.at(line, column, pos);
    }

    private SourceSpan span(SourceLocation start) {
        return SourceSpan.of(start, currentLocation());
    }

    private String text(SourceLocation start) {
        return input.substring(start.offset(), pos);
    }

    private static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
