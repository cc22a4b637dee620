package org.pragmatica.scad.parser;

import org.pragmatica.scad.tree.SourceSpan;

/**
 * Tokens produced by {@link OpenScadLexer}. Text is always the raw source slice.
 */
public sealed interface Token {
    SourceSpan span();

    String text();

    default int start() {
        return span().start().offset();
    }

    default int end() {
        return span().end().offset();
    }

    record Identifier(SourceSpan span, String text) implements Token {}

    record SpecialVariable(SourceSpan span, String text) implements Token {}

    record Keyword(SourceSpan span, String text) implements Token {}

    record Number(SourceSpan span, String text) implements Token {}

    /**
     * Double-quoted string, quotes included.
     */
    record StringLiteral(SourceSpan span, String text) implements Token {}

    /**
     * {@code <path>} after include or use, brackets included.
     */
    record Path(SourceSpan span, String text) implements Token {}

    record Punct(SourceSpan span, String text) implements Token {}

    record Comment(SourceSpan span, String text) implements Token {}

    record Invalid(SourceSpan span, String text, String message) implements Token {}

    record Eof(SourceSpan span) implements Token {
        @Override
        public String text() {
            return "";
        }
    }
}
