package org.pragmatica.scad.ast;

import java.util.Arrays;
import java.util.Optional;

/**
 * Debug modifier characters that may prefix a module instantiation.
 */
public enum Modifier {
    DISABLE('*'),
    SHOW_ONLY('!'),
    HIGHLIGHT('#'),
    TRANSPARENT('%');

    private final char symbol;

    Modifier(char symbol) {
        this.symbol = symbol;
    }

    public char symbol() {
        return symbol;
    }

    public static Optional<Modifier> fromSymbol(String text) {
        if (text == null || text.length() != 1) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                     .filter(modifier -> modifier.symbol == text.charAt(0))
                     .findFirst();
    }
}
