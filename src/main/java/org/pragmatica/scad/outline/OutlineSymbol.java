package org.pragmatica.scad.outline;

import org.pragmatica.scad.tree.SourceSpan;

import java.util.List;
import java.util.Optional;

/**
 * Entry of a document outline.
 *
 * @param range          span of the whole declaration
 * @param selectionRange span of the declared name; empty when the name was recovered from raw text
 * @param children       symbols declared inside a module body
 */
public record OutlineSymbol(String name, Kind kind, SourceSpan range, Optional<SourceSpan> selectionRange,
                            List<OutlineSymbol> children) {

    public enum Kind {
        MODULE,
        FUNCTION,
        VARIABLE
    }

    public OutlineSymbol {
        children = List.copyOf(children);
    }
}
